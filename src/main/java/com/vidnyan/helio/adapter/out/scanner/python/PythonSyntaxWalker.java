package com.vidnyan.helio.adapter.out.scanner.python;

import com.vidnyan.helio.application.port.out.SourceParseException;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses a Python module and reports imports, call bindings, decorated function declarations and
 * calls as an ordered list of {@link SyntaxEvent}s. Holds no state between walks.
 */
public final class PythonSyntaxWalker {

    private PythonSyntaxWalker() {
    }

    public static List<SyntaxEvent> walk(Path file, String content) throws SourceParseException {
        SyntaxErrors errors = new SyntaxErrors();
        Python3Lexer lexer = new Python3Lexer(CharStreams.fromString(content, file.toString()));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        Python3Parser parser = new Python3Parser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        Python3Parser.File_inputContext module = parser.file_input();
        if (errors.first != null) {
            throw new SourceParseException(file, errors.first);
        }

        EventCollector collector = new EventCollector();
        collector.visit(module);
        return collector.events;
    }

    private static final class SyntaxErrors extends BaseErrorListener {

        private String first;

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            if (first == null) {
                first = "line " + line + ":" + charPositionInLine + " " + msg;
            }
        }
    }

    private static final class EventCollector extends Python3ParserBaseVisitor<Void> {

        private final List<SyntaxEvent> events = new ArrayList<>();

        @Override
        public Void visitImport_name(Python3Parser.Import_nameContext ctx) {
            List<String> names = ctx.dotted_as_names().dotted_as_name().stream()
                    .map(name -> lower(name.dotted_name()))
                    .toList();
            events.add(new SyntaxEvent.ImportSeen(line(ctx), names));
            return null;
        }

        @Override
        public Void visitImport_from(Python3Parser.Import_fromContext ctx) {
            List<String> names = new ArrayList<>();
            if (ctx.dotted_name() != null) {
                names.add(lower(ctx.dotted_name()));
            }
            if (ctx.import_as_names() != null) {
                ctx.import_as_names().import_as_name().forEach(imported -> names.add(lower(imported.name(0))));
            }
            events.add(new SyntaxEvent.ImportSeen(line(ctx), List.copyOf(names)));
            return null;
        }

        @Override
        public Void visitDecorated(Python3Parser.DecoratedContext ctx) {
            Python3Parser.FuncdefContext function = ctx.funcdef() != null
                    ? ctx.funcdef()
                    : ctx.async_funcdef() != null ? ctx.async_funcdef().funcdef() : null;
            if (function == null) {
                return visit(ctx.classdef());
            }
            List<PyExpr> markers = ctx.decorators().decorator().stream()
                    .map(decorator -> PyExprBuilder.INSTANCE.visit(decorator.namedexpr_test()))
                    .toList();
            int line = ctx.async_funcdef() != null ? line(ctx.async_funcdef()) : line(function);
            events.add(new SyntaxEvent.DeclarationSeen(line, function.name().getText(), markers));
            return visit(function.block());
        }

        @Override
        public Void visitFuncdef(Python3Parser.FuncdefContext ctx) {
            return visit(ctx.block());
        }

        @Override
        public Void visitClassdef(Python3Parser.ClassdefContext ctx) {
            return visit(ctx.block());
        }

        /**
         * {@code x = y = Call(...)} or {@code x: T = Call(...)}; every target must be a plain name.
         */
        @Override
        public Void visitExpr_stmt(Python3Parser.Expr_stmtContext ctx) {
            List<Python3Parser.Testlist_star_exprContext> parts = ctx.testlist_star_expr();
            ParseTree value = null;
            if (ctx.annassign() != null && ctx.annassign().ASSIGN() != null) {
                value = ctx.annassign().testlist_star_expr();
            } else if (ctx.annassign() == null && ctx.augassign() == null && ctx.yield_expr().isEmpty()
                    && parts.size() > 1) {
                value = parts.get(parts.size() - 1);
            }

            if (value != null) {
                List<String> targets = new ArrayList<>();
                int targetCount = ctx.annassign() != null ? 1 : parts.size() - 1;
                for (int i = 0; i < targetCount; i++) {
                    PyExpr target = single(parts.get(i));
                    if (!(target instanceof PyExpr.Name name)) {
                        targets.clear();
                        break;
                    }
                    targets.add(name.id());
                }
                if (!targets.isEmpty() && single(value) instanceof PyExpr.Call call) {
                    events.add(new SyntaxEvent.BindingIntroduced(line(ctx), List.copyOf(targets), call));
                }
            }
            return visitChildren(ctx);
        }

        /**
         * Every call whose callee chain starts at a name, then the calls nested in its arguments.
         */
        @Override
        public Void visitAtom_expr(Python3Parser.Atom_exprContext ctx) {
            if (ctx.atom().name() != null && !ctx.trailer().isEmpty()) {
                collectCallChain(PyExprBuilder.INSTANCE.visit(ctx), line(ctx));
            }
            return visitChildren(ctx);
        }

        private void collectCallChain(PyExpr expr, int line) {
            if (expr instanceof PyExpr.Call call) {
                collectCallChain(call.func(), line);
                events.add(new SyntaxEvent.CallSeen(line, call));
            } else if (expr instanceof PyExpr.Attribute attribute) {
                collectCallChain(attribute.value(), line);
            }
        }

        // one expression without a trailing comma; a tuple is not a single value
        private static PyExpr single(ParseTree node) {
            if (node instanceof Python3Parser.Testlist_star_exprContext list
                    && list.getChildCount() == 1 && !list.namedexpr_test().isEmpty()) {
                return PyExprBuilder.INSTANCE.visit(list.namedexpr_test(0));
            }
            return new PyExpr.Opaque(node.getText());
        }

        private static String lower(ParseTree node) {
            return node.getText().toLowerCase(Locale.ROOT);
        }

        private static int line(ParserRuleContext ctx) {
            return ctx.getStart().getLine();
        }
    }
}
