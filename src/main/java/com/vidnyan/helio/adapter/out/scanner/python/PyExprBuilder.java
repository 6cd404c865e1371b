package com.vidnyan.helio.adapter.out.scanner.python;

import org.antlr.v4.runtime.tree.RuleNode;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Folds expression subtrees into the {@link PyExpr} shapes the route reducers read. Operators,
 * comprehensions, dict displays and anything else not modelled become {@link PyExpr.Opaque}.
 */
final class PyExprBuilder extends Python3ParserBaseVisitor<PyExpr> {

    static final PyExprBuilder INSTANCE = new PyExprBuilder();

    private PyExprBuilder() {
    }

    @Override
    protected PyExpr defaultResult() {
        return new PyExpr.Opaque("");
    }

    @Override
    public PyExpr visitChildren(RuleNode node) {
        return new PyExpr.Opaque(node.getText());
    }

    @Override
    public PyExpr visitNamedexpr_test(Python3Parser.Namedexpr_testContext ctx) {
        return ctx.WALRUS() == null ? visit(ctx.test(0)) : opaque(ctx);
    }

    @Override
    public PyExpr visitTest(Python3Parser.TestContext ctx) {
        return ctx.IF() == null && ctx.or_test().size() == 1 ? visit(ctx.or_test(0)) : opaque(ctx);
    }

    @Override
    public PyExpr visitOr_test(Python3Parser.Or_testContext ctx) {
        return ctx.and_test().size() == 1 ? visit(ctx.and_test(0)) : opaque(ctx);
    }

    @Override
    public PyExpr visitAnd_test(Python3Parser.And_testContext ctx) {
        return ctx.not_test().size() == 1 ? visit(ctx.not_test(0)) : opaque(ctx);
    }

    @Override
    public PyExpr visitNot_test(Python3Parser.Not_testContext ctx) {
        return ctx.comparison() != null ? visit(ctx.comparison()) : opaque(ctx);
    }

    @Override
    public PyExpr visitComparison(Python3Parser.ComparisonContext ctx) {
        return ctx.expr().size() == 1 ? visit(ctx.expr(0)) : opaque(ctx);
    }

    @Override
    public PyExpr visitExpr(Python3Parser.ExprContext ctx) {
        if (ctx.atom_expr() != null) {
            return visit(ctx.atom_expr());
        }
        // -N
        if (ctx.getChildCount() == 2 && ctx.MINUS().size() == 1 && ctx.expr().size() == 1) {
            PyExpr operand = visit(ctx.expr(0));
            if (operand instanceof PyExpr.Int number) {
                return integer(BigInteger.valueOf(number.value()).negate(), ctx);
            }
        }
        return opaque(ctx);
    }

    @Override
    public PyExpr visitAtom_expr(Python3Parser.Atom_exprContext ctx) {
        PyExpr expr = visit(ctx.atom());
        for (Python3Parser.TrailerContext trailer : ctx.trailer()) {
            if (trailer.name() != null) {
                expr = new PyExpr.Attribute(expr, trailer.name().getText());
            } else if (trailer.OPEN_PAREN() != null) {
                expr = call(expr, trailer.arglist());
            } else {
                expr = new PyExpr.Opaque("subscript");
            }
        }
        return expr;
    }

    @Override
    public PyExpr visitAtom(Python3Parser.AtomContext ctx) {
        if (ctx.name() != null) {
            return new PyExpr.Name(ctx.name().getText());
        }
        if (!ctx.STRING().isEmpty()) {
            return strings(ctx.STRING());
        }
        if (ctx.NUMBER() != null) {
            String digits = ctx.NUMBER().getText();
            return digits.matches("\\d[\\d_]*") ? integer(new BigInteger(digits.replace("_", "")), ctx) : opaque(ctx);
        }
        if (ctx.OPEN_PAREN() != null) {
            Python3Parser.Testlist_compContext inner = ctx.testlist_comp();
            if (inner == null) {
                return ctx.yield_expr() == null ? new PyExpr.Sequence(List.of()) : opaque(ctx);
            }
            List<PyExpr> elements = display(inner);
            boolean tuple = !inner.COMMA().isEmpty();
            return elements != null && !tuple && elements.size() == 1 ? elements.get(0) : sequence(elements, ctx);
        }
        if (ctx.OPEN_BRACK() != null) {
            return ctx.testlist_comp() == null ? new PyExpr.Sequence(List.of()) : sequence(display(ctx.testlist_comp()), ctx);
        }
        if (ctx.OPEN_BRACE() != null) {
            Python3Parser.DictorsetmakerContext maker = ctx.dictorsetmaker();
            if (maker == null || !maker.COLON().isEmpty() || !maker.POWER().isEmpty() || maker.comp_for() != null) {
                return opaque(ctx);
            }
            List<PyExpr> elements = new ArrayList<>();
            maker.namedexpr_test().forEach(element -> elements.add(visit(element)));
            return new PyExpr.Sequence(List.copyOf(elements));
        }
        return opaque(ctx);
    }

    private PyExpr call(PyExpr func, Python3Parser.ArglistContext arglist) {
        List<PyExpr> args = new ArrayList<>();
        Map<String, PyExpr> keywords = new LinkedHashMap<>();
        if (arglist != null) {
            for (Python3Parser.ArgumentContext argument : arglist.argument()) {
                if (argument.ASSIGN() != null) {
                    keywords.put(argument.test(0).getText(), visit(argument.test(1)));
                } else if (argument.STAR() == null && argument.POWER() == null
                        && argument.comp_for() == null && argument.WALRUS() == null) {
                    args.add(visit(argument.test(0)));
                }
            }
        }
        return new PyExpr.Call(func, List.copyOf(args), keywords);
    }

    /**
     * Elements of a list or tuple display, or null for a comprehension.
     */
    private List<PyExpr> display(Python3Parser.Testlist_compContext ctx) {
        if (ctx.comp_for() != null) {
            return null;
        }
        List<PyExpr> elements = new ArrayList<>();
        ctx.namedexpr_test().forEach(element -> elements.add(visit(element)));
        return List.copyOf(elements);
    }

    private static PyExpr sequence(List<PyExpr> elements, RuleNode ctx) {
        return elements == null ? opaque(ctx) : new PyExpr.Sequence(elements);
    }

    // adjacent literals concatenate; any f-string or bytes part makes the whole non-constant
    private static PyExpr strings(List<TerminalNode> parts) {
        StringBuilder value = new StringBuilder();
        boolean constant = true;
        for (TerminalNode part : parts) {
            String text = part.getText();
            int quote = 0;
            while (text.charAt(quote) != '\'' && text.charAt(quote) != '"') {
                quote++;
            }
            String prefix = text.substring(0, quote).toLowerCase(Locale.ROOT);
            constant &= prefix.indexOf('f') < 0 && prefix.indexOf('b') < 0;
            int delimiter = text.startsWith("'''", quote) || text.startsWith("\"\"\"", quote) ? 3 : 1;
            String body = text.substring(quote + delimiter, text.length() - delimiter);
            value.append(prefix.indexOf('r') >= 0 ? body : unescape(body));
        }
        return constant ? new PyExpr.Str(value.toString()) : new PyExpr.Opaque(value.toString());
    }

    static String unescape(String body) {
        StringBuilder value = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 == body.length()) {
                value.append(c);
                continue;
            }
            char escaped = body.charAt(++i);
            switch (escaped) {
                case '\n' -> { }
                case '\r' -> {
                    if (i + 1 < body.length() && body.charAt(i + 1) == '\n') {
                        i++;
                    }
                }
                case 'n' -> value.append('\n');
                case 't' -> value.append('\t');
                case 'r' -> value.append('\r');
                case '\\', '\'', '"' -> value.append(escaped);
                default -> value.append('\\').append(escaped);
            }
        }
        return value.toString();
    }

    private static PyExpr integer(BigInteger value, RuleNode ctx) {
        return value.bitLength() < 32 ? new PyExpr.Int(value.intValue()) : opaque(ctx);
    }

    private static PyExpr opaque(RuleNode ctx) {
        return new PyExpr.Opaque(ctx.getText());
    }
}
