package com.vidnyan.helio.adapter.out.scanner.python;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Superclass of the generated {@code Python3Lexer}. Turns leading whitespace into
 * {@code INDENT}/{@code DEDENT} tokens, drops line breaks inside brackets and on blank lines, and
 * closes the last logical line and every open block at end of input.
 */
public abstract class Python3LexerBase extends Lexer {

    private Deque<Token> pending = new ArrayDeque<>();
    private Deque<Integer> indents = new ArrayDeque<>();
    private int opened;
    private int lastType = Token.INVALID_TYPE;
    private boolean closed;

    protected Python3LexerBase(CharStream input) {
        super(input);
    }

    @Override
    public void emit(Token token) {
        super.setToken(token);
        pending.offer(token);
        if (token.getChannel() == Token.DEFAULT_CHANNEL && token.getType() != Token.EOF) {
            lastType = token.getType();
        }
    }

    @Override
    public Token nextToken() {
        if (!closed && _input.LA(1) == Token.EOF) {
            closed = true;
            if (lastType != Token.INVALID_TYPE && lastType != Python3Lexer.NEWLINE
                    && lastType != Python3Lexer.DEDENT) {
                emit(synthetic(Python3Lexer.NEWLINE, "\n"));
            }
            while (!indents.isEmpty()) {
                indents.pop();
                emit(synthetic(Python3Lexer.DEDENT, ""));
            }
        }
        Token next = super.nextToken();
        return pending.isEmpty() ? next : pending.poll();
    }

    @Override
    public void reset() {
        pending = new ArrayDeque<>();
        indents = new ArrayDeque<>();
        opened = 0;
        lastType = Token.INVALID_TYPE;
        closed = false;
        super.reset();
    }

    protected boolean atStartOfInput() {
        return getCharPositionInLine() == 0 && getLine() == 1;
    }

    protected void openBrace() {
        opened++;
    }

    protected void closeBrace() {
        if (opened > 0) {
            opened--;
        }
    }

    protected void onNewLine() {
        String text = getText();
        String spaces = text.replaceAll("[\r\n\f]+", "");
        int next = _input.LA(1);
        if (opened > 0 || next == '\r' || next == '\n' || next == '\f' || next == '#') {
            skip();
            return;
        }

        emit(synthetic(Python3Lexer.NEWLINE, text.replaceAll("[^\r\n\f]+", "")));
        int indent = indentation(spaces);
        int previous = indents.isEmpty() ? 0 : indents.peek();
        if (indent == previous) {
            skip();
        } else if (indent > previous) {
            indents.push(indent);
            emit(synthetic(Python3Lexer.INDENT, spaces));
        } else {
            while (!indents.isEmpty() && indents.peek() > indent) {
                indents.pop();
                emit(synthetic(Python3Lexer.DEDENT, ""));
            }
        }
    }

    /**
     * Column of the first non-blank character, tabs advancing to the next multiple of eight.
     */
    static int indentation(String spaces) {
        int count = 0;
        for (char ch : spaces.toCharArray()) {
            count = ch == '\t' ? count + 8 - (count % 8) : count + 1;
        }
        return count;
    }

    private Token synthetic(int type, String text) {
        int stop = getCharIndex() - 1;
        CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL,
                Math.max(0, stop - text.length() + 1), stop);
        token.setText(text);
        token.setLine(_tokenStartLine > 0 ? _tokenStartLine : getLine());
        return token;
    }
}
