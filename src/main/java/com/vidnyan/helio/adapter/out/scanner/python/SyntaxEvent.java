package com.vidnyan.helio.adapter.out.scanner.python;

import java.util.List;

/**
 * Facts a syntax walk reports, in source order. Reducers fold these into routes.
 */
public interface SyntaxEvent {

    int line();

    /**
     * {@code import a.b, c} or {@code from a import b}; module and imported names, lower-cased.
     */
    record ImportSeen(int line, List<String> names) implements SyntaxEvent {}

    /**
     * {@code x = y = Call(...)}: every plain-name target bound to a call result.
     */
    record BindingIntroduced(int line, List<String> targets, PyExpr.Call value) implements SyntaxEvent {}

    /**
     * A function declaration with its decorator markers, top to bottom.
     */
    record DeclarationSeen(int line, String function, List<PyExpr> markers) implements SyntaxEvent {}

    record CallSeen(int line, PyExpr.Call call) implements SyntaxEvent {}
}
