package com.vidnyan.helio.adapter.out.scanner.python;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Expression shapes the route reducers look at. Anything else is {@link Opaque}.
 */
public interface PyExpr {

    record Name(String id) implements PyExpr {}

    record Attribute(PyExpr value, String attr) implements PyExpr {}

    record Call(PyExpr func, List<PyExpr> args, Map<String, PyExpr> keywords) implements PyExpr {

        public Optional<PyExpr> keyword(String name) {
            return Optional.ofNullable(keywords.get(name));
        }

        public Optional<PyExpr> firstArg() {
            return args.isEmpty() ? Optional.empty() : Optional.of(args.get(0));
        }
    }

    record Str(String value) implements PyExpr {}

    record Int(int value) implements PyExpr {}

    /** list, tuple or set display */
    record Sequence(List<PyExpr> elements) implements PyExpr {}

    record Opaque(String text) implements PyExpr {}

    /**
     * {@code x} for a name, {@code attr} for {@code a.b.attr}, the callee's terminal name for a call.
     */
    static Optional<String> terminalName(PyExpr expr) {
        if (expr instanceof Name name) {
            return Optional.of(name.id());
        }
        if (expr instanceof Attribute attribute) {
            return Optional.of(attribute.attr());
        }
        if (expr instanceof Call call) {
            return terminalName(call.func());
        }
        return Optional.empty();
    }

    /**
     * Receiver name of {@code receiver.attr}, when the receiver is a plain name.
     */
    static Optional<String> receiverName(Attribute attribute) {
        return attribute.value() instanceof Name name ? Optional.of(name.id()) : Optional.empty();
    }
}
