package com.vidnyan.helio.adapter.out.scanner.python;

import com.vidnyan.helio.domain.model.Framework;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Flask idiom: {@code @bp.route("/items", methods=["GET", "POST"])} on the app or any Blueprint.
 * Without {@code methods} the route is GET. Port comes from {@code app.run(port=N)}.
 */
@Component
public class FlaskRouteExtractor extends DecoratorRouteExtractor {

    private static final Set<String> APP_NAMES = Set.of("app");

    private static final Set<String> CONSTRUCTORS = Set.of("Flask", "Blueprint");

    @Override
    public Framework framework() {
        return Framework.FLASK;
    }

    @Override
    protected Set<String> defaultAppNames() {
        return APP_NAMES;
    }

    @Override
    protected boolean isAppConstructor(PyExpr.Call value) {
        return PyExpr.terminalName(value.func()).map(CONSTRUCTORS::contains).orElse(false);
    }

    @Override
    protected Optional<List<RouteCandidate>> routeMarker(PyExpr marker, Set<String> appNames) {
        Optional<ReceiverCall> receiverCall = receiverCall(marker);
        if (receiverCall.isEmpty()
                || !appNames.contains(receiverCall.get().receiver())
                || !receiverCall.get().attribute().equals("route")) {
            return Optional.empty();
        }

        PyExpr.Call call = receiverCall.get().call();
        String path = literalPath(call.firstArg().or(() -> call.keyword("rule")));
        List<RouteCandidate> candidates = new ArrayList<>();
        for (String method : methods(call)) {
            candidates.add(new RouteCandidate(method, path));
        }
        return Optional.of(candidates);
    }

    private static List<String> methods(PyExpr.Call call) {
        Optional<PyExpr> methods = call.keyword("methods");
        if (methods.isEmpty()) {
            return List.of("GET");
        }
        List<String> names = new ArrayList<>();
        if (methods.get() instanceof PyExpr.Sequence sequence) {
            for (PyExpr element : sequence.elements()) {
                if (element instanceof PyExpr.Str str) {
                    names.add(str.value().toUpperCase(Locale.ROOT));
                } else if (element instanceof PyExpr.Int number) {
                    names.add(String.valueOf(number.value()));
                }
            }
        }
        return names;
    }

    @Override
    protected Optional<Integer> serverPort(PyExpr.Call call, Set<String> appNames) {
        return receiverCall(call)
                .filter(rc -> appNames.contains(rc.receiver()) && rc.attribute().equals("run"))
                .flatMap(rc -> intKeyword(call, "port"));
    }
}
