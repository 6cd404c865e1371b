package com.vidnyan.helio.adapter.out.scanner.python;

import com.vidnyan.helio.domain.model.Framework;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * FastAPI idiom: the HTTP verb is the decorator attribute, {@code @app.get("/items")}.
 * Port comes from {@code uvicorn.run(..., port=N)}.
 */
@Component
public class FastApiRouteExtractor extends DecoratorRouteExtractor {

    private static final Set<String> APP_NAMES = Set.of("app", "router", "api");

    private static final Set<String> CONSTRUCTORS = Set.of(
            "fastapi", "apirouter", "fastapiclient", "fastapirouter", "fastapiapp", "fastapiapplication");

    private static final Set<String> VERBS = Set.of("get", "post", "put", "delete", "patch", "options", "head");

    @Override
    public Framework framework() {
        return Framework.FASTAPI;
    }

    @Override
    protected Set<String> defaultAppNames() {
        return APP_NAMES;
    }

    @Override
    protected boolean isAppConstructor(PyExpr.Call value) {
        return PyExpr.terminalName(value.func())
                .map(name -> CONSTRUCTORS.contains(name.toLowerCase(Locale.ROOT)))
                .orElse(false);
    }

    @Override
    protected Optional<List<RouteCandidate>> routeMarker(PyExpr marker, Set<String> appNames) {
        Optional<ReceiverCall> receiverCall = receiverCall(marker);
        if (receiverCall.isEmpty()) {
            return Optional.empty();
        }
        String verb = receiverCall.get().attribute().toLowerCase(Locale.ROOT);
        if (!appNames.contains(receiverCall.get().receiver()) || !VERBS.contains(verb)) {
            return Optional.empty();
        }

        PyExpr.Call call = receiverCall.get().call();
        Optional<PyExpr> pathArgument = call.firstArg().or(() -> call.keyword("path"));
        return Optional.of(List.of(new RouteCandidate(verb.toUpperCase(Locale.ROOT), literalPath(pathArgument))));
    }

    @Override
    protected Optional<Integer> serverPort(PyExpr.Call call, Set<String> appNames) {
        return receiverCall(call)
                .filter(rc -> rc.receiver().equals("uvicorn") && rc.attribute().equals("run"))
                .flatMap(rc -> intKeyword(call, "port"));
    }
}
