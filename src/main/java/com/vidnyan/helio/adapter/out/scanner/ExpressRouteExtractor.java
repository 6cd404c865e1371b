package com.vidnyan.helio.adapter.out.scanner;

import com.vidnyan.helio.application.port.out.RouteExtractor;
import com.vidnyan.helio.domain.model.Framework;
import com.vidnyan.helio.domain.model.Route;
import com.vidnyan.helio.domain.route.RouteNaming;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extracts routes from Express.js sources: {@code app.get('/path', mw1, mw2, handler)} on {@code app},
 * {@code router} and any name bound to {@code express()}, {@code express.Router()} or {@code Router()}.
 *
 * <p>Arguments before the first inline function are middleware; the inline function (or, when there
 * is none, the last argument) is the handler.</p>
 */
@Slf4j
@Component
public class ExpressRouteExtractor implements RouteExtractor {

    private static final Set<String> DEFAULT_APP_NAMES = Set.of("app", "router");

    private static final Pattern APP_BINDING = Pattern.compile(
            "\\b(?:const|let|var)\\s+([A-Za-z_$][\\w$]*)\\s*=\\s*(?:express\\s*\\(\\s*\\)|express\\.Router\\s*\\(|Router\\s*\\()");

    private static final Pattern HANDLER_MARKER = Pattern.compile(
            "((?:async\\s+)?function\\s*\\w*\\s*\\(|(?:async\\s+)?\\([^)]*\\)\\s*=>|(?:async\\s+)?[A-Za-z_$][\\w$]*\\s*=>)");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern LISTEN_LITERAL = Pattern.compile("\\.listen\\s*\\(\\s*(\\d+)\\s*[,)]");
    private static final Pattern LISTEN_ENV_FALLBACK = Pattern.compile(
            "\\.listen\\s*\\(\\s*process\\.env\\.\\w+\\s*\\|\\|\\s*(\\d+)\\s*[,)]");
    private static final Pattern LISTEN_IDENTIFIER = Pattern.compile("\\.listen\\s*\\(\\s*([A-Za-z_$][\\w$]*)\\s*[,)]");

    @Override
    public Framework framework() {
        return Framework.EXPRESS;
    }

    @Override
    public Extraction extract(Path file, String content) {
        String code = CommentStripper.strip(content);
        Set<String> appNames = appNames(code);

        List<Route> routes = new ArrayList<>();
        Matcher matcher = routePattern(appNames).matcher(code);
        while (matcher.find()) {
            String method = matcher.group(2).toUpperCase(Locale.ROOT);
            String path = matcher.group(4);
            int openParen = code.indexOf('(', matcher.start(2));
            int closeParen = SourceText.matchingParen(code, openParen);
            if (closeParen < 0) {
                log.debug("Unterminated route call at offset {} in {}", matcher.start(), file);
                continue;
            }
            String rest = code.substring(matcher.end(), closeParen);
            routes.add(toRoute(method, path, rest));
        }

        return new Extraction(routes, port(code));
    }

    private Route toRoute(String method, String path, String rest) {
        List<String> middleware;
        String handler;

        Matcher marker = HANDLER_MARKER.matcher(rest);
        if (marker.find()) {
            middleware = SourceText.splitTopLevel(rest.substring(0, marker.start()));
            handler = rest.substring(marker.start());
        } else {
            List<String> parts = SourceText.splitTopLevel(rest);
            if (parts.isEmpty()) {
                middleware = List.of();
                handler = "";
            } else {
                middleware = parts.subList(0, parts.size() - 1);
                handler = parts.get(parts.size() - 1);
            }
        }

        return Route.builder()
                .name(RouteNaming.routeName(method, path))
                .method(method)
                .path(path)
                .handler(WHITESPACE.matcher(handler).replaceAll(" ").trim())
                .middleware(middleware)
                .framework(Framework.EXPRESS)
                .build();
    }

    static Set<String> appNames(String code) {
        Set<String> names = new LinkedHashSet<>(DEFAULT_APP_NAMES);
        Matcher binding = APP_BINDING.matcher(code);
        while (binding.find()) {
            names.add(binding.group(1));
        }
        return names;
    }

    private static Pattern routePattern(Set<String> appNames) {
        String alternatives = appNames.stream().map(Pattern::quote).collect(Collectors.joining("|"));
        return Pattern.compile(
                "(?<![\\w$.])(" + alternatives + ")\\s*\\.\\s*(get|post|put|delete|patch|options|head)\\s*\\(\\s*"
                        + "(['\"`])([^'\"`]*)\\3\\s*,",
                Pattern.CASE_INSENSITIVE);
    }

    static Integer port(String code) {
        Matcher literal = LISTEN_LITERAL.matcher(code);
        if (literal.find()) {
            return SourceText.port(literal.group(1));
        }
        Matcher env = LISTEN_ENV_FALLBACK.matcher(code);
        if (env.find()) {
            return SourceText.port(env.group(1));
        }
        Matcher identifier = LISTEN_IDENTIFIER.matcher(code);
        if (identifier.find()) {
            Pattern declaration = Pattern.compile(
                    "\\b(?:const|let|var)\\s+" + Pattern.quote(identifier.group(1))
                            + "\\s*=\\s*(?:process\\.env\\.\\w+\\s*\\|\\|\\s*)?(\\d+)");
            Matcher value = declaration.matcher(code);
            if (value.find()) {
                return SourceText.port(value.group(1));
            }
        }
        return null;
    }
}
