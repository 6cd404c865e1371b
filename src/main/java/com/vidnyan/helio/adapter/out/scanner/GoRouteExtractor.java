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

/**
 * Extracts routes from Go sources: {@code net/http} {@code HandleFunc} registrations (method {@code ANY})
 * and gin/echo/chi/fiber style {@code r.GET("/path", handler)} calls. Go routes carry no middleware.
 */
@Slf4j
@Component
public class GoRouteExtractor implements RouteExtractor {

    static final String ANY_METHOD = "ANY";

    private static final Pattern HANDLE_FUNC = Pattern.compile(
            "\\b\\w+\\.HandleFunc\\s*\\(\\s*\"([^\"]*)\"\\s*,\\s*([A-Za-z0-9_.]+)\\s*\\)");

    private static final Pattern VERB_CALL = Pattern.compile(
            "\\b\\w+\\.(GET|POST|PUT|DELETE|PATCH|OPTIONS|HEAD|Get|Post|Put|Delete|Patch|Options|Head)"
                    + "\\s*\\(\\s*\"([^\"]*)\"\\s*,\\s*([A-Za-z0-9_.]+)\\s*\\)");

    private static final List<Pattern> PORT_PATTERNS = List.of(
            Pattern.compile("ListenAndServe(?:TLS)?\\s*\\(\\s*\"[^\"]*:(\\d+)\""),
            Pattern.compile("\\.Run\\s*\\(\\s*\"[^\"]*:(\\d+)\""),
            Pattern.compile("\\.Listen\\s*\\(\\s*\"[^\"]*:(\\d+)\""),
            Pattern.compile("\\.Start\\s*\\(\\s*\"[^\"]*:(\\d+)\""));

    @Override
    public Framework framework() {
        return Framework.GO;
    }

    @Override
    public Extraction extract(Path file, String content) {
        String code = CommentStripper.strip(content);

        // (offset, route) so registrations come out in source order across both call shapes
        TreeMap<Integer, Route> found = new TreeMap<>();

        Matcher handleFunc = HANDLE_FUNC.matcher(code);
        while (handleFunc.find()) {
            found.put(handleFunc.start(), route(ANY_METHOD, handleFunc.group(1), handleFunc.group(2)));
        }

        Matcher verbCall = VERB_CALL.matcher(code);
        while (verbCall.find()) {
            String method = verbCall.group(1).toUpperCase(Locale.ROOT);
            found.put(verbCall.start(), route(method, verbCall.group(2), verbCall.group(3)));
        }

        log.debug("Found {} Go routes in {}", found.size(), file);
        return new Extraction(new ArrayList<>(found.values()), port(code));
    }

    private Route route(String method, String path, String handler) {
        return Route.builder()
                .name(RouteNaming.routeName(method, path))
                .method(method)
                .path(path)
                .handler(handler)
                .middleware(List.of())
                .framework(Framework.GO)
                .build();
    }

    static Integer port(String code) {
        for (Pattern pattern : PORT_PATTERNS) {
            Matcher matcher = pattern.matcher(code);
            if (matcher.find()) {
                return SourceText.port(matcher.group(1));
            }
        }
        return null;
    }
}
