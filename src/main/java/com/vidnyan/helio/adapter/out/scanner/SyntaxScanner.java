package com.vidnyan.helio.adapter.out.scanner;

import com.vidnyan.helio.adapter.out.scanner.python.PythonSyntaxWalker;
import com.vidnyan.helio.adapter.out.scanner.python.SyntaxEvent;
import com.vidnyan.helio.application.port.out.RouteExtractor;
import com.vidnyan.helio.application.port.out.RouteExtractor.Extraction;
import com.vidnyan.helio.application.port.out.SourceParseException;
import com.vidnyan.helio.application.port.out.SourceScanner;
import com.vidnyan.helio.domain.model.Framework;
import com.vidnyan.helio.domain.model.Route;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Picks the extractor for one file and runs it.
 *
 * <p>The extension decides for {@code .js}/{@code .ts}, {@code .go} and {@code .java}. Python files
 * are inspected: a single idiom match runs that extractor, otherwise both decorator idioms run and
 * the results are resolved by {@link #resolve}. A file that cannot be read or parsed scans as
 * {@link Framework#UNKNOWN} with no routes.</p>
 */
@Slf4j
@Component
public class SyntaxScanner implements SourceScanner {

    private static final List<Framework> PYTHON_IDIOMS = List.of(Framework.FLASK, Framework.FASTAPI);

    private final Map<Framework, RouteExtractor> extractors;
    private final FrameworkDetector frameworkDetector;

    public SyntaxScanner(List<RouteExtractor> extractors, FrameworkDetector frameworkDetector) {
        this.extractors = extractors.stream()
                .collect(Collectors.toMap(RouteExtractor::framework, Function.identity(),
                        (first, second) -> first, () -> new EnumMap<>(Framework.class)));
        this.frameworkDetector = frameworkDetector;
    }

    @Override
    public ScannedFile scan(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (MalformedInputException e) {
            log.warn("Skipping {}: not valid UTF-8", file);
            return ScannedFile.unknown(file);
        } catch (IOException e) {
            log.warn("Skipping {}: {}", file, e.getMessage());
            return ScannedFile.unknown(file);
        }
        return scan(file, content);
    }

    public ScannedFile scan(Path file, String content) {
        try {
            switch (SourceFileCollector.extension(file)) {
                case ".js", ".ts":
                    return run(file, content, Framework.EXPRESS);
                case ".go":
                    return run(file, content, Framework.GO);
                case ".java":
                    return run(file, content, Framework.SPRING);
                case ".py":
                    return scanPython(file, content);
                default:
                    if (content.contains("express") && content.contains(".get(")) {
                        return run(file, content, Framework.EXPRESS);
                    }
                    log.debug("No extractor for {}", file);
                    return ScannedFile.unknown(file);
            }
        } catch (SourceParseException e) {
            log.warn("Failed to parse {}: {}", file, e.getMessage());
            return ScannedFile.unknown(file);
        }
    }

    private ScannedFile scanPython(Path file, String content) throws SourceParseException {
        List<SyntaxEvent> events = PythonSyntaxWalker.walk(file, content);
        FrameworkMatch match = frameworkDetector.detectPython(events, content);

        if (match.kind() == FrameworkMatch.Kind.SINGLE) {
            return run(file, content, match.framework());
        }

        Map<Framework, Extraction> results = new LinkedHashMap<>();
        for (Framework idiom : PYTHON_IDIOMS) {
            results.put(idiom, extractor(idiom).extract(file, content));
        }
        ScannedFile resolved = resolve(file, results);
        log.debug("{} match for {} resolved to {}", match.kind(), file, resolved.framework().label());
        return resolved;
    }

    /**
     * Resolve the results of several idioms run on one file: exactly one with routes wins and keeps
     * its label; several with routes are concatenated in idiom order as {@code Mixed}; none is
     * {@code Unknown}. The port is the first declared one.
     */
    static ScannedFile resolve(Path file, Map<Framework, Extraction> results) {
        List<Map.Entry<Framework, Extraction>> withRoutes = results.entrySet().stream()
                .filter(entry -> entry.getValue().hasRoutes())
                .toList();
        Integer port = results.values().stream()
                .map(Extraction::port)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);

        if (withRoutes.size() == 1) {
            Map.Entry<Framework, Extraction> winner = withRoutes.get(0);
            return new ScannedFile(file, winner.getKey(), winner.getValue().routes(), winner.getValue().port());
        }
        if (withRoutes.isEmpty()) {
            return new ScannedFile(file, Framework.UNKNOWN, List.of(), port);
        }
        List<Route> combined = withRoutes.stream()
                .flatMap(entry -> entry.getValue().routes().stream())
                .toList();
        return new ScannedFile(file, Framework.MIXED, combined, port);
    }

    private ScannedFile run(Path file, String content, Framework framework) throws SourceParseException {
        Extraction extraction = extractor(framework).extract(file, content);
        return new ScannedFile(file, framework, extraction.routes(), extraction.port());
    }

    private RouteExtractor extractor(Framework framework) {
        RouteExtractor extractor = extractors.get(framework);
        if (extractor == null) {
            throw new IllegalStateException("No route extractor registered for " + framework.label());
        }
        return extractor;
    }
}
