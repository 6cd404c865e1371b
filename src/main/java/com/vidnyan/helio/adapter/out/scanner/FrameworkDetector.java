package com.vidnyan.helio.adapter.out.scanner;

import com.vidnyan.helio.adapter.out.scanner.python.SyntaxEvent;
import com.vidnyan.helio.domain.model.Framework;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides which decorator idiom a Python file uses from its imports and literal markers.
 */
@Slf4j
@Component
public class FrameworkDetector {

    private static final Pattern FASTAPI_KEYWORD = Pattern.compile("\\bFastAPI\\b");
    private static final Pattern FLASK_KEYWORD = Pattern.compile("\\bflask\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern FLASK_CONSTRUCTOR = Pattern.compile("\\b(?:Blueprint|Flask)\\s*\\(");

    public FrameworkMatch detectPython(List<SyntaxEvent> events, String content) {
        List<String> imported = events.stream()
                .filter(SyntaxEvent.ImportSeen.class::isInstance)
                .flatMap(event -> ((SyntaxEvent.ImportSeen) event).names().stream())
                .toList();

        boolean fastApi = imported.stream().anyMatch(name -> name.contains("fastapi"))
                || FASTAPI_KEYWORD.matcher(content).find();
        boolean flask = imported.stream().anyMatch(name -> name.contains("flask"))
                || FLASK_KEYWORD.matcher(content).find()
                || FLASK_CONSTRUCTOR.matcher(content).find();

        FrameworkMatch match;
        if (fastApi && flask) {
            match = FrameworkMatch.ambiguous();
        } else if (fastApi) {
            match = FrameworkMatch.single(Framework.FASTAPI);
        } else if (flask) {
            match = FrameworkMatch.single(Framework.FLASK);
        } else {
            match = FrameworkMatch.none();
        }
        log.debug("Python framework markers: fastapi={}, flask={} -> {}", fastApi, flask, match.kind());
        return match;
    }
}
