package com.vidnyan.helio.adapter.out.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.helio.application.port.out.ReportWriteException;
import com.vidnyan.helio.application.port.out.ReportWriter;
import com.vidnyan.helio.domain.verification.VerificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes the verification result document. {@code model} is present only when satisfiable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonReportWriter implements ReportWriter {

    private final ObjectMapper objectMapper;

    @Override
    public void write(VerificationResult result, Path resultPath) {
        try {
            Path parent = resultPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(resultPath.toFile(), toDocument(result));
        } catch (IOException e) {
            throw new ReportWriteException(resultPath, e);
        }
        log.info("Full JSON report saved to {}", resultPath);
    }

    static ResultDocument toDocument(VerificationResult result) {
        return new ResultDocument(
                result.satisfiable(),
                result.outcome().name(),
                result.errors(),
                result.warnings(),
                result.suggestions(),
                result.model());
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ResultDocument(
        @JsonProperty("is_satisfiable") boolean satisfiable,
        @JsonProperty("outcome") String outcome,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("warnings") List<String> warnings,
        @JsonProperty("suggestions") List<String> suggestions,
        @JsonProperty("model") Map<String, Boolean> model
    ) {}
}
