package com.vidnyan.helio.adapter.in.cli;

import com.vidnyan.helio.application.port.in.ExtractRoutesUseCase;
import com.vidnyan.helio.application.port.in.ExtractRoutesUseCase.ExtractionRequest;
import com.vidnyan.helio.application.port.in.VerifyConformanceUseCase;
import com.vidnyan.helio.application.port.out.DocumentLoadException;
import com.vidnyan.helio.application.port.out.ReportWriteException;
import com.vidnyan.helio.application.port.out.ReportWriter;
import com.vidnyan.helio.application.port.out.RouteModelStore;
import com.vidnyan.helio.config.HelioProperties;
import com.vidnyan.helio.domain.model.RouteModel;
import com.vidnyan.helio.domain.model.Service;
import com.vidnyan.helio.domain.verification.VerificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * CLI entry point.
 * The command comes from {@code helio.command} or the first non-option argument:
 * {@code extract}, {@code verify} or {@code run} (extract, then verify the written document).
 *
 * Exit status: 0 satisfiable (or extraction done), 1 unsatisfiable or inconclusive, 2 usage or load failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HelioCliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_VIOLATIONS = 1;
    static final int EXIT_USAGE = 2;

    private final ExtractRoutesUseCase extractRoutesUseCase;
    private final VerifyConformanceUseCase verifyConformanceUseCase;
    private final RouteModelStore routeModelStore;
    private final ReportWriter reportWriter;
    private final HelioProperties properties;

    private int exitCode = EXIT_OK;

    @Override
    public void run(String... args) {
        String command = resolveCommand(args);
        try {
            exitCode = switch (command) {
                case "extract" -> extract();
                case "verify" -> verify();
                case "run" -> {
                    int extracted = extract();
                    yield extracted == EXIT_OK ? verify() : extracted;
                }
                default -> usage(command);
            };
        } catch (DocumentLoadException e) {
            log.error("Cannot read {}: {}", e.getKind(), e.getMessage());
            exitCode = EXIT_USAGE;
        } catch (ReportWriteException e) {
            log.error(e.getMessage(), e);
            exitCode = EXIT_USAGE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private String resolveCommand(String... args) {
        if (properties.getCommand() != null && !properties.getCommand().isBlank()) {
            return properties.getCommand().trim().toLowerCase(Locale.ROOT);
        }
        return Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .findFirst()
                .map(arg -> arg.toLowerCase(Locale.ROOT))
                .orElse("");
    }

    private int extract() {
        ExtractionRequest request;
        if (!properties.getFiles().isEmpty()) {
            request = ExtractionRequest.forFiles(properties.getFiles().stream().map(Path::of).toList());
        } else if (!properties.getSourceRoot().isBlank()) {
            request = ExtractionRequest.forRoot(Path.of(properties.getSourceRoot()));
        } else {
            log.error("Nothing to extract. Set helio.files or helio.source-root.");
            return EXIT_USAGE;
        }

        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║              Helio - Route Extraction                        ║");
        log.info("╚══════════════════════════════════════════════════════════════╝");

        RouteModel model = extractRoutesUseCase.extract(request);
        Path routesPath = Path.of(properties.getRoutesPath());
        routeModelStore.write(model, routesPath);

        printExtraction(model);
        log.info(" Routes document: {}", routesPath);
        return EXIT_OK;
    }

    private int verify() {
        if (properties.getSpecPath().isBlank()) {
            log.error("No specification given. Set helio.spec-path.");
            return EXIT_USAGE;
        }

        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║              Helio - Conformance Verification                ║");
        log.info("╠══════════════════════════════════════════════════════════════╣");
        log.info("║ Spec:   {}", truncatePath(properties.getSpecPath(), 50));
        log.info("║ Routes: {}", truncatePath(properties.getRoutesPath(), 50));
        log.info("╚══════════════════════════════════════════════════════════════╝");

        VerificationResult result = verifyConformanceUseCase.verify(
                Path.of(properties.getSpecPath()), Path.of(properties.getRoutesPath()));
        reportWriter.write(result, Path.of(properties.getResultPath()));

        printResult(result);
        if (result.isLoadFailure()) {
            return EXIT_USAGE;
        }
        return result.satisfiable() ? EXIT_OK : EXIT_VIOLATIONS;
    }

    private int usage(String command) {
        if (!command.isEmpty()) {
            log.error("Unknown command: {}", command);
        }
        log.info("Usage: helio <extract|verify|run> [--helio.<property>=<value> ...]");
        log.info("  extract  --helio.files=a.js,b.py | --helio.source-root=DIR  [--helio.routes-path=routes.json]");
        log.info("  verify   --helio.spec-path=spec.json [--helio.routes-path=routes.json] [--helio.result-path=result.json]");
        log.info("  run      extract, then verify the extracted routes");
        return EXIT_USAGE;
    }

    private void printExtraction(RouteModel model) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" EXTRACTED SERVICES");
        log.info("═══════════════════════════════════════════════════════════════");
        for (Service service : model.services().values()) {
            log.info(" {} [{}] port={} routes={}", service.name(), service.framework().label(),
                    service.port() != null ? service.port() : "-", service.routes().size());
        }
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" Services: {}   Routes: {}", model.metadata().totalServices(), model.metadata().totalRoutes());
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private void printResult(VerificationResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" VERIFICATION RESULT: {}", result.outcome());
        log.info("═══════════════════════════════════════════════════════════════");
        printChannel("🔴 Errors", result.errors());
        printChannel("🟡 Warnings", result.warnings());
        printChannel("💡 Suggestions", result.suggestions());
        log.info("═══════════════════════════════════════════════════════════════");
        if (result.satisfiable() && result.errors().isEmpty()) {
            log.info("✅ Implementation conforms to the specification.");
        }
        log.info(" Full JSON report: {}", properties.getResultPath());
    }

    private void printChannel(String title, List<String> findings) {
        log.info(" {}: {}", title, findings.size());
        for (String finding : findings) {
            log.info("   - {}", finding);
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
