package com.vidnyan.helio.adapter.in.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.helio.adapter.out.analyzer.ConsistencyAnalyzer;
import com.vidnyan.helio.adapter.out.analyzer.PerformanceAnalyzer;
import com.vidnyan.helio.adapter.out.analyzer.SecurityAnalyzer;
import com.vidnyan.helio.adapter.out.document.JsonReportWriter;
import com.vidnyan.helio.adapter.out.document.JsonRouteModelStore;
import com.vidnyan.helio.adapter.out.document.JsonSpecificationLoader;
import com.vidnyan.helio.adapter.out.scanner.ExpressRouteExtractor;
import com.vidnyan.helio.adapter.out.scanner.FrameworkDetector;
import com.vidnyan.helio.adapter.out.scanner.GoRouteExtractor;
import com.vidnyan.helio.adapter.out.scanner.SourceFileCollector;
import com.vidnyan.helio.adapter.out.scanner.SpringRouteExtractor;
import com.vidnyan.helio.adapter.out.scanner.SyntaxScanner;
import com.vidnyan.helio.adapter.out.scanner.python.FastApiRouteExtractor;
import com.vidnyan.helio.adapter.out.scanner.python.FlaskRouteExtractor;
import com.vidnyan.helio.adapter.out.solver.Sat4jSatisfiabilityEngine;
import com.vidnyan.helio.application.service.ConformanceVerificationService;
import com.vidnyan.helio.application.service.RouteExtractionService;
import com.vidnyan.helio.config.HelioConfiguration;
import com.vidnyan.helio.config.HelioProperties;
import com.vidnyan.helio.domain.verification.ConstraintModelBuilder;
import com.vidnyan.helio.domain.verification.DiagnosticTranslator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HelioCliRunnerTest {

    private static final String SPEC = """
            {
              "services": {"OrderService": {"routes": {"create_order": {"method": "POST", "path": "/orders"}}}},
              "communications": [],
              "policies": {"authRequired": ["create_order"], "timeout": {"default": "5s"}}
            }
            """;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new HelioConfiguration().objectMapper();
    private ThreadPoolTaskExecutor executor;
    private HelioProperties properties;
    private HelioCliRunner runner;

    @BeforeEach
    void setUp() {
        properties = new HelioProperties();
        properties.setRoutesPath(tempDir.resolve("routes.json").toString());
        properties.setResultPath(tempDir.resolve("result.json").toString());
        properties.getScan().setThreads(2);
        executor = new HelioConfiguration().scanExecutor(properties);
        executor.initialize();

        JsonRouteModelStore store = new JsonRouteModelStore(objectMapper);
        SyntaxScanner scanner = new SyntaxScanner(
                List.of(new ExpressRouteExtractor(), new GoRouteExtractor(), new SpringRouteExtractor(),
                        new FlaskRouteExtractor(), new FastApiRouteExtractor()),
                new FrameworkDetector());
        RouteExtractionService extraction = new RouteExtractionService(new SourceFileCollector(), scanner, executor);
        ConformanceVerificationService verification = new ConformanceVerificationService(
                new JsonSpecificationLoader(objectMapper), store, new Sat4jSatisfiabilityEngine(),
                new ConstraintModelBuilder(), new DiagnosticTranslator(),
                List.of(new SecurityAnalyzer(), new PerformanceAnalyzer(), new ConsistencyAnalyzer()), properties);
        runner = new HelioCliRunner(extraction, verification, store, new JsonReportWriter(objectMapper), properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void run_ShouldExitWithUsageOnUnknownCommand() {
        runner.run("deploy");

        assertEquals(HelioCliRunner.EXIT_USAGE, runner.getExitCode());
    }

    @Test
    void run_ShouldExitWithUsageWhenNothingToExtract() {
        runner.run("extract");

        assertEquals(HelioCliRunner.EXIT_USAGE, runner.getExitCode());
        assertFalse(Files.exists(tempDir.resolve("routes.json")));
    }

    @Test
    void run_ShouldExitWithUsageWhenSpecIsMissing() {
        properties.setSpecPath(tempDir.resolve("missing-spec.json").toString());

        runner.run("verify");

        assertEquals(HelioCliRunner.EXIT_USAGE, runner.getExitCode());
        assertTrue(Files.exists(tempDir.resolve("result.json")));
    }

    @Test
    void run_ShouldExtractAndVerifyConformingSources() throws IOException {
        // Arrange
        Path sources = Files.createDirectories(tempDir.resolve("services"));
        Files.writeString(sources.resolve("orders.js"),
                "app.post('/orders', authenticate, (req, res) => res.status(201).end());\napp.listen(3000);\n");
        Path spec = tempDir.resolve("spec.json");
        Files.writeString(spec, SPEC);
        properties.setSourceRoot(sources.toString());
        properties.setSpecPath(spec.toString());

        // Act
        runner.run("run");

        // Assert
        assertEquals(HelioCliRunner.EXIT_OK, runner.getExitCode());
        JsonNode routes = objectMapper.readTree(tempDir.resolve("routes.json").toFile());
        assertEquals(3000, routes.path("services").path("OrdersService").path("port").asInt());
        JsonNode result = objectMapper.readTree(tempDir.resolve("result.json").toFile());
        assertTrue(result.path("is_satisfiable").asBoolean());
    }

    @Test
    void run_ShouldExitWithViolationsWhenAuthIsMissing() throws IOException {
        Path source = tempDir.resolve("orders.js");
        Files.writeString(source, "app.post('/orders', (req, res) => res.end());\n");
        Path spec = tempDir.resolve("spec.json");
        Files.writeString(spec, SPEC);
        properties.setFiles(List.of(source.toString()));
        properties.setSpecPath(spec.toString());

        runner.run("extract");
        assertEquals(HelioCliRunner.EXIT_OK, runner.getExitCode());

        runner.run("verify");
        assertEquals(HelioCliRunner.EXIT_VIOLATIONS, runner.getExitCode());
        JsonNode result = objectMapper.readTree(tempDir.resolve("result.json").toFile());
        assertEquals("UNSATISFIABLE", result.path("outcome").asText());
        assertEquals(1, result.path("errors").size());
    }

    @Test
    void run_ShouldPreferConfiguredCommandOverArguments() {
        properties.setCommand("bogus");

        runner.run("extract");

        assertEquals(HelioCliRunner.EXIT_USAGE, runner.getExitCode());
    }
}
