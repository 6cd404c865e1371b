package com.vidnyan.helio.application.service;

import com.vidnyan.helio.application.port.in.VerifyConformanceUseCase;
import com.vidnyan.helio.application.port.out.DocumentLoadException;
import com.vidnyan.helio.application.port.out.RouteModelStore;
import com.vidnyan.helio.application.port.out.SatisfiabilityEngine;
import com.vidnyan.helio.application.port.out.SpecificationLoader;
import com.vidnyan.helio.config.HelioProperties;
import com.vidnyan.helio.domain.analysis.AnalysisInput;
import com.vidnyan.helio.domain.analysis.HeuristicAnalyzer;
import com.vidnyan.helio.domain.graph.CommunicationGraph;
import com.vidnyan.helio.domain.model.RouteModel;
import com.vidnyan.helio.domain.model.Specification;
import com.vidnyan.helio.domain.verification.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Main application service that orchestrates a verification run.
 *
 * Flow:
 * 1. Structural gate: cycles in the sync communication graph
 * 2. Constraint model: service and spec-route terms, auth policies as tracked assumptions
 * 3. Solve and translate blamed assumptions into errors
 * 4. Heuristic analyzers, on every branch
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConformanceVerificationService implements VerifyConformanceUseCase {

    private final SpecificationLoader specificationLoader;
    private final RouteModelStore routeModelStore;
    private final SatisfiabilityEngine satisfiabilityEngine;
    private final ConstraintModelBuilder constraintModelBuilder;
    private final DiagnosticTranslator diagnosticTranslator;
    private final List<HeuristicAnalyzer> analyzers;
    private final HelioProperties properties;

    @Override
    public VerificationResult verify(Path specPath, Path routesPath) {
        Specification specification;
        RouteModel implementation;
        try {
            specification = specificationLoader.load(specPath);
            implementation = routeModelStore.read(routesPath);
        } catch (DocumentLoadException e) {
            log.error("Aborting verification, {} document could not be loaded: {}",
                    e.getKind(), e.getMessage());
            return VerificationResult.loadFailure(e.getMessage());
        }
        return verify(specification, implementation);
    }

    @Override
    public VerificationResult verify(Specification specification, RouteModel implementation) {
        Instant startTime = Instant.now();
        log.info("Verifying {} spec routes against {} implementation routes",
                specification.routes().size(), implementation.metadata().totalRoutes());

        VerificationResult.Builder result = VerificationResult.builder();

        log.info("Step 1: Checking communication graph for cycles...");
        CommunicationGraph graph = CommunicationGraph.ofSyncEdges(specification.communications());
        List<List<String>> cycles = graph.findCycles();

        if (!cycles.isEmpty()) {
            log.info("Found {} circular dependencies, skipping symbolic solving", cycles.size());
            result.outcome(VerificationOutcome.UNSATISFIABLE)
                    .errors(cycles.stream().map(ConformanceVerificationService::formatCycle).toList());
        } else {
            solve(specification, implementation, result);
        }

        log.info("Step 4: Running {} heuristic analyzers...", analyzers.size());
        runAnalyzers(AnalysisInput.of(specification, implementation), result);

        VerificationResult verification = result.build();
        log.info("Verification complete: {} ({} errors, {} warnings, {} suggestions) in {}ms",
                verification.outcome(),
                verification.errors().size(),
                verification.warnings().size(),
                verification.suggestions().size(),
                Duration.between(startTime, Instant.now()).toMillis());
        return verification;
    }

    private void solve(Specification specification, RouteModel implementation, VerificationResult.Builder result) {
        log.info("Step 2: Building constraint model...");
        ConstraintModel model = constraintModelBuilder.build(specification, implementation.allRoutes());
        log.info("Model: {} terms, {} tracked assumptions", model.termCount(), model.assumptions().size());

        log.info("Step 3: Solving...");
        Duration deadline = properties.getSolver().getTimeout();
        SolveResult solved = satisfiabilityEngine.solve(
                model, deadline, properties.getSolver().isEnumerateAllViolations());

        switch (solved.status()) {
            case SATISFIABLE -> result.outcome(VerificationOutcome.SATISFIABLE)
                    .model(solved.assignment());
            case UNSATISFIABLE -> result.outcome(VerificationOutcome.UNSATISFIABLE)
                    .errors(diagnosticTranslator.translate(model, solved));
            case TIMEOUT -> {
                log.warn("Solver did not finish within {}: {}", deadline, solved.detail());
                result.outcome(VerificationOutcome.INCONCLUSIVE)
                        .error(String.format(
                                "Solver Timeout: verification was inconclusive after %d ms. "
                                        + "Increase helio.solver.timeout or reduce the model.",
                                deadline.toMillis()));
            }
        }
    }

    private void runAnalyzers(AnalysisInput input, VerificationResult.Builder result) {
        List<String> warnings = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        for (HeuristicAnalyzer analyzer : analyzers) {
            try {
                List<String> findings = analyzer.analyze(input);
                log.debug("  {} produced {} findings", analyzer.getName(), findings.size());
                switch (analyzer.channel()) {
                    case WARNING -> warnings.addAll(findings);
                    case SUGGESTION -> suggestions.addAll(findings);
                }
            } catch (RuntimeException e) {
                log.error("Error running analyzer {}: {}", analyzer.getName(), e.getMessage(), e);
                warnings.add("Analyzer Failure: " + analyzer.getName() + " could not complete: " + e.getMessage());
            }
        }

        result.warnings(warnings).suggestions(suggestions);
    }

    static String formatCycle(List<String> cycle) {
        List<String> closed = new ArrayList<>(cycle);
        closed.add(cycle.get(0));
        return "Architectural Error: Circular dependency detected: " + String.join(" -> ", closed);
    }
}
