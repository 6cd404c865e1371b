package com.vidnyan.helio.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.helio.application.port.out.RouteExtractor;
import com.vidnyan.helio.domain.analysis.HeuristicAnalyzer;
import com.vidnyan.helio.domain.verification.ConstraintModelBuilder;
import com.vidnyan.helio.domain.verification.DiagnosticTranslator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;

/**
 * Spring configuration for helio components.
 * Wires the framework-free domain pieces into the application services.
 */
@Slf4j
@Configuration
public class HelioConfiguration {

    /**
     * ObjectMapper for JSON documents.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public ConstraintModelBuilder constraintModelBuilder() {
        return new ConstraintModelBuilder();
    }

    @Bean
    public DiagnosticTranslator diagnosticTranslator() {
        return new DiagnosticTranslator();
    }

    /**
     * Worker pool for per-file route extraction.
     */
    @Bean
    public ThreadPoolTaskExecutor scanExecutor(HelioProperties properties) {
        int threads = Math.max(1, properties.getScan().getThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("helio-scan-");
        executor.setDaemon(true);
        return executor;
    }

    /**
     * Log available extractors and analyzers on startup.
     */
    @Bean
    public String logComponents(List<RouteExtractor> extractors, List<HeuristicAnalyzer> analyzers) {
        log.info("Registered {} route extractors:", extractors.size());
        extractors.forEach(e -> log.info("  - {} ({})", e.getClass().getSimpleName(), e.framework().label()));
        log.info("Registered {} heuristic analyzers:", analyzers.size());
        analyzers.forEach(a -> log.info("  - {}", a.getName()));
        return "components-logged";
    }
}
