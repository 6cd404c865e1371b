package com.vidnyan.helio.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for extraction and verification.
 * Can be configured via application.yml or {@code --helio.*} command-line arguments.
 */
@Data
@Component
@ConfigurationProperties(prefix = "helio")
public class HelioProperties {

    /**
     * extract, verify or run (extract then verify). Empty prints usage.
     */
    private String command = "";

    /**
     * Directory walked for source files when no explicit files are given.
     */
    private String sourceRoot = "";

    /**
     * Explicit source files to extract routes from.
     */
    private List<String> files = new ArrayList<>();

    private String specPath = "";

    /**
     * Implementation route document: written by extract, read by verify.
     */
    private String routesPath = "routes.json";

    private String resultPath = "verification_result.json";

    private Scan scan = new Scan();

    private Solver solver = new Solver();

    @Data
    public static class Scan {

        /**
         * Worker threads for per-file extraction.
         */
        private int threads = Runtime.getRuntime().availableProcessors();
    }

    @Data
    public static class Solver {

        /**
         * Deadline for one decision-procedure call, minimal-core extraction included.
         */
        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Report every violated requirement instead of the first minimal core only.
         */
        private boolean enumerateAllViolations = true;
    }
}
