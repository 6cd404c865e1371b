package com.vidnyan.helio.application.service;

import com.vidnyan.helio.application.port.in.ExtractRoutesUseCase;
import com.vidnyan.helio.application.port.out.DocumentLoadException;
import com.vidnyan.helio.application.port.out.DocumentLoadException.DocumentKind;
import com.vidnyan.helio.application.port.out.SourceScanner;
import com.vidnyan.helio.application.port.out.SourceScanner.ScannedFile;
import com.vidnyan.helio.application.port.out.SourceTreeWalker;
import com.vidnyan.helio.domain.model.RouteModel;
import com.vidnyan.helio.domain.model.Service;
import com.vidnyan.helio.domain.route.RouteDeduplicator;
import com.vidnyan.helio.domain.route.RouteNaming;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskExecutor;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Builds the implementation route model from source files.
 *
 * Files are scanned concurrently; services are named and stored in input order afterwards, so
 * collision suffixes do not depend on scheduling.
 */
@Slf4j
@org.springframework.stereotype.Service
@RequiredArgsConstructor
public class RouteExtractionService implements ExtractRoutesUseCase {

    private final SourceTreeWalker sourceTreeWalker;
    private final SourceScanner sourceScanner;
    private final TaskExecutor scanExecutor;

    @Override
    public RouteModel extract(ExtractionRequest request) {
        Instant startTime = Instant.now();

        log.info("Step 1: Resolving source files...");
        List<Path> files = resolveFiles(request);
        log.info("Found {} source files", files.size());

        log.info("Step 2: Scanning files...");
        List<CompletableFuture<ScannedFile>> pending = new ArrayList<>();
        for (Path file : files) {
            pending.add(CompletableFuture.supplyAsync(() -> sourceScanner.scan(file), scanExecutor)
                    .exceptionally(e -> {
                        log.warn("Extraction failed for {}: {}", file, e.getMessage(), e);
                        return ScannedFile.unknown(file);
                    }));
        }

        log.info("Step 3: Building services...");
        Map<String, Service> services = new LinkedHashMap<>();
        for (CompletableFuture<ScannedFile> future : pending) {
            ScannedFile scanned = future.join();
            String name = RouteNaming.uniqueServiceName(scanned.file().getFileName().toString(), services.keySet());
            services.put(name, new Service(
                    name,
                    scanned.port(),
                    scanned.file().toString(),
                    scanned.framework(),
                    RouteDeduplicator.deduplicate(scanned.routes())));
            log.debug("  {} <- {} ({}, {} routes)", name, scanned.file(), scanned.framework().label(),
                    services.get(name).routes().size());
        }

        RouteModel model = new RouteModel(services);
        log.info("Extraction complete: {} services, {} routes in {}ms",
                model.metadata().totalServices(),
                model.metadata().totalRoutes(),
                Duration.between(startTime, Instant.now()).toMillis());
        return model;
    }

    private List<Path> resolveFiles(ExtractionRequest request) {
        if (!request.files().isEmpty()) {
            return request.files();
        }
        if (request.sourceRoot() == null) {
            return List.of();
        }
        try {
            return sourceTreeWalker.collect(request.sourceRoot());
        } catch (IOException e) {
            throw new DocumentLoadException(DocumentKind.SOURCE_TREE,
                    "Cannot walk source root " + request.sourceRoot() + ": " + e.getMessage(), e);
        }
    }
}
