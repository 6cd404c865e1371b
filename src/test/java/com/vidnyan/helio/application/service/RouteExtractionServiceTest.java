package com.vidnyan.helio.application.service;

import com.vidnyan.helio.application.port.in.ExtractRoutesUseCase.ExtractionRequest;
import com.vidnyan.helio.application.port.out.DocumentLoadException;
import com.vidnyan.helio.application.port.out.SourceScanner;
import com.vidnyan.helio.application.port.out.SourceScanner.ScannedFile;
import com.vidnyan.helio.application.port.out.SourceTreeWalker;
import com.vidnyan.helio.domain.model.Framework;
import com.vidnyan.helio.domain.model.Route;
import com.vidnyan.helio.domain.model.RouteModel;
import com.vidnyan.helio.domain.model.Service;
import com.vidnyan.helio.config.HelioConfiguration;
import com.vidnyan.helio.config.HelioProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RouteExtractionServiceTest {

    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        HelioProperties properties = new HelioProperties();
        properties.getScan().setThreads(3);
        executor = new HelioConfiguration().scanExecutor(properties);
        executor.initialize();
    }

    @AfterEach
    void shutdown() {
        executor.shutdown();
    }

    @Test
    void extract_ShouldSuffixCollidingServiceNamesInInputOrder() {
        SourceScanner scanner = file -> new ScannedFile(file, Framework.EXPRESS, List.of(route("/a", "h")), 3000);
        RouteExtractionService service = new RouteExtractionService(root -> List.of(), scanner, executor);

        RouteModel model = service.extract(ExtractionRequest.forFiles(List.of(
                Path.of("one/user-api.js"), Path.of("two/user-api.js"), Path.of("three/user-api.ts"))));

        assertEquals(List.of("UserApiService", "UserApiService2", "UserApiService3"),
                List.copyOf(model.services().keySet()));
        assertEquals("one/user-api.js", model.services().get("UserApiService").sourcePath());
        assertEquals("three/user-api.ts", model.services().get("UserApiService3").sourcePath());
        assertEquals(3, model.metadata().totalRoutes());
    }

    @Test
    void extract_ShouldDeduplicateRoutesWithinFile() {
        SourceScanner scanner = file -> new ScannedFile(file, Framework.FLASK,
                List.of(route("/a", "h"), route("/a", "h"), route("/a", "other")), 5000);
        RouteExtractionService service = new RouteExtractionService(root -> List.of(), scanner, executor);

        RouteModel model = service.extract(ExtractionRequest.forFiles(List.of(Path.of("app.py"))));

        Service app = model.services().get("AppService");
        assertEquals(2, app.routes().size());
        assertEquals(Framework.FLASK, app.framework());
        assertEquals(5000, app.port());
    }

    @Test
    void extract_ShouldTurnScannerFailureIntoUnknownService() {
        SourceScanner scanner = file -> {
            if (file.toString().endsWith("bad.go")) {
                throw new IllegalStateException("scanner bug");
            }
            return new ScannedFile(file, Framework.GO, List.of(route("/ok", "ok")), 8080);
        };
        RouteExtractionService service = new RouteExtractionService(root -> List.of(), scanner, executor);

        RouteModel model = service.extract(ExtractionRequest.forFiles(List.of(Path.of("bad.go"), Path.of("good.go"))));

        Service bad = model.services().get("BadService");
        assertEquals(Framework.UNKNOWN, bad.framework());
        assertTrue(bad.routes().isEmpty());
        assertNull(bad.port());
        assertEquals(1, model.services().get("GoodService").routes().size());
    }

    @Test
    void extract_ShouldWalkSourceRootWhenNoFilesGiven() {
        SourceTreeWalker walker = root -> List.of(root.resolve("orders.js"));
        SourceScanner scanner = file -> ScannedFile.unknown(file);
        RouteExtractionService service = new RouteExtractionService(walker, scanner, executor);

        RouteModel model = service.extract(ExtractionRequest.forRoot(Path.of("src")));

        assertEquals(List.of("OrdersService"), List.copyOf(model.services().keySet()));
    }

    @Test
    void extract_ShouldFailWhenSourceRootCannotBeWalked() {
        SourceTreeWalker walker = root -> {
            throw new IOException("permission denied");
        };
        RouteExtractionService service = new RouteExtractionService(walker, ScannedFile::unknown, executor);

        DocumentLoadException e = assertThrows(DocumentLoadException.class,
                () -> service.extract(ExtractionRequest.forRoot(Path.of("src"))));
        assertEquals(DocumentLoadException.DocumentKind.SOURCE_TREE, e.getKind());
    }

    @Test
    void extract_ShouldReturnEmptyModelWithoutInput() {
        RouteExtractionService service = new RouteExtractionService(root -> List.of(), ScannedFile::unknown, executor);

        RouteModel model = service.extract(new ExtractionRequest(List.of(), null));

        assertTrue(model.services().isEmpty());
    }

    private Route route(String path, String handler) {
        return Route.builder()
                .name("get" + path.replace('/', '_'))
                .method("GET")
                .path(path)
                .handler(handler)
                .build();
    }
}
