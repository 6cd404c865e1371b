package com.vidnyan.helio.adapter.out.scanner;

import com.vidnyan.helio.application.port.out.RouteExtractor.Extraction;
import com.vidnyan.helio.domain.model.Framework;
import com.vidnyan.helio.domain.model.Route;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressRouteExtractorTest {

    private static final String SOURCE = """
            const express = require('express');
            const api = express.Router();
            const PORT = process.env.PORT || 3000;

            // app.get('/commented', handler)
            app.get('/', (req, res) => res.send('ok'));
            app.post('/orders', authenticate, validateOrder, async (req, res) => {
              res.json({ created: true });
            });
            api.delete("/orders/:id", requireAuth, orderController.remove);
            router.put(`/items/:id`, function update(req, res) { res.end(); });

            app.listen(PORT, () => console.log('up'));
            """;

    private final ExpressRouteExtractor extractor = new ExpressRouteExtractor();

    @Test
    void extract_ShouldFindRoutesInSourceOrder() {
        Extraction extraction = extractor.extract(Path.of("server.js"), SOURCE);

        List<Route> routes = extraction.routes();
        assertEquals(4, routes.size());
        assertEquals(List.of("GET", "POST", "DELETE", "PUT"), routes.stream().map(Route::method).toList());
        assertEquals(List.of("/", "/orders", "/orders/:id", "/items/:id"), routes.stream().map(Route::path).toList());
        assertEquals(List.of("get_root", "post_orders", "delete_orders_id", "put_items_id"),
                routes.stream().map(Route::name).toList());
        assertTrue(routes.stream().allMatch(r -> r.framework() == Framework.EXPRESS));
    }

    @Test
    void extract_ShouldSplitMiddlewareFromInlineHandler() {
        Route create = extractor.extract(Path.of("server.js"), SOURCE).routes().get(1);

        assertEquals(List.of("authenticate", "validateOrder"), create.middleware());
        assertEquals("async (req, res) => { res.json({ created: true }); }", create.handler());
    }

    @Test
    void extract_ShouldTreatLastArgumentAsHandlerWithoutInlineFunction() {
        List<Route> routes = extractor.extract(Path.of("server.js"), SOURCE).routes();

        assertEquals(List.of("requireAuth"), routes.get(2).middleware());
        assertEquals("orderController.remove", routes.get(2).handler());
        assertEquals(List.of(), routes.get(3).middleware());
        assertEquals("function update(req, res) { res.end(); }", routes.get(3).handler());
    }

    @Test
    void extract_ShouldResolvePortThroughIdentifier() {
        assertEquals(3000, extractor.extract(Path.of("server.js"), SOURCE).port());
    }

    @Test
    void port_ShouldReadLiteralAndRejectOutOfRange() {
        assertEquals(8080, ExpressRouteExtractor.port("app.listen(8080, () => {})"));
        assertEquals(4000, ExpressRouteExtractor.port("server.listen(process.env.APP_PORT || 4000)"));
        assertNull(ExpressRouteExtractor.port("app.listen(99999)"));
        assertNull(ExpressRouteExtractor.port("app.listen(config.port)"));
    }

    @Test
    void extract_ShouldIgnoreUnknownReceivers() {
        Extraction extraction = extractor.extract(Path.of("client.js"),
                "axios.get('/remote', handler);\nmap.get('key', fallback);\n");

        assertTrue(extraction.routes().isEmpty());
        assertNull(extraction.port());
    }
}
