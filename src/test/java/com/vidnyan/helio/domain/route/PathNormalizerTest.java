package com.vidnyan.helio.domain.route;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PathNormalizerTest {

    @Test
    void normalize_ShouldDropTrailingSlashButKeepRoot() {
        assertEquals("/orders", PathNormalizer.normalize("/orders/"));
        assertEquals("/orders", PathNormalizer.normalize("/orders//"));
        assertEquals("/", PathNormalizer.normalize("/"));
        assertEquals("/", PathNormalizer.normalize("///"));
        assertEquals("", PathNormalizer.normalize(""));
        assertEquals("", PathNormalizer.normalize(null));
    }

    @Test
    void normalize_ShouldUnifyParameterNotations() {
        assertEquals("/users/{id}", PathNormalizer.normalize("/users/:id"));
        assertEquals("/users/{id}", PathNormalizer.normalize("/users/<id>"));
        assertEquals("/users/{id}", PathNormalizer.normalize("/users/<int:id>/"));
        assertEquals("/users/{id}", PathNormalizer.normalize("/users/{id}"));
        assertEquals("/a/{x}/b/{y}", PathNormalizer.normalize(" /a/:x/b/<path:y> "));
    }

    @Test
    void normalize_ShouldDropWhitespaceExposedByTrailingSlashes() {
        assertEquals("/a", PathNormalizer.normalize("/a/ /"));
        assertEquals("/", PathNormalizer.normalize("/ /"));
    }

    @Test
    void normalize_ShouldBeIdempotent() {
        List<String> samples = List.of("/orders/", "/", "", "//", " /a/:id/ ", "/u/<int:id>", "/x/{y}//", "orders",
                "/a/ /", "/a/\t/ ", "/a\u0000/");
        for (String sample : samples) {
            String once = PathNormalizer.normalize(sample);
            assertEquals(once, PathNormalizer.normalize(once), "not idempotent for '" + sample + "'");
        }
    }

    @Test
    void hasParameter_ShouldDetectEveryNotation() {
        assertTrue(PathNormalizer.hasParameter("/users/:id"));
        assertTrue(PathNormalizer.hasParameter("/users/{id}"));
        assertTrue(PathNormalizer.hasParameter("/users/<int:id>"));
        assertTrue(PathNormalizer.hasParameter("/users/<id>"));
        assertFalse(PathNormalizer.hasParameter("/users"));
        assertFalse(PathNormalizer.hasParameter(null));
    }

    @Test
    void samePath_ShouldCompareNormalizedForms() {
        assertTrue(PathNormalizer.samePath("/orders/:id/", "/orders/{id}"));
        assertFalse(PathNormalizer.samePath("/orders", "/order"));
    }
}
