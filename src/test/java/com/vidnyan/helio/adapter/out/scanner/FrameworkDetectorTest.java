package com.vidnyan.helio.adapter.out.scanner;

import com.vidnyan.helio.adapter.out.scanner.python.PythonSyntaxWalker;
import com.vidnyan.helio.application.port.out.SourceParseException;
import com.vidnyan.helio.domain.model.Framework;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FrameworkDetectorTest {

    private final FrameworkDetector detector = new FrameworkDetector();

    @Test
    void detectPython_ShouldMatchFastApiImport() throws SourceParseException {
        assertEquals(FrameworkMatch.single(Framework.FASTAPI), detect("from fastapi import APIRouter\n"));
    }

    @Test
    void detectPython_ShouldMatchFlaskByConstructor() throws SourceParseException {
        assertEquals(FrameworkMatch.single(Framework.FLASK), detect("bp = Blueprint('bp', __name__)\n"));
    }

    @Test
    void detectPython_ShouldReportAmbiguousMarkers() throws SourceParseException {
        assertEquals(FrameworkMatch.Kind.AMBIGUOUS,
                detect("import flask\nimport fastapi\n").kind());
    }

    @Test
    void detectPython_ShouldReportNoMarkers() throws SourceParseException {
        assertEquals(FrameworkMatch.none(), detect("import os\nprint(os.getcwd())\n"));
    }

    @Test
    void frameworkMatch_ShouldRejectFrameworkOnNonSingleKind() {
        assertThrows(IllegalArgumentException.class,
                () -> new FrameworkMatch(FrameworkMatch.Kind.NONE, Framework.FLASK));
    }

    private FrameworkMatch detect(String source) throws SourceParseException {
        return detector.detectPython(
                PythonSyntaxWalker.walk(Path.of("app.py"), source), source);
    }
}
