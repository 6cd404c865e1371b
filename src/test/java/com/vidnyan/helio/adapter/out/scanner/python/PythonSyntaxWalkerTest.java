package com.vidnyan.helio.adapter.out.scanner.python;

import com.vidnyan.helio.application.port.out.SourceParseException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PythonSyntaxWalkerTest {

    @Test
    void walk_ShouldReportImportsWithoutAliases() throws SourceParseException {
        List<SyntaxEvent> events = walk("import flask.views as fv, os\nfrom fastapi import FastAPI\n");

        assertEquals(new SyntaxEvent.ImportSeen(1, List.of("flask.views", "os")), events.get(0));
        assertEquals(new SyntaxEvent.ImportSeen(2, List.of("fastapi", "fastapi")), events.get(1));
    }

    @Test
    void walk_ShouldReportChainedBindingTargets() throws SourceParseException {
        List<SyntaxEvent> events = walk("app = api = FastAPI(title='x')\n");

        SyntaxEvent.BindingIntroduced binding = (SyntaxEvent.BindingIntroduced) events.get(0);
        assertEquals(List.of("app", "api"), binding.targets());
        assertEquals(new PyExpr.Name("FastAPI"), binding.value().func());
        assertEquals(new PyExpr.Str("x"), binding.value().keyword("title").orElseThrow());
    }

    @Test
    void walk_ShouldNotBindNonCallValues() throws SourceParseException {
        List<SyntaxEvent> events = walk("app = other\nport = make() + 1\n");

        assertTrue(events.stream().noneMatch(SyntaxEvent.BindingIntroduced.class::isInstance));
    }

    @Test
    void walk_ShouldAttachDecoratorsToFollowingDef() throws SourceParseException {
        List<SyntaxEvent> events = walk("""
                @app.get("/items", tags=["a"])
                @cache
                async def list_items():
                    return []
                """);

        List<SyntaxEvent.DeclarationSeen> declarations = events.stream()
                .filter(SyntaxEvent.DeclarationSeen.class::isInstance)
                .map(SyntaxEvent.DeclarationSeen.class::cast)
                .toList();
        assertEquals(1, declarations.size());
        assertEquals("list_items", declarations.get(0).function());
        assertEquals(2, declarations.get(0).markers().size());
        assertEquals(new PyExpr.Name("cache"), declarations.get(0).markers().get(1));
        PyExpr.Call route = (PyExpr.Call) declarations.get(0).markers().get(0);
        assertEquals(List.of(new PyExpr.Str("/items")), route.args());
    }

    @Test
    void walk_ShouldDropDecoratorsOfClasses() throws SourceParseException {
        List<SyntaxEvent> events = walk("@dataclass\nclass Item:\n    pass\n\ndef plain():\n    pass\n");

        assertTrue(events.stream().noneMatch(SyntaxEvent.DeclarationSeen.class::isInstance));
    }

    @Test
    void walk_ShouldReportNestedCalls() throws SourceParseException {
        List<SyntaxEvent> events = walk("uvicorn.run(create_app(), port=8000)\n");

        List<PyExpr.Call> calls = events.stream()
                .filter(SyntaxEvent.CallSeen.class::isInstance)
                .map(event -> ((SyntaxEvent.CallSeen) event).call())
                .toList();
        assertEquals(2, calls.size());
        assertEquals(new PyExpr.Attribute(new PyExpr.Name("uvicorn"), "run"), calls.get(0).func());
        assertEquals(new PyExpr.Int(8000), calls.get(0).keyword("port").orElseThrow());
        assertEquals(new PyExpr.Name("create_app"), calls.get(1).func());
    }

    @Test
    void walk_ShouldDecodeStringLiterals() throws SourceParseException {
        PyExpr.Call call = firstCall(walk(
                "call('it\\'s', r'\\d+', f'{x}', \"\"\"multi\nline\"\"\", 'con' 'cat', b'raw')\n"));

        assertEquals(new PyExpr.Str("it's"), call.args().get(0));
        assertEquals(new PyExpr.Str("\\d+"), call.args().get(1));
        assertInstanceOf(PyExpr.Opaque.class, call.args().get(2));
        assertEquals(new PyExpr.Str("multi\nline"), call.args().get(3));
        assertEquals(new PyExpr.Str("concat"), call.args().get(4));
        assertInstanceOf(PyExpr.Opaque.class, call.args().get(5));
    }

    @Test
    void walk_ShouldReadIntegerLiterals() throws SourceParseException {
        PyExpr.Call call = firstCall(walk("run(port=8_000, offset=-3, ratio=1.5, mask=0x1F)\n"));

        assertEquals(new PyExpr.Int(8000), call.keyword("port").orElseThrow());
        assertEquals(new PyExpr.Int(-3), call.keyword("offset").orElseThrow());
        assertInstanceOf(PyExpr.Opaque.class, call.keyword("ratio").orElseThrow());
        assertInstanceOf(PyExpr.Opaque.class, call.keyword("mask").orElseThrow());
    }

    @Test
    void walk_ShouldReadMethodsSequences() throws SourceParseException {
        PyExpr.Call call = firstCall(walk("route('/a', methods=('GET', 'POST'), tags={'x'}, extra={'k': 1})\n"));

        assertEquals(new PyExpr.Sequence(List.of(new PyExpr.Str("GET"), new PyExpr.Str("POST"))),
                call.keyword("methods").orElseThrow());
        assertEquals(new PyExpr.Sequence(List.of(new PyExpr.Str("x"))), call.keyword("tags").orElseThrow());
        assertInstanceOf(PyExpr.Opaque.class, call.keyword("extra").orElseThrow());
    }

    @Test
    void walk_ShouldRejectSyntaxErrors() {
        SourceParseException e = assertThrows(SourceParseException.class, () -> walk("x = 'open\n"));
        assertTrue(e.getMessage().contains("line 1"));
        assertEquals(Path.of("app.py"), e.getFile());

        assertThrows(SourceParseException.class, () -> walk("x = (1]\n"));
        assertThrows(SourceParseException.class, () -> walk("x = [1, 2\n"));
        assertThrows(SourceParseException.class, () -> walk("x = 1)\n"));
        assertThrows(SourceParseException.class, () -> walk("x = $y\n"));
        assertThrows(SourceParseException.class, () -> walk("def f():\nreturn 1\n"));
    }

    @Test
    void walk_ShouldAcceptCombiningMarksInNames() throws SourceParseException {
        List<SyntaxEvent> events = walk("cafe\u0301 = FastAPI()\n");

        SyntaxEvent.BindingIntroduced binding = (SyntaxEvent.BindingIntroduced) events.get(0);
        assertEquals(List.of("cafe\u0301"), binding.targets());
    }

    @Test
    void walk_ShouldBindAnnotatedAssignments() throws SourceParseException {
        List<SyntaxEvent> events = walk("app: FastAPI = FastAPI()\nitems: list\n");

        List<SyntaxEvent.BindingIntroduced> bindings = events.stream()
                .filter(SyntaxEvent.BindingIntroduced.class::isInstance)
                .map(SyntaxEvent.BindingIntroduced.class::cast)
                .toList();
        assertEquals(1, bindings.size());
        assertEquals(List.of("app"), bindings.get(0).targets());
    }

    @Test
    void walk_ShouldParseModernModule() throws SourceParseException {
        List<SyntaxEvent> events = walk("""
                from typing import Optional
                import asyncio

                app = FastAPI()


                class Item(BaseModel):
                    name: str
                    price: Optional[float] = None


                @app.post("/items/{item_id}", status_code=201)
                async def create(item_id: int, item: Item, *, q: str | None = None, **extra) -> dict:
                    if (n := len(item.name)) > 3:
                        data = {k: v for k, v in extra.items()}
                    match item.name:
                        case "a" | "b":
                            return {"kind": "short"}
                        case Point(x=0, y=_):
                            pass
                        case [first, *rest]:
                            pass
                        case _:
                            pass
                    async with lock:
                        await asyncio.sleep(0)
                    try:
                        values = [x * 2 for x in range(3) if x]
                    except (ValueError, KeyError) as e:
                        raise RuntimeError(f"bad {e!r}") from e
                    finally:
                        pass
                    return {"id": item_id, **data}""");

        List<SyntaxEvent.DeclarationSeen> declarations = events.stream()
                .filter(SyntaxEvent.DeclarationSeen.class::isInstance)
                .map(SyntaxEvent.DeclarationSeen.class::cast)
                .toList();
        assertEquals(1, declarations.size());
        assertEquals("create", declarations.get(0).function());
        assertTrue(events.stream()
                .filter(SyntaxEvent.CallSeen.class::isInstance)
                .map(event -> ((SyntaxEvent.CallSeen) event).call().func())
                .anyMatch(new PyExpr.Attribute(new PyExpr.Name("asyncio"), "sleep")::equals));
    }

    private static PyExpr.Call firstCall(List<SyntaxEvent> events) {
        return events.stream()
                .filter(SyntaxEvent.CallSeen.class::isInstance)
                .map(event -> ((SyntaxEvent.CallSeen) event).call())
                .findFirst()
                .orElseThrow();
    }

    private List<SyntaxEvent> walk(String source) throws SourceParseException {
        return PythonSyntaxWalker.walk(Path.of("app.py"), source);
    }
}
