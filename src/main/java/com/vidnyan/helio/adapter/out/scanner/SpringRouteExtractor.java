package com.vidnyan.helio.adapter.out.scanner;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.*;
import com.vidnyan.helio.application.port.out.RouteExtractor;
import com.vidnyan.helio.application.port.out.SourceParseException;
import com.vidnyan.helio.domain.model.Framework;
import com.vidnyan.helio.domain.model.Route;
import com.vidnyan.helio.domain.route.RouteNaming;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.*;

/**
 * Extracts routes from Spring MVC controllers with JavaParser.
 *
 * <p>A class-level {@code @RequestMapping} supplies base paths; method-level
 * {@code @GetMapping}-style annotations and {@code @RequestMapping(method = ...)} supply routes.
 * Every other annotation on the class or method (and {@code @Valid}/{@code @Validated} on
 * parameters) is recorded as middleware. A {@code @RequestMapping} without {@code method}
 * serves every verb and is recorded as {@code ANY}.</p>
 */
@Slf4j
@Component
public class SpringRouteExtractor implements RouteExtractor {

    static final String ANY_METHOD = "ANY";

    private static final String REQUEST_MAPPING = "RequestMapping";

    private static final Map<String, String> VERB_MAPPINGS = Map.of(
            "GetMapping", "GET",
            "PostMapping", "POST",
            "PutMapping", "PUT",
            "DeleteMapping", "DELETE",
            "PatchMapping", "PATCH");

    private static final Set<String> NOT_MIDDLEWARE = Set.of("Controller", "RestController", REQUEST_MAPPING,
            "Override", "ResponseBody", "ResponseStatus", "CrossOrigin", "SuppressWarnings", "Deprecated");

    private static final Set<String> VALIDATION_PARAMETER_ANNOTATIONS = Set.of("Valid", "Validated");

    @Override
    public Framework framework() {
        return Framework.SPRING;
    }

    @Override
    public Extraction extract(Path file, String content) throws SourceParseException {
        // JavaParser instances are not thread-safe; files are scanned concurrently
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        ParseResult<CompilationUnit> result = new JavaParser(config).parse(content);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problem = result.getProblems().isEmpty()
                    ? "unknown parse failure"
                    : result.getProblems().get(0).getMessage();
            throw new SourceParseException(file, problem);
        }

        List<Route> routes = new ArrayList<>();
        for (ClassOrInterfaceDeclaration type : result.getResult().get().findAll(ClassOrInterfaceDeclaration.class)) {
            routes.addAll(routesOf(type));
        }
        log.debug("Found {} Spring routes in {}", routes.size(), file);
        return new Extraction(routes, null);
    }

    private List<Route> routesOf(ClassOrInterfaceDeclaration type) {
        List<String> basePaths = List.of("");
        List<String> classMiddleware = new ArrayList<>();
        for (AnnotationExpr annotation : type.getAnnotations()) {
            String name = simpleName(annotation);
            if (name.equals(REQUEST_MAPPING)) {
                basePaths = paths(annotation);
            } else if (!NOT_MIDDLEWARE.contains(name)) {
                classMiddleware.add(name);
            }
        }

        List<Route> routes = new ArrayList<>();
        for (MethodDeclaration method : type.getMethods()) {
            List<String> verbs = new ArrayList<>();
            List<String> subPaths = List.of();
            List<String> middleware = new ArrayList<>(classMiddleware);

            for (AnnotationExpr annotation : method.getAnnotations()) {
                String name = simpleName(annotation);
                if (VERB_MAPPINGS.containsKey(name)) {
                    verbs.add(VERB_MAPPINGS.get(name));
                    subPaths = paths(annotation);
                } else if (name.equals(REQUEST_MAPPING)) {
                    verbs.addAll(requestMethods(annotation));
                    subPaths = paths(annotation);
                } else if (!NOT_MIDDLEWARE.contains(name)) {
                    middleware.add(name);
                }
            }
            if (verbs.isEmpty()) {
                continue;
            }
            for (Parameter parameter : method.getParameters()) {
                parameter.getAnnotations().stream()
                        .map(SpringRouteExtractor::simpleName)
                        .filter(VALIDATION_PARAMETER_ANNOTATIONS::contains)
                        .forEach(middleware::add);
            }

            String handler = type.getNameAsString() + "." + method.getNameAsString();
            for (String base : basePaths) {
                for (String sub : subPaths) {
                    String path = join(base, sub);
                    for (String verb : verbs) {
                        routes.add(Route.builder()
                                .name(RouteNaming.routeName(verb, path))
                                .method(verb)
                                .path(path)
                                .handler(handler)
                                .middleware(middleware)
                                .framework(Framework.SPRING)
                                .build());
                    }
                }
            }
        }
        return routes;
    }

    private static String simpleName(AnnotationExpr annotation) {
        return annotation.getName().getIdentifier();
    }

    /**
     * Literal paths from {@code value} or {@code path}; a mapping with none maps the empty path.
     */
    static List<String> paths(AnnotationExpr annotation) {
        Optional<Expression> value = Optional.empty();
        if (annotation instanceof SingleMemberAnnotationExpr single) {
            value = Optional.of(single.getMemberValue());
        } else if (annotation instanceof NormalAnnotationExpr normal) {
            value = normal.getPairs().stream()
                    .filter(pair -> pair.getNameAsString().equals("value") || pair.getNameAsString().equals("path"))
                    .map(MemberValuePair::getValue)
                    .findFirst();
        }

        List<String> paths = new ArrayList<>();
        value.ifPresent(expression -> {
            if (expression instanceof ArrayInitializerExpr array) {
                array.getValues().forEach(element -> paths.add(literal(element)));
            } else {
                paths.add(literal(expression));
            }
        });
        return paths.isEmpty() ? List.of("") : paths;
    }

    private static List<String> requestMethods(AnnotationExpr annotation) {
        if (!(annotation instanceof NormalAnnotationExpr normal)) {
            return List.of(ANY_METHOD);
        }
        List<String> methods = new ArrayList<>();
        normal.getPairs().stream()
                .filter(pair -> pair.getNameAsString().equals("method"))
                .map(MemberValuePair::getValue)
                .forEach(expression -> {
                    if (expression instanceof ArrayInitializerExpr array) {
                        array.getValues().forEach(element -> methods.add(constantName(element)));
                    } else {
                        methods.add(constantName(expression));
                    }
                });
        return methods.isEmpty() ? List.of(ANY_METHOD) : methods;
    }

    // RequestMethod.GET or a statically imported GET
    private static String constantName(Expression expression) {
        if (expression instanceof FieldAccessExpr field) {
            return field.getNameAsString().toUpperCase(Locale.ROOT);
        }
        if (expression instanceof NameExpr name) {
            return name.getNameAsString().toUpperCase(Locale.ROOT);
        }
        return ANY_METHOD;
    }

    private static String literal(Expression expression) {
        return expression instanceof StringLiteralExpr string ? string.asString().trim() : "";
    }

    static String join(String base, String sub) {
        String prefix = base.isEmpty() || base.startsWith("/") ? base : "/" + base;
        String suffix = sub.isEmpty() || sub.startsWith("/") ? sub : "/" + sub;
        if (prefix.endsWith("/") && suffix.startsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        String path = prefix + suffix;
        return path.isEmpty() ? "/" : path;
    }
}
