package com.vidnyan.helio.adapter.out.scanner;

import com.vidnyan.helio.application.port.out.SourceTreeWalker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scans a source tree for files any route extractor can read.
 * Build output, dependency and VCS directories are not descended into.
 */
@Slf4j
@Component
public class SourceFileCollector implements SourceTreeWalker {

    static final Set<String> SOURCE_EXTENSIONS = Set.of(".js", ".ts", ".py", ".go", ".java");

    private static final Set<String> SKIPPED_DIRECTORIES = Set.of(
            ".git", ".idea", "build", "target", "node_modules", "__pycache__", "venv", ".venv", "vendor");

    /**
     * Scan and return all source files under the root, sorted by path.
     */
    @Override
    public List<Path> collect(Path root) throws IOException {
        List<Path> sourceFiles = new ArrayList<>();

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && SKIPPED_DIRECTORIES.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && isSourceFile(file)) {
                    sourceFiles.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });

        sourceFiles.sort(null);
        log.debug("Collected {} source files under {}", sourceFiles.size(), root);
        return sourceFiles;
    }

    public static boolean isSourceFile(Path file) {
        return SOURCE_EXTENSIONS.contains(extension(file));
    }

    /**
     * Lower-cased extension including the dot, or empty.
     */
    public static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
