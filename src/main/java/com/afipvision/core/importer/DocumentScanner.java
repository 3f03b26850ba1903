package com.afipvision.core.importer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Ищет изображения документов под каталогом по glob-маскам (import.patterns). */
public final class DocumentScanner {
    private static final Logger log = LoggerFactory.getLogger(DocumentScanner.class);

    static final List<String> DEFAULT_PATTERNS =
            List.of("**/*.png", "**/*.jpg", "**/*.jpeg", "**/*.tif", "**/*.tiff");

    private final List<PathMatcher> matchers;

    public DocumentScanner(List<String> patterns) {
        var pats = (patterns == null || patterns.isEmpty()) ? DEFAULT_PATTERNS : patterns;
        List<PathMatcher> ms = new ArrayList<>();
        for (String p : pats) {
            ms.add(FileSystems.getDefault().getPathMatcher("glob:" + p.toLowerCase(Locale.ROOT)));
            // "**/*.png" не совпадает с файлом в самом корне
            if (p.startsWith("**/")) {
                ms.add(FileSystems.getDefault().getPathMatcher("glob:" + p.substring(3).toLowerCase(Locale.ROOT)));
            }
        }
        this.matchers = List.copyOf(ms);
    }

    /** Отсортированный список подходящих файлов. Нечитаемый корень — UncheckedIOException. */
    public List<Path> scan(Path root) {
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("not a directory: " + root);
        }
        List<Path> found;
        try (Stream<Path> s = Files.walk(root)) {
            found = s.filter(Files::isRegularFile)
                    .filter(p -> matches(root, p))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("scan failed: " + root, e);
        }
        log.info("scan done: {} documents under {}", found.size(), root);
        return found;
    }

    boolean matches(Path root, Path file) {
        Path rel = Path.of(root.relativize(file).toString().toLowerCase(Locale.ROOT));
        Path name = rel.getFileName();
        for (PathMatcher m : matchers) {
            if (m.matches(rel) || (name != null && m.matches(name))) return true;
        }
        return false;
    }
}
