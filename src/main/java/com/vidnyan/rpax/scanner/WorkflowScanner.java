package com.vidnyan.rpax.scanner;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Scans a project directory for workflow files.
 * Discovers all .xaml files (any case), minus those matching the exclude globs.
 */
@Slf4j
@Component
public class WorkflowScanner {

    private static final String XAML_EXTENSION = ".xaml";

    /**
     * Discovered workflows and the files dropped by exclude patterns, both sorted by relative path.
     */
    public record ScanResult(Path projectRoot, List<Path> workflows, List<String> excludedFiles) {}

    public ScanResult scan(Path projectRoot, List<String> excludePatterns) throws IOException {
        List<PathMatcher> matchers = excludePatterns.stream()
                .map(p -> FileSystems.getDefault().getPathMatcher("glob:" + p))
                .toList();

        List<Path> workflows = new ArrayList<>();
        List<String> excluded = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(projectRoot)) {
            List<Path> candidates = paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(XAML_EXTENSION))
                    .sorted(Comparator.comparing(p -> relativePath(projectRoot, p)))
                    .toList();
            for (Path candidate : candidates) {
                String relative = relativePath(projectRoot, candidate);
                if (isExcluded(relative, matchers)) {
                    excluded.add(relative);
                } else {
                    workflows.add(candidate);
                }
            }
        }

        log.info("Discovered {} workflows in {} ({} excluded)", workflows.size(), projectRoot, excluded.size());
        return new ScanResult(projectRoot, workflows, excluded);
    }

    /**
     * Project-relative path with forward slashes.
     */
    public static String relativePath(Path projectRoot, Path file) {
        return projectRoot.relativize(file).toString().replace('\\', '/');
    }

    private static boolean isExcluded(String relativePath, List<PathMatcher> matchers) {
        Path path = Path.of(relativePath);
        return matchers.stream().anyMatch(m -> m.matches(path));
    }
}
