package com.vidnyan.rpax.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Project declaration read from {@code project.json}.
 */
public record ProjectDescriptor(
    String name,
    String projectId,
    String slug,
    String description,
    String main,
    String expressionLanguage,
    String outputType,
    String schemaVersion,
    Map<String, String> dependencies,
    List<EntryPoint> entryPoints
) {

    public record EntryPoint(String filePath, String uniqueId) {}

    public ProjectDescriptor {
        dependencies = dependencies == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(dependencies));
        entryPoints = entryPoints == null ? List.of() : List.copyOf(entryPoints);
    }

    /**
     * Main workflow followed by declared entry points, POSIX-normalized and de-duplicated.
     */
    public List<String> entryPointPaths() {
        Set<String> paths = new LinkedHashSet<>();
        if (main != null && !main.isBlank()) {
            paths.add(normalize(main));
        }
        for (EntryPoint entryPoint : entryPoints) {
            if (entryPoint.filePath() != null && !entryPoint.filePath().isBlank()) {
                paths.add(normalize(entryPoint.filePath()));
            }
        }
        return new ArrayList<>(paths);
    }

    /**
     * Identifier used for graph artifacts, falling back to the project name.
     */
    public String effectiveProjectId() {
        if (projectId != null && !projectId.isBlank()) {
            return projectId;
        }
        return "project-" + (name == null ? "unnamed" : name.toLowerCase(Locale.ROOT));
    }

    public boolean isLibrary() {
        return "library".equalsIgnoreCase(outputType);
    }

    private static String normalize(String path) {
        String posix = path.replace('\\', '/');
        return posix.startsWith("./") ? posix.substring(2) : posix;
    }
}
