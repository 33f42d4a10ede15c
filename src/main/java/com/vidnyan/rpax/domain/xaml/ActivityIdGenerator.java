package com.vidnyan.rpax.domain.xaml;

import com.vidnyan.rpax.domain.model.AttributeValue;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Deterministic, content-addressed activity identifiers:
 * {@code projectId#workflowId#nodeId#hash8}.
 * <p>
 * The hash covers the activity type, its arguments, its business properties and the key
 * set of its configuration. Designer metadata is never part of it.
 */
public final class ActivityIdGenerator {

    public static final int HASH_LENGTH = 8;
    private static final String XAML_EXTENSION = ".xaml";

    private ActivityIdGenerator() {
    }

    /**
     * Workflow id for a project-relative path: POSIX separators, no leading "./", no .xaml suffix.
     */
    public static String workflowId(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            return "unknown";
        }
        String id = normalizePath(relativePath);
        if (id.toLowerCase(Locale.ROOT).endsWith(XAML_EXTENSION)) {
            id = id.substring(0, id.length() - XAML_EXTENSION.length());
        }
        return id;
    }

    /**
     * POSIX form of a path as written in a workflow or on disk.
     */
    public static String normalizePath(String path) {
        String posix = path.trim().replace('\\', '/');
        while (posix.startsWith("./")) {
            posix = posix.substring(2);
        }
        return posix.replaceAll("/{2,}", "/");
    }

    /**
     * Canonical serialization of the identity-bearing content of an activity.
     */
    public static String canonicalContent(String activityType,
                                          Map<String, String> arguments,
                                          Map<String, AttributeValue> properties,
                                          Iterable<String> configurationKeys) {
        String args = new TreeMap<>(arguments).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(",", "[", "]"));
        String props = new TreeMap<>(properties).entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue().render())
                .collect(Collectors.joining(",", "[", "]"));
        TreeSet<String> keys = new TreeSet<>();
        configurationKeys.forEach(keys::add);
        return "type=" + activityType
                + "|arguments=" + args
                + "|properties=" + props
                + "|config_keys=" + String.join(",", keys);
    }

    public static String contentHash(String canonicalContent) {
        return ContentHasher.shortHash(canonicalContent, HASH_LENGTH);
    }

    public static String activityId(String projectId, String workflowId, String nodeId, String canonicalContent) {
        return String.format("%s#%s#%s#%s", projectId, workflowId, nodeId, contentHash(canonicalContent));
    }
}
