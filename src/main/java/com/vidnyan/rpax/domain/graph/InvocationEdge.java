package com.vidnyan.rpax.domain.graph;

import com.vidnyan.rpax.domain.invocation.InvocationKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outgoing edge of a workflow node. {@code targetId} is a weak reference and may be null
 * for dynamic, missing and coded invocations.
 */
public record InvocationEdge(
    String sourceId,
    String targetPath,
    String targetId,
    InvocationKind kind,
    Map<String, String> arguments,
    String nodeId,
    String activityName
) {

    public InvocationEdge {
        arguments = arguments == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public boolean isResolved() {
        return targetId != null;
    }

    /**
     * Static, resolved edges are the only ones followed for depth and cycles.
     */
    public boolean isTraversable() {
        return kind == InvocationKind.STATIC && targetId != null;
    }
}
