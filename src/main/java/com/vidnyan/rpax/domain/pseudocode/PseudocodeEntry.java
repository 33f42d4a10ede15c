package com.vidnyan.rpax.domain.pseudocode;

/**
 * One pseudocode line, bound to the activity it describes.
 *
 * @param indent nesting level below the workflow's top-level activities
 * @param invocation true when the activity invokes another workflow file
 */
public record PseudocodeEntry(
    int indent,
    String displayName,
    String activityType,
    String nodeId,
    String activityId,
    int depth,
    boolean visible,
    boolean invocation,
    String invocationTarget,
    String formattedLine
) {}
