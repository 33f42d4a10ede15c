package com.vidnyan.rpax.domain.model;

/**
 * Failure while extracting a single activity. Recorded, never thrown across the tree.
 */
public record ExtractionError(
    String nodeId,
    String elementTag,
    String message
) {

    public String format() {
        return String.format("%s <%s>: %s", nodeId, elementTag, message);
    }
}
