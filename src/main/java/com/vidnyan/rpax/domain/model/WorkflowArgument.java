package com.vidnyan.rpax.domain.model;

/**
 * Workflow argument declared in the {@code x:Members} block.
 */
public record WorkflowArgument(
    String name,
    String type,
    ArgumentDirection direction,
    String defaultValue,
    String annotation
) {}
