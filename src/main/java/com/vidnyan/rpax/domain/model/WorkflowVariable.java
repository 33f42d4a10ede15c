package com.vidnyan.rpax.domain.model;

/**
 * Variable declaration and the scope that owns it
 * ("workflow" or the enclosing container's tag).
 */
public record WorkflowVariable(
    String name,
    String type,
    String defaultValue,
    String scope
) {

    public static final String WORKFLOW_SCOPE = "workflow";
}
