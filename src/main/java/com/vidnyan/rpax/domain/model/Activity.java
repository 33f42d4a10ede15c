package com.vidnyan.rpax.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node of a workflow's execution tree.
 * Immutable value object; {@code activityId} is content-addressed and stable
 * under edits to designer metadata.
 */
public record Activity(
    String activityId,
    String workflowId,
    String activityType,
    String displayName,
    String nodeId,
    int depth,
    String parentActivityId,
    Map<String, String> arguments,
    Map<String, AttributeValue> configuration,
    Map<String, AttributeValue> properties,
    Map<String, String> metadata,
    List<Expression> expressions,
    List<String> variablesReferenced,
    Map<String, String> selectors,
    String annotation,
    boolean visible,
    String containerType,
    String invocationTarget,
    Map<String, String> invocationArguments
) {

    public static final String INVOKE_WORKFLOW_FILE = "InvokeWorkflowFile";

    public Activity {
        arguments = arguments == null ? Map.of() : copy(arguments);
        configuration = configuration == null ? Map.of() : copy(configuration);
        properties = properties == null ? Map.of() : copy(properties);
        metadata = metadata == null ? Map.of() : copy(metadata);
        expressions = expressions == null ? List.of() : List.copyOf(expressions);
        variablesReferenced = variablesReferenced == null ? List.of() : List.copyOf(variablesReferenced);
        selectors = selectors == null ? Map.of() : copy(selectors);
        invocationArguments = invocationArguments == null ? Map.of() : copy(invocationArguments);
    }

    /**
     * Check if this activity invokes another workflow file.
     */
    public boolean isInvocation() {
        return INVOKE_WORKFLOW_FILE.equals(activityType);
    }

    /**
     * Check if this is a top-level activity.
     */
    public boolean isRoot() {
        return parentActivityId == null;
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        // keep document order, tolerate null values from empty elements
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /**
     * Builder for Activity.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String activityId;
        private String workflowId;
        private String activityType;
        private String displayName;
        private String nodeId;
        private int depth;
        private String parentActivityId;
        private Map<String, String> arguments = Map.of();
        private Map<String, AttributeValue> configuration = Map.of();
        private Map<String, AttributeValue> properties = Map.of();
        private Map<String, String> metadata = Map.of();
        private List<Expression> expressions = List.of();
        private List<String> variablesReferenced = List.of();
        private Map<String, String> selectors = Map.of();
        private String annotation;
        private boolean visible = true;
        private String containerType;
        private String invocationTarget;
        private Map<String, String> invocationArguments = Map.of();

        public Builder activityId(String id) { this.activityId = id; return this; }
        public Builder workflowId(String id) { this.workflowId = id; return this; }
        public Builder activityType(String type) { this.activityType = type; return this; }
        public Builder displayName(String name) { this.displayName = name; return this; }
        public Builder nodeId(String id) { this.nodeId = id; return this; }
        public Builder depth(int d) { this.depth = d; return this; }
        public Builder parentActivityId(String id) { this.parentActivityId = id; return this; }
        public Builder arguments(Map<String, String> args) { this.arguments = args; return this; }
        public Builder configuration(Map<String, AttributeValue> config) { this.configuration = config; return this; }
        public Builder properties(Map<String, AttributeValue> props) { this.properties = props; return this; }
        public Builder metadata(Map<String, String> meta) { this.metadata = meta; return this; }
        public Builder expressions(List<Expression> exprs) { this.expressions = exprs; return this; }
        public Builder variablesReferenced(List<String> vars) { this.variablesReferenced = vars; return this; }
        public Builder selectors(Map<String, String> sel) { this.selectors = sel; return this; }
        public Builder annotation(String text) { this.annotation = text; return this; }
        public Builder visible(boolean v) { this.visible = v; return this; }
        public Builder containerType(String type) { this.containerType = type; return this; }
        public Builder invocationTarget(String target) { this.invocationTarget = target; return this; }
        public Builder invocationArguments(Map<String, String> args) { this.invocationArguments = args; return this; }

        public Activity build() {
            return new Activity(activityId, workflowId, activityType, displayName, nodeId, depth,
                    parentActivityId, arguments, configuration, properties, metadata, expressions,
                    variablesReferenced, selectors, annotation, visible, containerType, invocationTarget,
                    invocationArguments);
        }
    }
}
