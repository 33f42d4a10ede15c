package com.vidnyan.rpax.domain.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Workflow in the call graph. Filled in two passes by {@link CallGraphBuilder}:
 * edge attachment, then depth assignment. Read-only once the graph is built.
 */
public final class WorkflowNode {

    public static final int UNREACHED = -1;

    private final String workflowId;
    private final String filePath;
    private final String displayName;
    private final boolean entryPoint;
    private final List<InvocationEdge> dependencies = new ArrayList<>();
    private final Set<String> dependents = new TreeSet<>();
    private int callDepth;

    public WorkflowNode(String workflowId, String filePath, String displayName, boolean entryPoint) {
        this.workflowId = workflowId;
        this.filePath = filePath;
        this.displayName = displayName;
        this.entryPoint = entryPoint;
        this.callDepth = entryPoint ? 0 : UNREACHED;
    }

    /**
     * Recreate a node from a serialized graph.
     */
    public static WorkflowNode restore(String workflowId, String filePath, String displayName, boolean entryPoint,
                                       int callDepth, List<InvocationEdge> dependencies, Set<String> dependents) {
        WorkflowNode node = new WorkflowNode(workflowId, filePath, displayName, entryPoint);
        node.callDepth = callDepth;
        node.dependencies.addAll(dependencies);
        node.dependents.addAll(dependents);
        return node;
    }

    void addDependency(InvocationEdge edge) {
        dependencies.add(edge);
    }

    void addDependent(String workflowId) {
        dependents.add(workflowId);
    }

    void assignDepth(int depth) {
        this.callDepth = depth;
    }

    public String workflowId() {
        return workflowId;
    }

    public String filePath() {
        return filePath;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isEntryPoint() {
        return entryPoint;
    }

    public int callDepth() {
        return callDepth;
    }

    public boolean isReachable() {
        return callDepth != UNREACHED;
    }

    public List<InvocationEdge> dependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    public Set<String> dependents() {
        return Collections.unmodifiableSet(dependents);
    }

    /**
     * Resolved static targets, in edge order.
     */
    public List<String> staticTargets() {
        return dependencies.stream()
                .filter(InvocationEdge::isTraversable)
                .map(InvocationEdge::targetId)
                .toList();
    }

    @Override
    public String toString() {
        return "WorkflowNode[" + workflowId + ", depth=" + callDepth + "]";
    }
}
