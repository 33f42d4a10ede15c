package com.vidnyan.rpax.domain.graph;

import com.vidnyan.rpax.domain.invocation.InvocationKind;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Project-wide workflow call graph.
 * Rebuilt wholesale on every run, never patched incrementally.
 */
public final class CallGraph {

    public static final String SCHEMA_VERSION = "1.0.0";

    private final String projectId;
    private final String projectSlug;
    private final String schemaVersion;
    private final Instant generatedAt;
    private final Map<String, WorkflowNode> workflows;
    private final List<String> entryPoints;
    private final List<Cycle> cycles;
    private final CallGraphMetrics metrics;
    private final Map<String, Object> generationConfig;

    public CallGraph(String projectId, String projectSlug, String schemaVersion, Instant generatedAt,
                     Map<String, WorkflowNode> workflows, List<String> entryPoints, List<Cycle> cycles,
                     CallGraphMetrics metrics, Map<String, Object> generationConfig) {
        this.projectId = projectId;
        this.projectSlug = projectSlug;
        this.schemaVersion = schemaVersion;
        this.generatedAt = generatedAt;
        this.workflows = Collections.unmodifiableMap(new LinkedHashMap<>(workflows));
        this.entryPoints = List.copyOf(entryPoints);
        this.cycles = List.copyOf(cycles);
        this.metrics = metrics;
        this.generationConfig = Collections.unmodifiableMap(new LinkedHashMap<>(generationConfig));
    }

    public String projectId() {
        return projectId;
    }

    public String projectSlug() {
        return projectSlug;
    }

    public String schemaVersion() {
        return schemaVersion;
    }

    public Instant generatedAt() {
        return generatedAt;
    }

    public Map<String, WorkflowNode> workflows() {
        return workflows;
    }

    public List<String> entryPoints() {
        return entryPoints;
    }

    public List<Cycle> cycles() {
        return cycles;
    }

    public CallGraphMetrics metrics() {
        return metrics;
    }

    public Map<String, Object> generationConfig() {
        return generationConfig;
    }

    public Optional<WorkflowNode> node(String workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    /**
     * Get all outgoing edges of a workflow.
     */
    public List<InvocationEdge> dependenciesOf(String workflowId) {
        WorkflowNode node = workflows.get(workflowId);
        return node == null ? List.of() : node.dependencies();
    }

    /**
     * Get the workflows invoking a workflow.
     */
    public Set<String> dependentsOf(String workflowId) {
        WorkflowNode node = workflows.get(workflowId);
        return node == null ? Set.of() : node.dependents();
    }

    /**
     * All edges in node order.
     */
    public List<InvocationEdge> edges() {
        return workflows.values().stream()
                .flatMap(n -> n.dependencies().stream())
                .toList();
    }

    public List<InvocationEdge> edgesOfKind(InvocationKind kind) {
        return edges().stream().filter(e -> e.kind() == kind).toList();
    }

    /**
     * Workflows not reachable from any entry point.
     */
    public List<String> orphans() {
        return workflows.values().stream()
                .filter(n -> !n.isReachable())
                .map(WorkflowNode::workflowId)
                .toList();
    }

    /**
     * Find all workflows reachable from a start workflow over static edges, start included.
     */
    public Set<String> reachableFrom(String startId) {
        Set<String> visited = new LinkedHashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.add(startId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!workflows.containsKey(current) || !visited.add(current)) {
                continue;
            }
            for (String target : workflows.get(current).staticTargets()) {
                if (!visited.contains(target)) {
                    queue.add(target);
                }
            }
        }
        return visited;
    }

    /**
     * Check if a resolved static edge leads from one workflow to another.
     */
    public boolean hasStaticEdge(String fromId, String toId) {
        return dependenciesOf(fromId).stream()
                .anyMatch(e -> e.isTraversable() && e.targetId().equals(toId));
    }

    public int size() {
        return workflows.size();
    }

    public static String formatCycle(Collection<String> workflowIds) {
        return String.join(" → ", workflowIds);
    }
}
