package com.vidnyan.rpax.domain.pseudocode;

import com.vidnyan.rpax.domain.graph.CallGraph;
import com.vidnyan.rpax.domain.graph.InvocationEdge;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Inlines the outline of each statically invoked workflow below the line that invokes it.
 * Targets come from resolved static edges of the call graph, matched by node id.
 * Recursion is bounded by {@code maxDepth} invocation hops.
 */
@Slf4j
public class PseudocodeExpander {

    public enum CycleHandling {
        DETECT_AND_MARK,
        DETECT_AND_STOP,
        IGNORE
    }

    private final CallGraph callGraph;
    private final int maxDepth;
    private final CycleHandling cycleHandling;

    public PseudocodeExpander(CallGraph callGraph, int maxDepth, CycleHandling cycleHandling) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        this.callGraph = callGraph;
        this.maxDepth = maxDepth;
        this.cycleHandling = cycleHandling;
    }

    public List<String> expand(String workflowId, Map<String, WorkflowPseudocode> pseudocode) {
        List<String> lines = new ArrayList<>();
        expandInto(workflowId, pseudocode, new HashSet<>(), 0, "", lines);
        return lines;
    }

    private void expandInto(String workflowId, Map<String, WorkflowPseudocode> pseudocode, Set<String> path,
                            int hops, String pad, List<String> out) {
        if (path.contains(workflowId)) {
            markCycle(workflowId, pad, out);
            return;
        }
        if (hops > maxDepth) {
            out.add(pad + "[DEPTH LIMIT REACHED: " + workflowId + "] (max depth: " + maxDepth + ")");
            return;
        }
        WorkflowPseudocode base = pseudocode.get(workflowId);
        if (base == null) {
            out.add(pad + "[MISSING WORKFLOW: " + workflowId + "] (pseudocode not found)");
            return;
        }

        path.add(workflowId);
        for (PseudocodeEntry entry : base.entries()) {
            out.add(pad + entry.formattedLine());
            if (entry.invocation()) {
                Optional<String> target = targetOf(workflowId, entry.nodeId());
                if (target.isPresent()) {
                    String nestedPad = pad + "  ".repeat(entry.indent() + 1);
                    expandInto(target.get(), pseudocode, path, hops + 1, nestedPad, out);
                }
            }
        }
        path.remove(workflowId);
    }

    private Optional<String> targetOf(String workflowId, String nodeId) {
        return callGraph.dependenciesOf(workflowId).stream()
                .filter(InvocationEdge::isTraversable)
                .filter(e -> nodeId.equals(e.nodeId()))
                .map(InvocationEdge::targetId)
                .findFirst();
    }

    private void markCycle(String workflowId, String pad, List<String> out) {
        switch (cycleHandling) {
            case DETECT_AND_MARK -> out.add(pad + "[CYCLE DETECTED: " + workflowId + "] (already expanded above)");
            case DETECT_AND_STOP -> out.add(pad + "[CYCLE DETECTED: " + workflowId + "] (expansion stopped)");
            case IGNORE -> log.debug("Cycle back to {} not expanded", workflowId);
        }
    }
}
