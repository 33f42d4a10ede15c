package com.vidnyan.rpax.domain.graph;

import java.util.List;
import java.util.TreeSet;

/**
 * A cycle of static invocations, listed in traversal order without repeating the first node.
 */
public record Cycle(
    String id,
    List<String> workflowIds,
    CycleType cycleType
) {

    public enum CycleType {
        SELF("self"),
        COMPLEX("complex");

        private final String wireName;

        CycleType(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static CycleType fromWireName(String name) {
            return "self".equals(name) ? SELF : COMPLEX;
        }
    }

    public Cycle {
        workflowIds = List.copyOf(workflowIds);
    }

    /**
     * Order-independent key of the participating workflows.
     */
    public String canonicalKey() {
        return String.join("|", new TreeSet<>(workflowIds));
    }

    public int length() {
        return workflowIds.size();
    }
}
