package com.vidnyan.rpax.domain.rule;

import com.vidnyan.rpax.domain.graph.CallGraph;
import com.vidnyan.rpax.domain.invocation.InvocationRecord;
import com.vidnyan.rpax.domain.model.ProjectDescriptor;
import com.vidnyan.rpax.domain.model.WorkflowIndex;

import java.util.List;

/**
 * Everything a validation rule may look at.
 */
public record ValidationContext(
    ProjectDescriptor project,
    WorkflowIndex index,
    List<InvocationRecord> invocations,
    CallGraph callGraph,
    boolean failOnCycles,
    boolean failOnMissing
) {

    public ValidationContext {
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
    }

    public boolean isKnownWorkflow(String workflowId) {
        return index.findByWorkflowId(workflowId).isPresent();
    }
}
