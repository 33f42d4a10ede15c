package com.vidnyan.rpax.domain.explain;

import com.vidnyan.rpax.domain.graph.CallGraph;
import com.vidnyan.rpax.domain.graph.InvocationEdge;
import com.vidnyan.rpax.domain.graph.WorkflowNode;
import com.vidnyan.rpax.domain.model.WorkflowDocument;
import com.vidnyan.rpax.domain.model.WorkflowEntry;
import com.vidnyan.rpax.domain.model.WorkflowIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Explains a workflow from the index, its parsed document and the call graph.
 */
public class WorkflowExplainer {

    private static final List<String> TEST_MARKERS = List.of("test", "spec", "unit", "integration");

    /**
     * Find a workflow by id, relative path, file name, then partial path or display name
     * (case-insensitive). First match wins at each step.
     */
    public Optional<WorkflowEntry> find(WorkflowIndex index, String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        String posix = identifier.replace('\\', '/');
        String lower = posix.toLowerCase(Locale.ROOT);
        List<Predicate<WorkflowEntry>> matchers = List.of(
                w -> w.workflowId().equals(posix),
                w -> w.relativePath().equals(posix),
                w -> w.fileName().equals(posix),
                w -> w.relativePath().toLowerCase(Locale.ROOT).contains(lower),
                w -> w.displayName() != null && w.displayName().toLowerCase(Locale.ROOT).contains(lower));
        for (Predicate<WorkflowEntry> matcher : matchers) {
            Optional<WorkflowEntry> match = index.workflows().stream().filter(matcher).findFirst();
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    public Optional<WorkflowExplanation> explain(String identifier, WorkflowIndex index, CallGraph graph,
                                                 Map<String, WorkflowDocument> documents) {
        return find(index, identifier).map(entry -> explain(entry, index, graph, documents.get(entry.workflowId())));
    }

    private WorkflowExplanation explain(WorkflowEntry entry, WorkflowIndex index, CallGraph graph, WorkflowDocument document) {
        String workflowId = entry.workflowId();

        List<WorkflowExplanation.Callee> invokes = new ArrayList<>();
        for (InvocationEdge edge : graph.dependenciesOf(workflowId)) {
            invokes.add(new WorkflowExplanation.Callee(
                    edge.targetId() != null ? edge.targetId() : edge.targetPath(),
                    edge.targetId(),
                    edge.kind().wireName(),
                    edge.arguments()));
        }

        List<WorkflowExplanation.Caller> callers = new ArrayList<>();
        for (WorkflowNode node : graph.workflows().values()) {
            for (InvocationEdge edge : node.dependencies()) {
                if (workflowId.equals(edge.targetId())) {
                    callers.add(new WorkflowExplanation.Caller(node.workflowId(), edge.kind().wireName(),
                            edge.arguments()));
                }
            }
        }

        Optional<WorkflowNode> node = graph.node(workflowId);
        String relativePath = entry.relativePath();
        String lowerPath = relativePath.toLowerCase(Locale.ROOT);
        int slash = relativePath.indexOf('/');

        return new WorkflowExplanation(
                workflowId,
                entry.displayName() != null ? entry.displayName() : entry.fileName(),
                relativePath,
                index.projectName(),
                entry.fileSize(),
                entry.lastModified(),
                entry.parseSuccessful(),
                entry.parseErrors(),
                document != null ? document.arguments() : List.of(),
                invokes,
                callers,
                node.map(WorkflowNode::isEntryPoint).orElse(false),
                node.map(n -> !n.isReachable()).orElse(true),
                TEST_MARKERS.stream().anyMatch(lowerPath::contains),
                slash > 0 ? relativePath.substring(0, slash) : null,
                node.map(WorkflowNode::callDepth).orElse(WorkflowNode.UNREACHED));
    }
}
