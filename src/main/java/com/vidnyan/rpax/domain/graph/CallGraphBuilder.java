package com.vidnyan.rpax.domain.graph;

import com.vidnyan.rpax.domain.invocation.InvocationKind;
import com.vidnyan.rpax.domain.invocation.InvocationRecord;
import com.vidnyan.rpax.domain.model.WorkflowEntry;
import com.vidnyan.rpax.domain.xaml.ActivityIdGenerator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.TreeMap;

/**
 * Assembles the call graph from the workflow index and the invocation stream.
 * <ol>
 *   <li>one node per indexed workflow, entry points at depth 0;</li>
 *   <li>edge attachment with target resolution (exact path, then file name);</li>
 *   <li>BFS depth assignment over resolved static edges;</li>
 *   <li>DFS cycle detection over the same edges, deduplicated by node set;</li>
 *   <li>metrics.</li>
 * </ol>
 * Nodes are visited in sorted id order so results never depend on input order.
 * Runs sequentially over one mutable node map.
 */
@Slf4j
public class CallGraphBuilder {

    private final Clock clock;

    public CallGraphBuilder() {
        this(Clock.systemUTC());
    }

    public CallGraphBuilder(Clock clock) {
        this.clock = clock;
    }

    /**
     * Input of one build.
     *
     * @param entryPointPaths main workflow and declared entry points, as written in the project file
     */
    public record Request(
        String projectId,
        String projectSlug,
        List<WorkflowEntry> workflows,
        List<String> entryPointPaths,
        List<InvocationRecord> invocations
    ) {}

    public CallGraph build(Request request) {
        // Step 1: nodes
        Set<String> entryPointIds = resolveEntryPoints(request.entryPointPaths(), request.workflows());
        Map<String, WorkflowNode> nodes = new TreeMap<>();
        for (WorkflowEntry entry : request.workflows()) {
            nodes.put(entry.workflowId(), new WorkflowNode(
                    entry.workflowId(),
                    entry.relativePath(),
                    displayNameOf(entry),
                    entryPointIds.contains(entry.workflowId())));
        }

        // Step 2: edges
        TargetIndex targets = new TargetIndex(request.workflows());
        for (InvocationRecord invocation : request.invocations()) {
            WorkflowNode source = nodes.get(invocation.from());
            if (source == null) {
                log.warn("Invocation from unknown workflow {} to {} ignored", invocation.from(), invocation.to());
                continue;
            }
            InvocationEdge edge = toEdge(invocation, targets);
            source.addDependency(edge);
            if (edge.isResolved()) {
                WorkflowNode target = nodes.get(edge.targetId());
                if (target == null) {
                    throw new IllegalStateException("Resolved target missing from node map: " + edge.targetId());
                }
                target.addDependent(source.workflowId());
            }
        }

        // Step 3: depths
        assignDepths(nodes, entryPointIds);

        // Step 4: cycles
        List<Cycle> cycles = detectCycles(nodes);

        // Step 5: metrics
        CallGraphMetrics metrics = computeMetrics(nodes, entryPointIds, cycles);

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("entryPoints", List.copyOf(request.entryPointPaths()));
        generationConfig.put("traversalKinds", List.of(InvocationKind.STATIC.wireName()));
        generationConfig.put("cycleDeduplication", "node-set");

        log.info("Call graph built: {} workflows, {} edges, {} cycles, {} orphans",
                metrics.totalWorkflows(), metrics.totalDependencies(),
                metrics.cyclesDetected(), metrics.orphanedWorkflows());

        return new CallGraph(
                request.projectId(),
                request.projectSlug(),
                CallGraph.SCHEMA_VERSION,
                Instant.now(clock),
                nodes,
                entryPointIds.stream().sorted().toList(),
                cycles,
                metrics,
                generationConfig);
    }

    /**
     * Match declared entry points against indexed workflows by id, case-insensitive id, then file name.
     */
    private Set<String> resolveEntryPoints(List<String> entryPointPaths, List<WorkflowEntry> workflows) {
        Set<String> resolved = new LinkedHashSet<>();
        TargetIndex index = new TargetIndex(workflows);
        for (String path : entryPointPaths) {
            Optional<String> id = index.resolve(path);
            if (id.isPresent()) {
                resolved.add(id.get());
            } else {
                log.warn("Entry point {} does not match any discovered workflow", path);
            }
        }
        return resolved;
    }

    private static InvocationEdge toEdge(InvocationRecord invocation, TargetIndex targets) {
        InvocationKind kind = invocation.kind();
        String targetId = null;
        if (kind == InvocationKind.STATIC) {
            targetId = targets.resolve(invocation.to()).orElse(null);
            if (targetId == null) {
                // on disk but not indexed (excluded or outside the project)
                kind = InvocationKind.MISSING;
            }
        }
        return new InvocationEdge(
                invocation.from(),
                invocation.to(),
                targetId,
                kind,
                invocation.arguments(),
                invocation.nodeId(),
                invocation.activityName());
    }

    /**
     * BFS layering: a node's depth is the first layer that reaches it.
     */
    private static void assignDepths(Map<String, WorkflowNode> nodes, Set<String> entryPointIds) {
        Queue<String> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        entryPointIds.stream().sorted().forEach(id -> {
            visited.add(id);
            queue.add(id);
        });

        while (!queue.isEmpty()) {
            WorkflowNode current = nodes.get(queue.poll());
            for (String targetId : current.staticTargets()) {
                if (visited.add(targetId)) {
                    nodes.get(targetId).assignDepth(current.callDepth() + 1);
                    queue.add(targetId);
                }
            }
        }
    }

    /**
     * Back edges to a node on the DFS stack close a cycle; cycles sharing a node set are reported once.
     */
    private static List<Cycle> detectCycles(Map<String, WorkflowNode> nodes) {
        List<List<String>> found = new ArrayList<>();
        Set<String> visited = new HashSet<>();

        for (String id : nodes.keySet()) {
            if (!visited.contains(id)) {
                findCycles(id, nodes, visited, found);
            }
        }

        Set<String> seenKeys = new HashSet<>();
        List<Cycle> cycles = new ArrayList<>();
        for (List<String> members : found) {
            Cycle.CycleType type = members.size() == 1 ? Cycle.CycleType.SELF : Cycle.CycleType.COMPLEX;
            Cycle candidate = new Cycle("cycle_" + (cycles.size() + 1), members, type);
            if (seenKeys.add(candidate.canonicalKey())) {
                cycles.add(candidate);
            }
        }
        return cycles;
    }

    /**
     * Depth-first search from one start node with an explicit frame stack.
     * The current path mirrors the frames; a target already on the path closes a cycle.
     */
    private static void findCycles(
            String start,
            Map<String, WorkflowNode> nodes,
            Set<String> visited,
            List<List<String>> cycles
    ) {
        Deque<DfsFrame> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        List<String> path = new ArrayList<>();
        enter(start, nodes, visited, onStack, path, stack);

        while (!stack.isEmpty()) {
            DfsFrame frame = stack.peek();
            if (frame.hasNext()) {
                String target = frame.next();
                if (onStack.contains(target)) {
                    int from = path.indexOf(target);
                    cycles.add(new ArrayList<>(path.subList(from, path.size())));
                } else if (!visited.contains(target)) {
                    enter(target, nodes, visited, onStack, path, stack);
                }
            } else {
                stack.pop();
                path.remove(path.size() - 1);
                onStack.remove(frame.workflowId);
            }
        }
    }

    private static void enter(String workflowId, Map<String, WorkflowNode> nodes, Set<String> visited,
                              Set<String> onStack, List<String> path, Deque<DfsFrame> stack) {
        visited.add(workflowId);
        onStack.add(workflowId);
        path.add(workflowId);
        List<String> targets = nodes.get(workflowId).staticTargets().stream().distinct().sorted().toList();
        stack.push(new DfsFrame(workflowId, targets));
    }

    private static final class DfsFrame {
        private final String workflowId;
        private final List<String> targets;
        private int cursor;

        DfsFrame(String workflowId, List<String> targets) {
            this.workflowId = workflowId;
            this.targets = targets;
        }

        boolean hasNext() {
            return cursor < targets.size();
        }

        String next() {
            return targets.get(cursor++);
        }
    }

    private static CallGraphMetrics computeMetrics(Map<String, WorkflowNode> nodes, Set<String> entryPointIds,
                                                   List<Cycle> cycles) {
        Map<InvocationKind, Integer> byKind = new HashMap<>();
        int totalEdges = 0;
        for (WorkflowNode node : nodes.values()) {
            for (InvocationEdge edge : node.dependencies()) {
                byKind.merge(edge.kind(), 1, Integer::sum);
                totalEdges++;
            }
        }
        int orphans = (int) nodes.values().stream().filter(n -> !n.isReachable()).count();
        int maxDepth = nodes.values().stream().mapToInt(WorkflowNode::callDepth).max().orElse(0);

        return new CallGraphMetrics(
                nodes.size(),
                totalEdges,
                entryPointIds.size(),
                orphans,
                Math.max(maxDepth, 0),
                cycles.size(),
                byKind.getOrDefault(InvocationKind.STATIC, 0),
                byKind.getOrDefault(InvocationKind.DYNAMIC, 0),
                byKind.getOrDefault(InvocationKind.MISSING, 0),
                byKind.getOrDefault(InvocationKind.CODED, 0));
    }

    private static String displayNameOf(WorkflowEntry entry) {
        return entry.displayName() != null && !entry.displayName().isBlank()
                ? entry.displayName()
                : entry.fileName();
    }

    /**
     * Lookup of workflow ids by exact id, case-insensitive id and bare file name.
     */
    static final class TargetIndex {
        private final Set<String> ids = new HashSet<>();
        private final Map<String, String> byLowerId = new HashMap<>();
        private final Map<String, List<String>> byFileName = new HashMap<>();

        TargetIndex(List<WorkflowEntry> workflows) {
            for (WorkflowEntry entry : workflows) {
                ids.add(entry.workflowId());
                byLowerId.putIfAbsent(entry.workflowId().toLowerCase(Locale.ROOT), entry.workflowId());
                byFileName.computeIfAbsent(fileNameOf(entry.workflowId()), k -> new ArrayList<>())
                        .add(entry.workflowId());
            }
            byFileName.values().forEach(list -> list.sort(Comparator.naturalOrder()));
        }

        Optional<String> resolve(String path) {
            if (path == null || path.isBlank()) {
                return Optional.empty();
            }
            String id = ActivityIdGenerator.workflowId(path);
            if (ids.contains(id)) {
                return Optional.of(id);
            }
            String lower = byLowerId.get(id.toLowerCase(Locale.ROOT));
            if (lower != null) {
                return Optional.of(lower);
            }
            List<String> sameName = byFileName.get(fileNameOf(id));
            return sameName == null || sameName.isEmpty() ? Optional.empty() : Optional.of(sameName.get(0));
        }

        private static String fileNameOf(String workflowId) {
            int slash = workflowId.lastIndexOf('/');
            return (slash >= 0 ? workflowId.substring(slash + 1) : workflowId).toLowerCase(Locale.ROOT);
        }
    }
}
