package com.vidnyan.rpax.domain.xaml;

import com.vidnyan.rpax.domain.model.Activity;
import com.vidnyan.rpax.domain.model.ActivityTree;
import com.vidnyan.rpax.domain.model.ExtractionError;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Element;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Builds the activity tree of one workflow in a single pre-order pass.
 * <p>
 * Node ids are hierarchical and sibling-indexed ({@code /Sequence[0]/If[1]/Then/Click[0]}):
 * each visible element gets its namespace-free tag plus the number of earlier visible siblings
 * with the same tag under the same parent path. Invisible elements add no index and no depth;
 * property elements such as {@code If.Then} contribute their member name as a path segment.
 * Traversal uses an explicit work stack, so document depth never reaches the call stack.
 */
@Slf4j
public class ActivityTreeBuilder {

    public static final int DEFAULT_MAX_DEPTH = 100;

    private final ActivityExtractor extractor;
    private final int maxDepth;

    public ActivityTreeBuilder(ActivityExtractor extractor, int maxDepth) {
        this.extractor = extractor;
        this.maxDepth = maxDepth;
    }

    /**
     * Pending element with the placement inherited from its nearest visible ancestor.
     */
    private record Frame(Element element, String parentPath, int depth, String parentActivityId) {}

    public ActivityTree build(Element root, String projectId, String workflowId) {
        return build(root, projectId, workflowId, new TraversalContext());
    }

    /**
     * Build the tree, recording counters and problems into the given context.
     */
    public ActivityTree build(Element root, String projectId, String workflowId, TraversalContext context) {
        List<Activity> activities = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, "", 0, null));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            Element element = frame.element();
            String tag = XamlNames.localName(element);
            context.elementProcessed();

            String childPath;
            int childDepth;
            String childParentId;

            if (VisibilityClassifier.isVisible(element)) {
                if (frame.depth() >= maxDepth) {
                    String message = String.format("Depth limit %d reached at %s/%s in %s; subtree truncated",
                            maxDepth, frame.parentPath(), tag, workflowId);
                    log.warn(message);
                    context.subtreeTruncated(message);
                    continue;
                }

                int index = context.nextSiblingIndex(frame.parentPath(), tag);
                String nodeId = frame.parentPath() + "/" + tag + "[" + index + "]";
                childPath = nodeId;
                childDepth = frame.depth() + 1;
                childParentId = frame.parentActivityId();

                try {
                    Activity activity = extractor.extract(element, new ActivityExtractor.Position(
                            projectId, workflowId, nodeId, frame.depth(), frame.parentActivityId()));
                    activities.add(activity);
                    childParentId = activity.activityId();
                } catch (RuntimeException e) {
                    // children attach to the nearest successfully extracted ancestor
                    log.warn("Failed to extract activity {} in {}: {}", nodeId, workflowId, e.getMessage());
                    context.error(new ExtractionError(nodeId, tag, String.valueOf(e.getMessage())));
                }
            } else {
                context.elementSkipped();
                childPath = XamlNames.isPropertyElement(tag)
                        ? frame.parentPath() + "/" + XamlNames.memberName(tag)
                        : frame.parentPath();
                childDepth = frame.depth();
                childParentId = frame.parentActivityId();
            }

            List<Element> children = XamlNames.childElements(element);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), childPath, childDepth, childParentId));
            }
        }

        Activity treeRoot = rootOf(activities, projectId, workflowId);
        log.debug("Built tree for {}: {} activities, {} errors", workflowId, activities.size(), context.errors().size());
        return new ActivityTree(treeRoot, activities, context.errors(), context.warnings());
    }

    /**
     * Single top-level activity, a synthetic container for several, or null for none.
     */
    private Activity rootOf(List<Activity> activities, String projectId, String workflowId) {
        List<Activity> topLevel = activities.stream().filter(Activity::isRoot).toList();
        if (topLevel.isEmpty()) {
            return null;
        }
        if (topLevel.size() == 1) {
            return topLevel.get(0);
        }
        List<String> childNodeIds = topLevel.stream().map(Activity::nodeId).toList();
        String canonical = ActivityIdGenerator.canonicalContent(
                ActivityTree.SYNTHETIC_ROOT_TYPE, Map.of(), Map.of(), childNodeIds);
        return Activity.builder()
                .activityId(ActivityIdGenerator.activityId(projectId, workflowId,
                        ActivityTree.SYNTHETIC_ROOT_NODE_ID, canonical))
                .workflowId(workflowId)
                .activityType(ActivityTree.SYNTHETIC_ROOT_TYPE)
                .nodeId(ActivityTree.SYNTHETIC_ROOT_NODE_ID)
                .depth(-1)
                .visible(false)
                .build();
    }
}
