package com.vidnyan.rpax.domain.pseudocode;

import com.vidnyan.rpax.domain.model.Activity;
import com.vidnyan.rpax.domain.model.ActivityTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Renders an activity tree as an indented outline, one line per activity:
 * {@code - [Display Name] Type (Path: /Sequence[0]/Type[0])}.
 */
public class PseudocodeGenerator {

    private record Pending(Activity activity, int indent) {}

    public WorkflowPseudocode generate(String workflowId, ActivityTree tree) {
        if (tree == null) {
            return WorkflowPseudocode.failed(workflowId, "No activity tree");
        }

        List<PseudocodeEntry> entries = new ArrayList<>();
        Deque<Pending> stack = new ArrayDeque<>();
        pushReversed(stack, tree.topLevel(), 0);

        while (!stack.isEmpty()) {
            Pending pending = stack.pop();
            Activity activity = pending.activity();
            entries.add(new PseudocodeEntry(
                    pending.indent(),
                    activity.displayName(),
                    activity.activityType(),
                    activity.nodeId(),
                    activity.activityId(),
                    activity.depth(),
                    activity.visible(),
                    activity.isInvocation(),
                    activity.invocationTarget(),
                    formatLine(pending.indent(), activity.displayName(), activity.activityType(), activity.nodeId())));
            pushReversed(stack, tree.childrenOf(activity.activityId()), pending.indent() + 1);
        }
        return new WorkflowPseudocode(workflowId, entries, tree.size(), List.of(), null);
    }

    public static String formatLine(int indent, String displayName, String activityType, String nodeId) {
        StringBuilder line = new StringBuilder("  ".repeat(indent)).append("- ");
        if (displayName != null && !displayName.isBlank()) {
            line.append('[').append(displayName).append("] ");
        }
        return line.append(activityType).append(" (Path: ").append(nodeId).append(')').toString();
    }

    private static void pushReversed(Deque<Pending> stack, List<Activity> activities, int indent) {
        for (int i = activities.size() - 1; i >= 0; i--) {
            stack.push(new Pending(activities.get(i), indent));
        }
    }
}
