package com.vidnyan.rpax.domain.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Activity tree of one workflow, stored flat in document order with parent links.
 * The root is either the single top-level activity or a synthetic container
 * grouping several top-level activities.
 */
public final class ActivityTree {

    public static final String SYNTHETIC_ROOT_TYPE = "Workflow";
    public static final String SYNTHETIC_ROOT_NODE_ID = "/";

    private final Activity root;
    private final List<Activity> activities;
    private final List<ExtractionError> errors;
    private final List<String> warnings;
    private final Map<String, List<Activity>> childrenByParent;
    private final Map<String, Activity> byNodeId;

    public ActivityTree(Activity root, List<Activity> activities,
                        List<ExtractionError> errors, List<String> warnings) {
        this.root = root;
        this.activities = List.copyOf(activities);
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);

        Map<String, List<Activity>> children = new HashMap<>();
        Map<String, Activity> nodes = new HashMap<>();
        for (Activity activity : this.activities) {
            nodes.put(activity.nodeId(), activity);
            if (activity.parentActivityId() != null) {
                children.computeIfAbsent(activity.parentActivityId(), k -> new ArrayList<>()).add(activity);
            }
        }
        this.childrenByParent = children;
        this.byNodeId = nodes;
    }

    /**
     * Root activity, or null when the workflow has no visible activity.
     */
    public Activity root() {
        return root;
    }

    /**
     * All extracted activities in document order (synthetic root excluded).
     */
    public List<Activity> activities() {
        return activities;
    }

    public List<ExtractionError> errors() {
        return errors;
    }

    public List<String> warnings() {
        return warnings;
    }

    public boolean isSyntheticRoot() {
        return root != null && SYNTHETIC_ROOT_NODE_ID.equals(root.nodeId());
    }

    /**
     * Get the direct children of an activity.
     */
    public List<Activity> childrenOf(String activityId) {
        return childrenByParent.getOrDefault(activityId, List.of());
    }

    /**
     * Get top-level activities.
     */
    public List<Activity> topLevel() {
        return activities.stream().filter(Activity::isRoot).toList();
    }

    public Optional<Activity> findByNodeId(String nodeId) {
        return Optional.ofNullable(byNodeId.get(nodeId));
    }

    /**
     * Activities invoking another workflow file.
     */
    public List<Activity> invocations() {
        return activities.stream().filter(Activity::isInvocation).toList();
    }

    public int size() {
        return activities.size();
    }

    public static ActivityTree empty() {
        return new ActivityTree(null, List.of(), List.of(), List.of());
    }
}
