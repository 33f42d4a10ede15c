package com.vidnyan.rpax.domain.invocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One workflow-to-workflow invocation found in a XAML file.
 *
 * @param kind         classification of the target
 * @param from         invoking workflow id
 * @param to           target as a project-relative POSIX path (or the raw expression when dynamic)
 * @param arguments    arguments passed to the invoked workflow
 * @param activityName display name of the invoking activity
 * @param targetPath   file name exactly as written in the workflow
 * @param nodeId       node id of the invoking activity, null for fallback scan hits
 */
public record InvocationRecord(
    InvocationKind kind,
    String from,
    String to,
    Map<String, String> arguments,
    String activityName,
    String targetPath,
    String nodeId
) {

    public static final String DYNAMIC_PATH_COMBINE = "Dynamic Path.Combine";
    public static final String VARIABLE_EXPRESSION = "Variable Expression";

    public InvocationRecord {
        arguments = arguments == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public boolean hasArguments() {
        return !arguments.isEmpty();
    }
}
