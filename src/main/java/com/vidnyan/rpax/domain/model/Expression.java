package com.vidnyan.rpax.domain.model;

import java.util.List;

/**
 * An embedded VB.NET/C# expression found in an attribute or text node.
 */
public record Expression(
    String content,
    String role,
    String language,
    String context,
    List<String> variables,
    List<String> methods
) {

    public static final String ROLE_CONDITION = "condition";
    public static final String ROLE_ASSIGNMENT = "assignment";
    public static final String ROLE_MESSAGE = "message";
    public static final String ROLE_TIMEOUT = "timeout";
    public static final String ROLE_GENERAL = "general";

    public Expression {
        variables = variables == null ? List.of() : List.copyOf(variables);
        methods = methods == null ? List.of() : List.copyOf(methods);
    }
}
