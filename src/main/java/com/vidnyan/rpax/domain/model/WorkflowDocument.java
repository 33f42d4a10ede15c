package com.vidnyan.rpax.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Workflow-level metadata of one parsed XAML file.
 * Immutable after construction.
 */
public record WorkflowDocument(
    String workflowId,
    String filePath,
    String displayName,
    String description,
    String rootAnnotation,
    String expressionLanguage,
    Map<String, String> namespaces,
    List<String> assemblyReferences,
    List<String> imports,
    List<WorkflowArgument> arguments,
    List<WorkflowVariable> variables
) {

    public WorkflowDocument {
        namespaces = namespaces == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(namespaces));
        assemblyReferences = assemblyReferences == null ? List.of() : List.copyOf(assemblyReferences);
        imports = imports == null ? List.of() : List.copyOf(imports);
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
        variables = variables == null ? List.of() : List.copyOf(variables);
    }

    /**
     * Get arguments with the given direction.
     */
    public List<WorkflowArgument> argumentsByDirection(ArgumentDirection direction) {
        return arguments.stream()
                .filter(a -> a.direction() == direction)
                .toList();
    }
}
