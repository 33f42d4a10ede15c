package com.vidnyan.rpax.adapter.out.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.rpax.domain.model.Activity;
import com.vidnyan.rpax.domain.model.ActivityTree;
import com.vidnyan.rpax.domain.model.ArgumentDirection;
import com.vidnyan.rpax.domain.model.AttributeValue;
import com.vidnyan.rpax.domain.model.Expression;
import com.vidnyan.rpax.domain.model.ExtractionError;
import com.vidnyan.rpax.domain.model.ParseResult;
import com.vidnyan.rpax.domain.model.WorkflowArgument;
import com.vidnyan.rpax.domain.model.WorkflowDocument;
import com.vidnyan.rpax.domain.model.WorkflowVariable;
import com.vidnyan.rpax.domain.pseudocode.PseudocodeEntry;
import com.vidnyan.rpax.domain.pseudocode.WorkflowPseudocode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-workflow artifacts: the parsed document with its activity tree, and the pseudocode outline.
 * Files are named after the workflow id, so nested workflows land in nested directories.
 */
public class WorkflowJsonCodec {

    public static final String SCHEMA_VERSION = "1.0.0";

    private final ObjectMapper objectMapper;

    public WorkflowJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Document metadata and activity tree of one workflow, as read back from disk.
     */
    public record WorkflowActivities(WorkflowDocument document, ActivityTree tree) {}

    public static Path fileFor(Path dir, String workflowId) {
        return dir.resolve(workflowId + ".json");
    }

    // --- activity trees ---

    /**
     * @return the written file, or null when the parse produced no tree
     */
    public Path writeActivityTree(Path dir, ParseResult result) throws IOException {
        if (!result.hasTree()) {
            return null;
        }
        Path file = fileFor(dir, result.workflowId());
        Files.createDirectories(file.getParent());
        objectMapper.writeValue(file.toFile(), toDocument(result.workflowId(), result.document(), result.tree()));
        return file;
    }

    public WorkflowActivities readActivityTree(Path file) throws IOException {
        ActivityTreeDocument document = objectMapper.readerFor(ActivityTreeDocument.class)
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .readValue(file.toFile());
        return fromDocument(document);
    }

    ActivityTreeDocument toDocument(String workflowId, WorkflowDocument document, ActivityTree tree) {
        return new ActivityTreeDocument(
                workflowId,
                SCHEMA_VERSION,
                document != null ? toDocument(document) : null,
                tree.root() != null ? toDocument(tree.root()) : null,
                tree.activities().stream().map(WorkflowJsonCodec::toDocument).toList(),
                tree.errors(),
                tree.warnings());
    }

    WorkflowActivities fromDocument(ActivityTreeDocument document) {
        WorkflowDocument workflow = document.document() != null ? fromDocument(document.document()) : null;
        ActivityTree tree = new ActivityTree(
                document.root() != null ? fromDocument(document.root()) : null,
                document.activities().stream().map(WorkflowJsonCodec::fromDocument).toList(),
                document.errors() != null ? document.errors() : List.of(),
                document.warnings() != null ? document.warnings() : List.of());
        return new WorkflowActivities(workflow, tree);
    }

    private static WorkflowDocumentDocument toDocument(WorkflowDocument document) {
        List<ArgumentDocument> arguments = document.arguments().stream()
                .map(a -> new ArgumentDocument(a.name(), a.type(), a.direction().wireName(), a.defaultValue(),
                        a.annotation()))
                .toList();
        return new WorkflowDocumentDocument(document.workflowId(), document.filePath(), document.displayName(),
                document.description(), document.rootAnnotation(), document.expressionLanguage(),
                document.namespaces(), document.assemblyReferences(), document.imports(), arguments,
                document.variables());
    }

    private static WorkflowDocument fromDocument(WorkflowDocumentDocument document) {
        List<WorkflowArgument> arguments = document.arguments() == null ? List.of()
                : document.arguments().stream()
                        .map(a -> new WorkflowArgument(a.name(), a.type(),
                                ArgumentDirection.fromWireName(a.direction()), a.defaultValue(), a.annotation()))
                        .toList();
        return new WorkflowDocument(document.workflowId(), document.filePath(), document.displayName(),
                document.description(), document.rootAnnotation(), document.expressionLanguage(),
                document.namespaces(), document.assemblyReferences(), document.imports(), arguments,
                document.variables());
    }

    private static ActivityDocument toDocument(Activity activity) {
        return new ActivityDocument(
                activity.activityId(),
                activity.workflowId(),
                activity.activityType(),
                activity.displayName(),
                activity.nodeId(),
                activity.depth(),
                activity.parentActivityId(),
                activity.arguments(),
                toPlain(activity.configuration()),
                toPlain(activity.properties()),
                activity.metadata(),
                activity.expressions(),
                activity.variablesReferenced(),
                activity.selectors(),
                activity.annotation(),
                activity.visible(),
                activity.containerType(),
                activity.invocationTarget(),
                activity.invocationArguments());
    }

    private static Activity fromDocument(ActivityDocument document) {
        return Activity.builder()
                .activityId(document.activityId())
                .workflowId(document.workflowId())
                .activityType(document.activityType())
                .displayName(document.displayName())
                .nodeId(document.nodeId())
                .depth(document.depth())
                .parentActivityId(document.parentActivityId())
                .arguments(document.arguments())
                .configuration(fromPlain(document.configuration()))
                .properties(fromPlain(document.properties()))
                .metadata(document.metadata())
                .expressions(document.expressions())
                .variablesReferenced(document.variablesReferenced())
                .selectors(document.selectors())
                .annotation(document.annotation())
                .visible(document.visible())
                .containerType(document.containerType())
                .invocationTarget(document.invocationTarget())
                .invocationArguments(document.invocationArguments())
                .build();
    }

    private static Map<String, Object> toPlain(Map<String, AttributeValue> values) {
        Map<String, Object> plain = new LinkedHashMap<>();
        values.forEach((key, value) -> plain.put(key, value.toPlain()));
        return plain;
    }

    private static Map<String, AttributeValue> fromPlain(Map<String, Object> plain) {
        Map<String, AttributeValue> values = new LinkedHashMap<>();
        if (plain != null) {
            plain.forEach((key, value) -> values.put(key, AttributeValue.fromPlain(value)));
        }
        return values;
    }

    // --- pseudocode ---

    public Path writePseudocode(Path dir, WorkflowPseudocode pseudocode, String projectId, String projectSlug)
            throws IOException {
        Path file = fileFor(dir, pseudocode.workflowId());
        Files.createDirectories(file.getParent());
        objectMapper.writeValue(file.toFile(), new PseudocodeDocument(
                pseudocode.workflowId(),
                projectId,
                projectSlug,
                SCHEMA_VERSION,
                pseudocode.activityCount(),
                pseudocode.totalLines(),
                pseudocode.entries(),
                pseudocode.expandedLines(),
                pseudocode.error()));
        return file;
    }

    public WorkflowPseudocode readPseudocode(Path file) throws IOException {
        PseudocodeDocument document = objectMapper.readValue(file.toFile(), PseudocodeDocument.class);
        return new WorkflowPseudocode(document.workflowId(), document.entries(), document.activityCount(),
                document.expandedPseudocode(), document.error());
    }

    public Path writePseudocodeIndex(Path file, String projectId, String projectSlug,
                                     List<WorkflowPseudocode> pseudocode) throws IOException {
        List<PseudocodeIndexItem> items = pseudocode.stream()
                .map(p -> new PseudocodeIndexItem(p.workflowId(), p.totalLines(), p.activityCount(), p.hasError()))
                .toList();
        Files.createDirectories(file.getParent());
        objectMapper.writeValue(file.toFile(),
                new PseudocodeIndexDocument(projectId, projectSlug, SCHEMA_VERSION, items.size(), items));
        return file;
    }

    // Serialized shapes

    public record ActivityTreeDocument(
        String workflowId,
        String schemaVersion,
        WorkflowDocumentDocument document,
        ActivityDocument root,
        List<ActivityDocument> activities,
        List<ExtractionError> errors,
        List<String> warnings
    ) {}

    public record WorkflowDocumentDocument(
        String workflowId,
        String filePath,
        String displayName,
        String description,
        String rootAnnotation,
        String expressionLanguage,
        Map<String, String> namespaces,
        List<String> assemblyReferences,
        List<String> imports,
        List<ArgumentDocument> arguments,
        List<WorkflowVariable> variables
    ) {}

    public record ArgumentDocument(
        String name,
        String type,
        String direction,
        String defaultValue,
        String annotation
    ) {}

    public record ActivityDocument(
        String activityId,
        String workflowId,
        String activityType,
        String displayName,
        String nodeId,
        int depth,
        String parentActivityId,
        Map<String, String> arguments,
        Map<String, Object> configuration,
        Map<String, Object> properties,
        Map<String, String> metadata,
        List<Expression> expressions,
        List<String> variablesReferenced,
        Map<String, String> selectors,
        String annotation,
        boolean visible,
        String containerType,
        String invocationTarget,
        Map<String, String> invocationArguments
    ) {}

    public record PseudocodeDocument(
        String workflowId,
        String projectId,
        String projectSlug,
        String schemaVersion,
        int activityCount,
        int totalLines,
        List<PseudocodeEntry> entries,
        List<String> expandedPseudocode,
        String error
    ) {}

    public record PseudocodeIndexItem(String workflowId, int totalLines, int totalActivities, boolean hasError) {}

    public record PseudocodeIndexDocument(
        String projectId,
        String projectSlug,
        String schemaVersion,
        int totalWorkflows,
        List<PseudocodeIndexItem> workflows
    ) {}
}
