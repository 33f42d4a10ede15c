package com.vidnyan.rpax.application.port.out;

import com.vidnyan.rpax.domain.graph.CallGraph;
import com.vidnyan.rpax.domain.invocation.InvocationRecord;
import com.vidnyan.rpax.domain.model.ParseResult;
import com.vidnyan.rpax.domain.model.ProjectManifest;
import com.vidnyan.rpax.domain.model.WorkflowIndex;
import com.vidnyan.rpax.domain.pseudocode.WorkflowPseudocode;
import com.vidnyan.rpax.domain.rule.ValidationReport;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Port for persisting analysis artifacts.
 */
public interface ArtifactWriter {

    String MANIFEST_FILE = "manifest.json";
    String CALL_GRAPH_FILE = "call-graph.json";
    String INDEX_FILE = "workflows.index.json";
    String INVOCATIONS_FILE = "invocations.jsonl";
    String VALIDATION_FILE = "validation.json";
    /** One {@code <workflowId>.json} per parsed workflow: document metadata plus activity tree. */
    String ACTIVITIES_DIR = "activities.tree";
    /** One {@code <workflowId>.json} per workflow. */
    String PSEUDOCODE_DIR = "pseudocode";
    String PSEUDOCODE_INDEX_FILE = "pseudocode.index.json";

    /**
     * Write all artifacts into the output directory, creating it when needed.
     * @return written files
     */
    List<Path> write(Path outputDir, Artifacts artifacts) throws IOException;

    /**
     * Everything one run persists. The manifest, parse results and pseudocode are optional.
     */
    record Artifacts(
        ProjectManifest manifest,
        CallGraph callGraph,
        WorkflowIndex index,
        List<InvocationRecord> invocations,
        ValidationReport validation,
        List<ParseResult> parseResults,
        List<WorkflowPseudocode> pseudocode
    ) {
        public Artifacts {
            parseResults = parseResults == null ? List.of() : List.copyOf(parseResults);
            pseudocode = pseudocode == null ? List.of() : List.copyOf(pseudocode);
        }

        public Artifacts(CallGraph callGraph, WorkflowIndex index, List<InvocationRecord> invocations,
                         ValidationReport validation) {
            this(null, callGraph, index, invocations, validation, List.of(), List.of());
        }
    }
}
