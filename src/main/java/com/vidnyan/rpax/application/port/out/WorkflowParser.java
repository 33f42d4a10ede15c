package com.vidnyan.rpax.application.port.out;

import com.vidnyan.rpax.domain.model.ParseResult;

import java.nio.file.Path;

/**
 * Port for parsing one workflow file into its document, activity tree and invocations.
 * Implemented by adapters (e.g., the DOM adapter).
 */
public interface WorkflowParser {

    /**
     * Parse a single file. Failures are reported in the result, never thrown.
     * @param file    workflow file to parse
     * @param options identity and limits for this file
     */
    ParseResult parse(Path file, ParsingOptions options);

    /**
     * Parsing options.
     *
     * @param projectRoot directory holding project.json, or null to locate it from the file
     */
    record ParsingOptions(
        String projectId,
        String workflowId,
        Path projectRoot,
        int maxDepth,
        boolean strictMode
    ) {
        public static ParsingOptions defaults(String projectId, String workflowId) {
            return new ParsingOptions(projectId, workflowId, null, 100, false);
        }
    }
}
