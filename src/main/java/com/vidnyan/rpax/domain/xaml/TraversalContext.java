package com.vidnyan.rpax.domain.xaml;

import com.vidnyan.rpax.domain.model.ExtractionError;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of a single tree build: sibling counters, counters and collected problems.
 * Created per file and never shared.
 */
public final class TraversalContext {

    private final Map<String, Integer> siblingCounters = new HashMap<>();
    private final List<ExtractionError> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private int elementsProcessed;
    private int skippedElements;
    private int truncatedSubtrees;

    /**
     * Next index for a visible element with the given tag under the given parent path.
     */
    public int nextSiblingIndex(String parentPath, String tag) {
        String key = parentPath + "|" + tag;
        int index = siblingCounters.getOrDefault(key, 0);
        siblingCounters.put(key, index + 1);
        return index;
    }

    public void elementProcessed() {
        elementsProcessed++;
    }

    public void elementSkipped() {
        skippedElements++;
    }

    public void subtreeTruncated(String message) {
        truncatedSubtrees++;
        warnings.add(message);
    }

    public void error(ExtractionError error) {
        errors.add(error);
    }

    public void warning(String message) {
        warnings.add(message);
    }

    public List<ExtractionError> errors() {
        return errors;
    }

    public List<String> warnings() {
        return warnings;
    }

    public int elementsProcessed() {
        return elementsProcessed;
    }

    public int skippedElements() {
        return skippedElements;
    }

    public int truncatedSubtrees() {
        return truncatedSubtrees;
    }
}
