package com.docbinder.core.pipeline;

import java.util.List;

/**
 * Summary of a run: one result per output document, in configuration order, and every
 * warning recorded along the way.
 *
 * @param results per-document outcomes
 * @param warnings user-visible warnings
 */
public record BuildReport(List<DocumentBuildResult> results, List<String> warnings) {

    public BuildReport {
        results = results == null ? List.of() : List.copyOf(results);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public List<DocumentBuildResult> failures() {
        return results.stream().filter(result -> !result.isSuccess()).toList();
    }

    public long successCount() {
        return results.stream().filter(DocumentBuildResult::isSuccess).count();
    }

    public boolean hasFailures() {
        return !failures().isEmpty();
    }
}
