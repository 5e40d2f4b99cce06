package com.docbinder.core.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of building one output document.
 *
 * @param targetName output document name
 * @param docname root DocumentID
 * @param output written file, null when the build failed
 * @param error failure description, null on success
 */
public record DocumentBuildResult(String targetName, String docname, Path output, String error) {

    public DocumentBuildResult {
        Objects.requireNonNull(targetName, "targetName must not be null");
        Objects.requireNonNull(docname, "docname must not be null");
    }

    public static DocumentBuildResult succeeded(String targetName, String docname, Path output) {
        return new DocumentBuildResult(targetName, docname, Objects.requireNonNull(output, "output must not be null"), null);
    }

    public static DocumentBuildResult failed(String targetName, String docname, String error) {
        return new DocumentBuildResult(targetName, docname, null, error == null ? "unknown error" : error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
