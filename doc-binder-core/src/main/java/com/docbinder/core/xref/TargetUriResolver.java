package com.docbinder.core.xref;

import com.docbinder.core.source.NavigationGraph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes the URI under which a DocumentID can be linked from an output document.
 *
 * <p>Output documents address each other as {@code <scheme>:<target-name>.<extension>},
 * e.g. {@code pdf:manual.pdf}:
 * <ol>
 *   <li>{@code token} references always resolve to {@value #TOKEN_URI}.</li>
 *   <li>Documents inlined into the current output document resolve to {@code ""}.</li>
 *   <li>The root of another output document resolves to that document's URI.</li>
 *   <li>A document included by the toctree of another output document's root resolves to
 *       that output document's URI.</li>
 *   <li>Anything else raises {@link NoUriException}.</li>
 * </ol>
 */
public class TargetUriResolver {

    public static final String TOKEN_URI = "@token";
    public static final String DEFAULT_SCHEME = "pdf";

    private final Map<String, String> targetsByRoot;
    private final NavigationGraph navigationGraph;
    private final String scheme;
    private final String extension;

    /**
     * Creates a resolver.
     *
     * @param targetsByRoot target name of every output document keyed by root DocumentID,
     *                      in configuration order
     * @param navigationGraph toctree graph of the run
     * @param scheme URI scheme
     * @param extension output file extension, without dot
     */
    public TargetUriResolver(Map<String, String> targetsByRoot, NavigationGraph navigationGraph,
                             String scheme, String extension) {
        this.targetsByRoot = new LinkedHashMap<>(Objects.requireNonNull(targetsByRoot, "targetsByRoot must not be null"));
        this.navigationGraph = Objects.requireNonNull(navigationGraph, "navigationGraph must not be null");
        this.scheme = Objects.requireNonNull(scheme, "scheme must not be null");
        this.extension = Objects.requireNonNull(extension, "extension must not be null");
    }

    /**
     * Resolves the URI of a document as seen from an output document.
     *
     * @param docname document to link to
     * @param type reference type, may be null
     * @param localDocuments documents inlined into the current output document
     * @return URI, {@code ""} for local documents
     * @throws NoUriException if the document is not linkable
     */
    public String targetUri(String docname, String type, Set<String> localDocuments) throws NoUriException {
        if ("token".equals(type)) {
            return TOKEN_URI;
        }
        if (localDocuments.contains(docname)) {
            return "";
        }
        String target = targetsByRoot.get(docname);
        if (target != null) {
            return uriFor(target);
        }
        for (String includer : navigationGraph.includersOf(docname)) {
            String includerTarget = targetsByRoot.get(includer);
            if (includerTarget != null) {
                return uriFor(includerTarget);
            }
        }
        throw new NoUriException(docname);
    }

    private String uriFor(String targetName) {
        return scheme + ":" + targetName + "." + extension;
    }
}
