package com.docbinder.core.source;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of the toctree structure: which documents each document includes.
 *
 * <p>The graph may contain cycles and references to unknown documents; consumers must
 * tolerate both.
 *
 * @param includes ordered include lists keyed by including DocumentID
 */
public record NavigationGraph(Map<String, List<String>> includes) {

    /**
     * Compact constructor with validation and defensive copy.
     */
    public NavigationGraph {
        Objects.requireNonNull(includes, "includes must not be null");
        Map<String, List<String>> copy = new LinkedHashMap<>();
        includes.forEach((docname, included) -> copy.put(docname, List.copyOf(included)));
        includes = Collections.unmodifiableMap(copy);
    }

    public static NavigationGraph empty() {
        return new NavigationGraph(Map.of());
    }

    /**
     * Returns the documents directly included by a document.
     *
     * @param docname including document
     * @return included documents in toctree order, empty if none
     */
    public List<String> includedBy(String docname) {
        return includes.getOrDefault(docname, List.of());
    }

    /**
     * Returns the documents whose toctree directly includes the given document.
     *
     * @param docname included document
     * @return including documents in graph order
     */
    public Set<String> includersOf(String docname) {
        Set<String> result = new LinkedHashSet<>();
        includes.forEach((parent, included) -> {
            if (included.contains(docname)) {
                result.add(parent);
            }
        });
        return result;
    }

    /**
     * Returns every document reachable from {@code root}, including {@code root} itself.
     *
     * <p>Cycles are tolerated; each document is visited once.
     *
     * @param root starting document
     * @return reachable documents in breadth-first order
     */
    public Set<String> reachableFrom(String root) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (seen.add(current)) {
                queue.addAll(includedBy(current));
            }
        }
        return seen;
    }
}
