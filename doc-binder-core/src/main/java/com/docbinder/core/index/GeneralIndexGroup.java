package com.docbinder.core.index;

import java.util.List;
import java.util.Objects;

/**
 * One letter group of the general index.
 *
 * @param key group heading, a letter or {@code Symbols}
 * @param terms terms of the group in display order
 */
public record GeneralIndexGroup(String key, List<IndexTerm> terms) {

    public GeneralIndexGroup {
        Objects.requireNonNull(key, "key must not be null");
        terms = terms == null ? List.of() : List.copyOf(terms);
    }

    /**
     * A term of the general index.
     *
     * @param term displayed term
     * @param links URIs of every occurrence, first one is the main link
     * @param subEntries nested entries
     */
    public record IndexTerm(String term, List<String> links, List<SubEntry> subEntries) {

        public IndexTerm {
            Objects.requireNonNull(term, "term must not be null");
            links = links == null ? List.of() : List.copyOf(links);
            subEntries = subEntries == null ? List.of() : List.copyOf(subEntries);
        }
    }

    /**
     * A nested entry below a term.
     *
     * @param term displayed sub-term
     * @param links URIs of every occurrence, possibly none
     */
    public record SubEntry(String term, List<String> links) {

        public SubEntry {
            Objects.requireNonNull(term, "term must not be null");
            links = links == null ? List.of() : List.copyOf(links);
        }
    }
}
