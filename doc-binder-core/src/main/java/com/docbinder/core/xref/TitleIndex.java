package com.docbinder.core.xref;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Titles of the output documents of a run, keyed by DocumentID prefix.
 *
 * <p>Used to cite "(in Title)" when a reference points into another output document.
 *
 * @param entries prefix/title pairs in match order
 */
public record TitleIndex(List<Entry> entries) {

    private static final String INDEX_SUFFIX = "/index";

    public TitleIndex {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /**
     * Derives the prefix of an output document from its root DocumentID: a trailing
     * {@code index} component is dropped so that {@code api/index} covers {@code api/*}.
     *
     * @param rootDocname root DocumentID of an output document
     * @return matching prefix
     */
    public static String prefixOf(String rootDocname) {
        if (rootDocname.endsWith(INDEX_SUFFIX)) {
            return rootDocname.substring(0, rootDocname.length() - "index".length());
        }
        return rootDocname;
    }

    /**
     * Finds the title of the first entry whose prefix starts the given DocumentID.
     *
     * @param docname DocumentID holding a reference target
     * @return title, empty if no entry matches
     */
    public Optional<String> titleFor(String docname) {
        if (docname == null) {
            return Optional.empty();
        }
        return entries.stream()
            .filter(entry -> docname.startsWith(entry.prefix()))
            .map(Entry::title)
            .findFirst();
    }

    /**
     * A prefix/title pair.
     *
     * @param prefix DocumentID prefix
     * @param title output document title
     */
    public record Entry(String prefix, String title) {
        public Entry {
            Objects.requireNonNull(prefix, "prefix must not be null");
            Objects.requireNonNull(title, "title must not be null");
        }
    }
}
