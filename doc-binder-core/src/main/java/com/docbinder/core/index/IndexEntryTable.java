package com.docbinder.core.index;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Index entries of a whole build, bucketed by DocumentID.
 *
 * <p>The table is shared read state for every output document of a run. The only permitted
 * mutation is the scoped swap performed by {@link SwapAndRestoreScope}; all methods lock on
 * the table so a reader never observes it mid-swap.
 *
 * <p>A bucket named {@code <docname>-gen} holds entries generated for a single document and
 * takes precedence over per-document buckets when composing that document's index.
 */
public class IndexEntryTable {

    public static final String GENERATED_SUFFIX = "-gen";

    private final Map<String, List<IndexEntry>> entries = new LinkedHashMap<>();

    public IndexEntryTable() {
    }

    public IndexEntryTable(Map<String, List<IndexEntry>> entries) {
        replaceAll(entries);
    }

    public synchronized List<IndexEntry> get(String docname) {
        return entries.getOrDefault(docname, List.of());
    }

    public synchronized boolean contains(String docname) {
        return entries.containsKey(docname);
    }

    public synchronized void put(String docname, List<IndexEntry> bucket) {
        entries.put(Objects.requireNonNull(docname, "docname must not be null"), List.copyOf(bucket));
    }

    public synchronized Set<String> documents() {
        return Set.copyOf(entries.keySet());
    }

    /**
     * Returns an independent copy of the current contents.
     *
     * @return insertion-ordered copy
     */
    public synchronized Map<String, List<IndexEntry>> snapshot() {
        return new LinkedHashMap<>(entries);
    }

    /**
     * Replaces the whole contents of the table.
     *
     * @param replacement new buckets
     */
    public synchronized void replaceAll(Map<String, List<IndexEntry>> replacement) {
        Map<String, List<IndexEntry>> copy = new LinkedHashMap<>();
        replacement.forEach((docname, bucket) -> copy.put(docname, List.copyOf(bucket)));
        entries.clear();
        entries.putAll(copy);
    }

    /**
     * Computes the buckets visible while composing one output document's index.
     *
     * <p>If a {@code <root>-gen} bucket exists it is the only bucket, keyed by {@code root}.
     * Otherwise one bucket per consumed document is returned (empty if it has no entries).
     *
     * @param root root DocumentID of the output document
     * @param consumed documents inlined into the output document
     * @return scoped buckets
     */
    public synchronized Map<String, List<IndexEntry>> scopedView(String root, Collection<String> consumed) {
        Map<String, List<IndexEntry>> view = new LinkedHashMap<>();
        List<IndexEntry> generated = entries.get(root + GENERATED_SUFFIX);
        if (generated != null) {
            view.put(root, generated);
            return view;
        }
        for (String docname : consumed) {
            view.put(docname, entries.getOrDefault(docname, List.of()));
        }
        return view;
    }

    // holds at most one table's lock at a time
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexEntryTable other)) {
            return false;
        }
        return snapshot().equals(other.snapshot());
    }

    @Override
    public synchronized int hashCode() {
        return entries.hashCode();
    }

    @Override
    public synchronized String toString() {
        return "IndexEntryTable" + entries;
    }
}
