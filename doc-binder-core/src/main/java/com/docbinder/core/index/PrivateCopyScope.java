package com.docbinder.core.index;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Hands the action a private table built from the view; the shared table is never modified.
 */
public class PrivateCopyScope implements IndexScope {

    @Override
    public <T> T withEntries(IndexEntries shared, Map<String, List<IndexEntry>> view,
                             Function<IndexEntries, T> action) {
        return action.apply(new IndexEntries(new IndexEntryTable(view)));
    }
}
