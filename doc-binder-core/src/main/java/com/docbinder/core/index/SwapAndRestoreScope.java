package com.docbinder.core.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Narrows the shared table in place for the duration of the action and restores it
 * afterwards, even when the action fails.
 *
 * <p>The table's monitor is held for the whole scope, so concurrent readers block rather
 * than observe the narrowed contents.
 */
public class SwapAndRestoreScope implements IndexScope {

    private static final Logger log = LoggerFactory.getLogger(SwapAndRestoreScope.class);

    @Override
    public <T> T withEntries(IndexEntries shared, Map<String, List<IndexEntry>> view,
                             Function<IndexEntries, T> action) {
        IndexEntryTable table = shared.indexEntries();
        synchronized (table) {
            Map<String, List<IndexEntry>> saved = table.snapshot();
            log.debug("Scoping index entries to {} bucket(s)", view.size());
            table.replaceAll(view);
            try {
                return action.apply(shared);
            } finally {
                table.replaceAll(saved);
            }
        }
    }
}
