package com.docbinder.core.index;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Strategy restricting the shared index entries to one output document while its general
 * index is composed.
 *
 * <p>Chosen once per run from the build mode: sequential builds use
 * {@link SwapAndRestoreScope}, which temporarily narrows the shared table itself; parallel
 * builds use {@link PrivateCopyScope}, which never touches the shared table. Either way the
 * shared table holds its original contents again when {@link #withEntries} returns.
 */
public interface IndexScope {

    /**
     * Runs an action against index entries restricted to {@code view}.
     *
     * @param shared adapter over the run's shared table
     * @param view buckets visible to the action
     * @param action work to perform, receiving an adapter that sees only {@code view}
     * @param <T> result type
     * @return the action's result
     */
    <T> T withEntries(IndexEntries shared, Map<String, List<IndexEntry>> view, Function<IndexEntries, T> action);

    /**
     * Selects the strategy for a build mode.
     *
     * @param parallelBuild whether output documents are built concurrently
     * @return matching scope strategy
     */
    static IndexScope forBuildMode(boolean parallelBuild) {
        return parallelBuild ? new PrivateCopyScope() : new SwapAndRestoreScope();
    }
}
