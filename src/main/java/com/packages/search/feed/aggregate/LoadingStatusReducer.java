package com.packages.search.feed.aggregate;

import com.packages.search.model.LoadingStatus;
import com.packages.search.model.SearchResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Reduces per-source loading states to the single state of a multi-source search.
 *
 * <p>Priority, highest first:</p>
 * <ol>
 *   <li>{@code ERROR_OCCURRED} when every source errored,</li>
 *   <li>{@code LOADING} when any source is still producing results,</li>
 *   <li>{@code READY} when any source has more pages,</li>
 *   <li>{@code NO_MORE_ITEMS} when the surviving sources are exhausted,</li>
 *   <li>{@code CANCELLED} when the surviving sources were cancelled,</li>
 *   <li>{@code UNKNOWN} when the surviving sources have not reported yet.</li>
 * </ol>
 * A failed source never fails the composite while another source succeeded.
 */
public final class LoadingStatusReducer {

    private static final List<LoadingStatus> PRIORITY = List.of(
            LoadingStatus.LOADING,
            LoadingStatus.READY,
            LoadingStatus.NO_MORE_ITEMS,
            LoadingStatus.CANCELLED,
            LoadingStatus.UNKNOWN);

    private LoadingStatusReducer() {
    }

    /**
     * @param statuses per-source states keyed by source name
     * @return the composite state; {@code UNKNOWN} for an empty map
     */
    public static LoadingStatus reduce(final Map<String, LoadingStatus> statuses) {
        return reduce(statuses.values());
    }

    /**
     * @param statuses per-source states
     * @return the composite state; {@code UNKNOWN} for an empty collection
     */
    public static LoadingStatus reduce(final Collection<LoadingStatus> statuses) {
        if (statuses.isEmpty()) {
            return LoadingStatus.UNKNOWN;
        }
        if (statuses.stream().allMatch(s -> s == LoadingStatus.ERROR_OCCURRED)) {
            return LoadingStatus.ERROR_OCCURRED;
        }
        // not all errors, so at least one survivor is ranked
        return PRIORITY.stream()
                .filter(statuses::contains)
                .findFirst()
                .orElseThrow();
    }

    /**
     * Composite state of a page. A page without any source status is judged by its
     * continuation token alone.
     *
     * @param page page returned by a feed
     * @return the composite state of that page
     */
    public static LoadingStatus reduce(final SearchResult<?> page) {
        if (page.sourceSearchStatus().isEmpty()) {
            return page.hasMore() ? LoadingStatus.READY : LoadingStatus.NO_MORE_ITEMS;
        }
        return reduce(page.sourceSearchStatus());
    }
}
