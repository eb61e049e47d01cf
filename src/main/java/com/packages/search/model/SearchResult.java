package com.packages.search.model;

import lombok.Builder;
import lombok.Singular;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One page produced by a feed for a single query step.
 *
 * @param items               ordered results of this step, possibly empty
 * @param sourceSearchStatus  status of every source after this step, keyed by source name
 * @param nextToken           present iff more pages may exist
 * @param refreshToken        present iff the same page set may be re-polled for late results
 * @param sourceDurations     time each source took for this step, keyed by source name
 * @param aggregationDuration time spent merging source pages into this one
 * @param <T>                 item type
 */
@Builder(toBuilder = true)
public record SearchResult<T>(
        @Singular("item") List<T> items,
        @Singular("sourceStatus") Map<String, LoadingStatus> sourceSearchStatus,
        ContinuationToken nextToken,
        RefreshToken refreshToken,
        @Singular("sourceDuration") Map<String, Duration> sourceDurations,
        Duration aggregationDuration
) {

    public SearchResult {
        items = items == null ? List.of() : List.copyOf(items);
        sourceSearchStatus = ordered(sourceSearchStatus);
        sourceDurations = ordered(sourceDurations);
        aggregationDuration = aggregationDuration == null ? Duration.ZERO : aggregationDuration;
    }

    /**
     * @param items page content
     * @param <T>   item type
     * @return a page holding only {@code items}
     */
    @SafeVarargs
    public static <T> SearchResult<T> fromItems(final T... items) {
        return SearchResult.<T>builder().items(List.of(items)).build();
    }

    // source maps keep configuration order, which telemetry relies on
    private static <V> Map<String, V> ordered(final Map<String, V> map) {
        return map == null || map.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    /**
     * @return {@code true} when a continuation token is present
     */
    public boolean hasMore() {
        return nextToken != null;
    }
}
