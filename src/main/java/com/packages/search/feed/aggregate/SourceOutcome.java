package com.packages.search.feed.aggregate;

import com.packages.search.model.LoadingStatus;
import com.packages.search.model.PackageSearchMetadata;
import com.packages.search.model.SearchResult;

import java.time.Duration;

/**
 * What one source contributed to a fan-out step.
 *
 * @param source  source name
 * @param page    page returned by the source; empty when it failed or was cancelled
 * @param status  the source's own state after the step
 * @param elapsed time the source took
 */
record SourceOutcome(String source,
                     SearchResult<PackageSearchMetadata> page,
                     LoadingStatus status,
                     Duration elapsed) {

    static SourceOutcome completed(final String source,
                                   final SearchResult<PackageSearchMetadata> page,
                                   final Duration elapsed) {
        return new SourceOutcome(source, page, LoadingStatusReducer.reduce(page), elapsed);
    }

    static SourceOutcome failed(final String source, final Duration elapsed) {
        return new SourceOutcome(source, SearchResult.fromItems(), LoadingStatus.ERROR_OCCURRED, elapsed);
    }

    static SourceOutcome cancelled(final String source, final Duration elapsed) {
        return new SourceOutcome(source, SearchResult.fromItems(), LoadingStatus.CANCELLED, elapsed);
    }
}
