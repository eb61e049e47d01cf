package com.packages.search.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Loading state of a search, either for a single package source or
 * reduced across every source of a multi-source query.
 *
 * <p>Normal flow: {@code UNKNOWN → LOADING → READY → LOADING → … → NO_MORE_ITEMS}.
 * {@code ERROR_OCCURRED} and {@code CANCELLED} end the current fetch step.</p>
 */
@Getter
@RequiredArgsConstructor
public enum LoadingStatus {

    /** No query has been issued yet. */
    UNKNOWN("Unknown"),

    /** A fetch is outstanding, or a source is still producing results. */
    LOADING("Loading"),

    /** At least one page was produced and more may exist. */
    READY("Ready"),

    /** Every result has been delivered. */
    NO_MORE_ITEMS("NoMoreItems"),

    /** The fetch failed. */
    ERROR_OCCURRED("ErrorOccurred"),

    /** The fetch was cancelled by the caller. */
    CANCELLED("Cancelled");

    /**
     * Name used in telemetry payloads.
     */
    private final String displayName;

    /**
     * @return {@code true} for states that end the current step unsuccessfully
     */
    public boolean isFailure() {
        return this == ERROR_OCCURRED || this == CANCELLED;
    }
}
