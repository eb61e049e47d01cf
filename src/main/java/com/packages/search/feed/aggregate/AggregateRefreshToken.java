package com.packages.search.feed.aggregate;

import com.packages.search.model.ContinuationToken;
import com.packages.search.model.LoadingStatus;
import com.packages.search.model.RefreshToken;
import com.packages.search.model.SearchFilter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Refresh of a multi-source page: the refresh token of every source that was still
 * loading, plus the settled state of the others so it can be carried into the
 * refreshed page.
 *
 * @param feedId          id of the issuing {@link MultiSourcePackageFeed}
 * @param searchText      query of the logical search
 * @param filter          filter of the logical search
 * @param pendingTokens   per-source refresh tokens
 * @param settledTokens   continuation tokens of sources that are not refreshed
 * @param settledStatuses states of sources that are not refreshed
 */
record AggregateRefreshToken(UUID feedId,
                             String searchText,
                             SearchFilter filter,
                             Map<String, RefreshToken> pendingTokens,
                             Map<String, ContinuationToken> settledTokens,
                             Map<String, LoadingStatus> settledStatuses) implements RefreshToken {

    AggregateRefreshToken {
        pendingTokens = Collections.unmodifiableMap(new LinkedHashMap<>(pendingTokens));
        settledTokens = Collections.unmodifiableMap(new LinkedHashMap<>(settledTokens));
        settledStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(settledStatuses));
    }
}
