package com.packages.search.feed.aggregate;

import com.packages.search.model.ContinuationToken;
import com.packages.search.model.LoadingStatus;
import com.packages.search.model.SearchFilter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Continuation of a multi-source search: the own token of every source that has more
 * pages, plus the last state of every source that has not.
 *
 * @param feedId          id of the issuing {@link MultiSourcePackageFeed}
 * @param searchText      query of the logical search
 * @param filter          filter of the logical search
 * @param sourceTokens    per-source continuation tokens, never inspected here
 * @param settledStatuses final state of sources that are not continued
 */
record AggregateContinuationToken(UUID feedId,
                                  String searchText,
                                  SearchFilter filter,
                                  Map<String, ContinuationToken> sourceTokens,
                                  Map<String, LoadingStatus> settledStatuses) implements ContinuationToken {

    AggregateContinuationToken {
        sourceTokens = Collections.unmodifiableMap(new LinkedHashMap<>(sourceTokens));
        settledStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(settledStatuses));
    }
}
