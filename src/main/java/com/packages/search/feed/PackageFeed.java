package com.packages.search.feed;

import com.packages.search.model.ContinuationToken;
import com.packages.search.model.PackageSearchMetadata;
import com.packages.search.model.RefreshToken;
import com.packages.search.model.SearchFilter;
import com.packages.search.model.SearchResult;
import reactor.core.publisher.Mono;

/**
 * A queryable source of package search results, local or remote.
 * <p>
 * Every operation returns a lazy {@link Mono}: nothing happens until it is subscribed, and
 * cancelling the subscription or firing the {@link CancellationSignal} abandons the query.
 * A feed may itself be a fan-out over several feeds and still satisfy this contract.
 * </p>
 */
public interface PackageFeed {

    /**
     * @return {@code true} when results come from more than one package source
     */
    boolean isMultiSource();

    /**
     * Starts a new logical search. Prior continuation state is never consulted.
     *
     * @param searchText query text; blank matches everything
     * @param filter     search options
     * @param signal     cooperative cancellation
     * @return the first page
     */
    Mono<SearchResult<PackageSearchMetadata>> search(String searchText, SearchFilter filter,
                                                      CancellationSignal signal);

    /**
     * Fetches the page following the one that issued {@code token}.
     *
     * @param token  continuation token previously returned by this feed
     * @param signal cooperative cancellation
     * @return the next page; errors with {@link IllegalArgumentException} when the token
     *         was issued by another feed
     */
    Mono<SearchResult<PackageSearchMetadata>> continueSearch(ContinuationToken token,
                                                              CancellationSignal signal);

    /**
     * Re-polls the page set that issued {@code token} for results that were not ready yet.
     *
     * @param token  refresh token previously returned by this feed
     * @param signal cooperative cancellation
     * @return a page whose items are a superset of the refreshed page
     */
    Mono<SearchResult<PackageSearchMetadata>> refreshSearch(RefreshToken token,
                                                             CancellationSignal signal);
}
