package com.packages.search.loader;

import com.packages.search.feed.CancellationSignal;
import com.packages.search.feed.PackageFeed;
import com.packages.search.feed.aggregate.LoadingStatusReducer;
import com.packages.search.model.ContinuationToken;
import com.packages.search.model.LoadingStatus;
import com.packages.search.model.PackageSearchMetadata;
import com.packages.search.model.RefreshToken;
import com.packages.search.model.SearchFilter;
import com.packages.search.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <h2>Incremental package loader</h2>
 *
 * <p>Caller-facing engine that grows one result list page by page from a
 * {@link PackageFeed}. Callers drive it by polling:</p>
 * <pre>{@code
 * loader.loadNext(null, signal);
 * while (loader.getState().loadingStatus() == LoadingStatus.LOADING) {
 *     Thread.sleep(100);
 *     loader.updateState(signal);
 * }
 * List<PackageItem> items = loader.getCurrent();
 * }</pre>
 *
 * <ul>
 *   <li>{@link #loadNext} starts one background fetch and returns at once; only one fetch
 *       may be in flight.</li>
 *   <li>{@link #updateState} publishes a completed fetch: rows are appended, never
 *       removed or reordered, and the composite state is replaced.</li>
 *   <li>{@link #getCurrent()} and {@link #getState()} read an immutable snapshot and
 *       never block.</li>
 * </ul>
 *
 * <p>Feed errors are absorbed into {@code ERROR_OCCURRED}; cancellation ends in
 * {@code CANCELLED} and keeps earlier rows.</p>
 */
@Slf4j
public class PackageItemLoader {

    private enum FetchKind { PAGE, REFRESH }

    private record Fetch(FetchKind kind,
                         CompletableFuture<SearchResult<PackageSearchMetadata>> future,
                         long startNanos,
                         AtomicLong finishNanos,
                         CancellationSignal signal) {

        // time the feed took, independent of when the caller polled
        Duration elapsed() {
            long end = finishNanos.get();
            return Duration.ofNanos((end == 0L ? System.nanoTime() : end) - startNanos);
        }
    }

    private record Snapshot(List<PackageItem> items, LoaderState state) {
    }

    private final PackageLoadContext context;

    private final PackageFeed feed;

    private volatile Snapshot snapshot;

    // everything below is guarded by "this"
    private String searchText;

    private SearchFilter filter;

    private boolean searchAnnounced;

    private boolean firstPageLoaded;

    private ContinuationToken nextToken;

    private RefreshToken refreshToken;

    private int pageIndex;

    private Fetch inFlight;

    public PackageItemLoader(final PackageLoadContext context, final PackageFeed feed, final String searchText) {
        this(context, feed, searchText, false);
    }

    /**
     * @param context           shared collaborators
     * @param feed              feed to page through, usually a multi-source feed
     * @param searchText        query of the first search
     * @param includePrerelease default pre-release option for {@link #loadNext} calls without filter
     */
    public PackageItemLoader(final PackageLoadContext context,
                             final PackageFeed feed,
                             final String searchText,
                             final boolean includePrerelease) {
        this.context = context;
        this.feed = feed;
        newSearch(searchText, includePrerelease);
    }

    /**
     * Starts a new logical search: clears the list, abandons an in-flight fetch, resets the
     * state to {@code UNKNOWN} and generates a new operation id.
     *
     * @param text              query text
     * @param includePrerelease default pre-release option
     */
    public synchronized void newSearch(final String text, final boolean includePrerelease) {
        if (inFlight != null) {
            inFlight.future().cancel(true);
            inFlight = null;
        }
        this.searchText = StringUtils.trimToEmpty(text);
        this.filter = SearchFilter.of(includePrerelease);
        this.searchAnnounced = false;
        this.firstPageLoaded = false;
        this.nextToken = null;
        this.refreshToken = null;
        this.pageIndex = 0;

        UUID operationId = UUID.randomUUID();
        snapshot = new Snapshot(List.of(), new LoaderState(LoadingStatus.UNKNOWN, operationId, 0));
        log.debug("New search {} created", operationId);
    }

    /**
     * @return current state; never blocks
     */
    public LoaderState getState() {
        return snapshot.state();
    }

    /**
     * @return immutable snapshot of every row published so far; never blocks
     */
    public List<PackageItem> getCurrent() {
        return snapshot.items();
    }

    /**
     * Starts fetching the next page in the background: a fresh search on the first call,
     * the continuation of the previous page afterwards. The state is {@code LOADING} when
     * this method returns.
     * <p>
     * After {@code ERROR_OCCURRED} or {@code CANCELLED} the failed step is issued again.
     * Once every page was delivered the call does nothing.
     * </p>
     *
     * @param searchFilter filter for a fresh search; {@code null} keeps the current one
     * @param signal       cancels the fetch and every source query it started
     * @throws IllegalStateException if a fetch is already in flight
     */
    public synchronized void loadNext(final SearchFilter searchFilter, final CancellationSignal signal) {
        LoaderState state = snapshot.state();
        if (state.loadingStatus() == LoadingStatus.LOADING) {
            throw new IllegalStateException("Search " + state.operationId() + " is already loading");
        }
        CancellationSignal cancellation = orNone(signal);

        if (!firstPageLoaded) {
            if (searchFilter != null) {
                filter = searchFilter;
            }
            announceSearch(state.operationId());
            startFetch(FetchKind.PAGE, feed.search(searchText, filter, cancellation), cancellation);
        } else if (refreshToken != null && state.loadingStatus().isFailure()) {
            startFetch(FetchKind.REFRESH, feed.refreshSearch(refreshToken, cancellation), cancellation);
        } else if (nextToken != null) {
            startFetch(FetchKind.PAGE, feed.continueSearch(nextToken, cancellation), cancellation);
        } else {
            log.debug("Search {} has no more pages", state.operationId());
        }
    }

    /**
     * Publishes the in-flight fetch if it has completed; otherwise does nothing.
     * A fired {@code signal} cancels the in-flight fetch first.
     *
     * @param signal caller cancellation
     */
    public synchronized void updateState(final CancellationSignal signal) {
        Fetch fetch = inFlight;
        if (fetch == null) {
            return;
        }
        if (orNone(signal).isCancelled() && !fetch.future().isDone()) {
            fetch.future().cancel(true);
        }
        if (!fetch.future().isDone()) {
            return;
        }
        inFlight = null;
        complete(fetch);
    }

    /**
     * Counts the matches of the current query, paging until {@code maxCount} distinct
     * packages were seen or the feed is exhausted. The loader state is not touched.
     *
     * @param maxCount count at which paging stops
     * @param signal   cancels the count
     * @return at least {@code maxCount} when that many matches exist, the exact count otherwise
     */
    public Mono<Integer> getTotalCount(final int maxCount, final CancellationSignal signal) {
        CancellationSignal cancellation = orNone(signal);
        String text;
        SearchFilter searchFilter;
        synchronized (this) {
            text = searchText;
            searchFilter = filter;
        }
        Set<String> seen = Collections.synchronizedSet(new HashSet<>());
        return count(feed.search(text, searchFilter, cancellation), seen, maxCount, cancellation)
                .takeUntilOther(cancellation.whenCancelled())
                .switchIfEmpty(Mono.error(() -> new CancellationException("Total count was cancelled")));
    }

    private Mono<Integer> count(final Mono<SearchResult<PackageSearchMetadata>> step,
                                final Set<String> seen,
                                final int maxCount,
                                final CancellationSignal signal) {
        return step.flatMap(page -> {
            page.items().forEach(row -> seen.add(row.identity().key()));
            if (seen.size() >= maxCount) {
                return Mono.just(seen.size());
            }
            if (page.nextToken() != null) {
                return count(feed.continueSearch(page.nextToken(), signal), seen, maxCount, signal);
            }
            if (page.refreshToken() != null && LoadingStatusReducer.reduce(page) == LoadingStatus.LOADING) {
                return count(feed.refreshSearch(page.refreshToken(), signal), seen, maxCount, signal);
            }
            return Mono.just(seen.size());
        });
    }

    private void announceSearch(final UUID operationId) {
        if (searchAnnounced) {
            return;
        }
        searchAnnounced = true;
        log.info("Search {} started over {} source(s)", operationId, context.sources().size());
        context.telemetry().ifPresent(t -> {
            t.emit(context.events().search(operationId, searchText, filter.includePrerelease()));
            t.emit(context.events().sourceSummary(operationId, context.sources()));
        });
    }

    private void startFetch(final FetchKind kind,
                            final Mono<SearchResult<PackageSearchMetadata>> step,
                            final CancellationSignal signal) {
        long start = System.nanoTime();
        AtomicLong finish = new AtomicLong();
        CompletableFuture<SearchResult<PackageSearchMetadata>> future = step
                .takeUntilOther(signal.whenCancelled())
                .switchIfEmpty(Mono.error(() -> new CancellationException("Fetch was cancelled")))
                .doOnSuccess(page -> finish.set(System.nanoTime()))
                .subscribeOn(context.scheduler())
                .toFuture();
        inFlight = new Fetch(kind, future, start, finish, signal);

        Snapshot current = snapshot;
        snapshot = new Snapshot(current.items(), current.state().withStatus(LoadingStatus.LOADING));
    }

    private void complete(final Fetch fetch) {
        Snapshot current = snapshot;
        UUID operationId = current.state().operationId();

        SearchResult<PackageSearchMetadata> page;
        try {
            page = fetch.future().join();
        } catch (CancellationException ex) {
            cancelled(current, operationId);
            return;
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof CancellationException) {
                cancelled(current, operationId);
                return;
            }
            log.warn("Search {} failed to load a page: {}", operationId, String.valueOf(ex.getCause()));
            snapshot = new Snapshot(current.items(), current.state().withStatus(LoadingStatus.ERROR_OCCURRED));
            return;
        }

        Duration duration = fetch.elapsed();
        LoadingStatus status = LoadingStatusReducer.reduce(page);

        if (status == LoadingStatus.ERROR_OCCURRED) {
            // every source failed: keep the tokens so loadNext re-issues this step
            log.warn("Search {} {} failed on every source", operationId, fetch.kind());
        } else {
            if (fetch.kind() == FetchKind.PAGE) {
                firstPageLoaded = true;
            }
            nextToken = page.nextToken();
            refreshToken = page.refreshToken();
            if (status == LoadingStatus.LOADING && refreshToken == null) {
                status = nextToken != null ? LoadingStatus.READY : LoadingStatus.NO_MORE_ITEMS;
            }
        }

        List<PackageItem> items = append(current.items(), page.items());
        snapshot = new Snapshot(items, new LoaderState(status, operationId, items.size()));

        log.debug("Search {} {} done: {} rows, status={}, {} ms", operationId, fetch.kind(),
                page.items().size(), status, duration.toMillis());

        if (fetch.kind() == FetchKind.PAGE) {
            int index = pageIndex++;
            LoadingStatus pageStatus = status;
            context.telemetry().ifPresent(t -> t.emit(context.events().searchPage(operationId, index, pageStatus,
                    page.items().size(), duration, page.aggregationDuration(), page.sourceDurations().values())));
        }

        if (status == LoadingStatus.LOADING) {
            startFetch(FetchKind.REFRESH, feed.refreshSearch(refreshToken, fetch.signal()), fetch.signal());
        }
    }

    private void cancelled(final Snapshot current, final UUID operationId) {
        log.info("Search {} fetch was cancelled", operationId);
        snapshot = new Snapshot(current.items(), current.state().withStatus(LoadingStatus.CANCELLED));
    }

    // rows already visible (same package id) are not appended twice
    private List<PackageItem> append(final List<PackageItem> visible, final List<PackageSearchMetadata> rows) {
        if (rows.isEmpty()) {
            return visible;
        }
        Set<String> keys = new HashSet<>();
        visible.forEach(item -> keys.add(item.identity().key()));

        List<PackageItem> items = new ArrayList<>(visible);
        boolean multiSource = feed.isMultiSource();
        for (PackageSearchMetadata row : rows) {
            if (keys.add(row.identity().key())) {
                items.add(PackageItem.from(row, multiSource));
            }
        }
        return List.copyOf(items);
    }

    private static CancellationSignal orNone(final CancellationSignal signal) {
        return signal == null ? CancellationSignal.none() : signal;
    }
}
