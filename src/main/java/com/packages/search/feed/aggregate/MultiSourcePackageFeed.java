package com.packages.search.feed.aggregate;

import com.packages.search.feed.CancellationSignal;
import com.packages.search.feed.PackageFeed;
import com.packages.search.feed.PackageSourceFeed;
import com.packages.search.model.ContinuationToken;
import com.packages.search.model.LoadingStatus;
import com.packages.search.model.PackageSearchMetadata;
import com.packages.search.model.PackageSource;
import com.packages.search.model.RefreshToken;
import com.packages.search.model.SearchFilter;
import com.packages.search.model.SearchResult;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * <h2>Multi-source package feed</h2>
 *
 * <p>Fans every search step out to all configured source feeds at once and reduces their
 * pages to a single page:</p>
 * <ul>
 *   <li>each source runs on the {@link Scheduler} behind its own Resilience4j
 *       {@link CircuitBreaker}; a failing source reports {@code ERROR_OCCURRED} for itself
 *       and contributes no rows,</li>
 *   <li>the step completes once every source completed, failed or was cancelled; firing
 *       the {@link CancellationSignal} aborts it with {@link CancellationException},</li>
 *   <li>rows are merged by {@link SearchResultMerger}, states by
 *       {@link LoadingStatusReducer},</li>
 *   <li>continuation and refresh tokens are composites of the sources' own tokens, routed
 *       back to the source that issued them.</li>
 * </ul>
 *
 * <p>No state is kept between calls besides the immutable source list, whose order is
 * the source priority.</p>
 */
@Slf4j
public class MultiSourcePackageFeed implements PackageFeed {

    /**
     * Prefix of the circuit breaker name of each source.
     */
    public static final String BREAKER_PREFIX = "packageSource-";

    private final UUID feedId = UUID.randomUUID();

    private final List<PackageSourceFeed> sources;

    private final CircuitBreakerRegistry breakers;

    private final Scheduler scheduler;

    private final SearchResultMerger merger = new SearchResultMerger();

    /**
     * @param sources   source feeds, highest priority first
     * @param breakers  registry that supplies one circuit breaker per source
     * @param scheduler scheduler the source queries run on
     */
    public MultiSourcePackageFeed(final List<PackageSourceFeed> sources,
                                  final CircuitBreakerRegistry breakers,
                                  final Scheduler scheduler) {
        this.sources = List.copyOf(sources);
        this.breakers = breakers;
        this.scheduler = scheduler;
    }

    @Override
    public boolean isMultiSource() {
        return sources.size() > 1;
    }

    /**
     * @return sources in priority order
     */
    public List<PackageSource> getSources() {
        return sources.stream().map(PackageSourceFeed::source).toList();
    }

    @Override
    public Mono<SearchResult<PackageSearchMetadata>> search(final String searchText,
                                                             final SearchFilter filter,
                                                             final CancellationSignal signal) {
        Map<String, Supplier<Mono<SearchResult<PackageSearchMetadata>>>> calls = new LinkedHashMap<>();
        sources.forEach(s -> calls.put(s.name(), () -> s.feed().search(searchText, filter, signal)));
        return aggregate(searchText, filter, calls, Map.of(), Map.of(), signal);
    }

    @Override
    public Mono<SearchResult<PackageSearchMetadata>> continueSearch(final ContinuationToken token,
                                                                     final CancellationSignal signal) {
        return Mono.defer(() -> {
            if (!(token instanceof AggregateContinuationToken own) || !feedId.equals(own.feedId())) {
                return Mono.error(new IllegalArgumentException(
                        "Continuation token was not issued by this multi-source feed"));
            }

            Map<String, Supplier<Mono<SearchResult<PackageSearchMetadata>>>> calls = new LinkedHashMap<>();
            for (PackageSourceFeed s : sources) {
                ContinuationToken sourceToken = own.sourceTokens().get(s.name());
                if (sourceToken != null) {
                    calls.put(s.name(), () -> s.feed().continueSearch(sourceToken, signal));
                }
            }
            return aggregate(own.searchText(), own.filter(), calls, Map.of(), own.settledStatuses(), signal);
        });
    }

    @Override
    public Mono<SearchResult<PackageSearchMetadata>> refreshSearch(final RefreshToken token,
                                                                    final CancellationSignal signal) {
        return Mono.defer(() -> {
            if (!(token instanceof AggregateRefreshToken own) || !feedId.equals(own.feedId())) {
                return Mono.error(new IllegalArgumentException(
                        "Refresh token was not issued by this multi-source feed"));
            }

            Map<String, Supplier<Mono<SearchResult<PackageSearchMetadata>>>> calls = new LinkedHashMap<>();
            for (PackageSourceFeed s : sources) {
                RefreshToken sourceToken = own.pendingTokens().get(s.name());
                if (sourceToken != null) {
                    calls.put(s.name(), () -> s.feed().refreshSearch(sourceToken, signal));
                }
            }
            return aggregate(own.searchText(), own.filter(), calls,
                    own.settledTokens(), own.settledStatuses(), signal);
        });
    }

    private Mono<SearchResult<PackageSearchMetadata>> aggregate(
            final String searchText,
            final SearchFilter filter,
            final Map<String, Supplier<Mono<SearchResult<PackageSearchMetadata>>>> calls,
            final Map<String, ContinuationToken> carriedTokens,
            final Map<String, LoadingStatus> carriedStatuses,
            final CancellationSignal signal) {

        List<Mono<SourceOutcome>> queries = calls.entrySet().stream()
                .map(e -> query(e.getKey(), e.getValue()))
                .toList();

        // mergeSequential subscribes to every source at once but emits in priority order
        return Flux.mergeSequential(queries)
                .collectList()
                .takeUntilOther(signal.whenCancelled())
                .switchIfEmpty(Mono.error(() -> new CancellationException("Multi-source search was cancelled")))
                .map(outcomes -> combine(searchText, filter, outcomes, carriedTokens, carriedStatuses));
    }

    private Mono<SourceOutcome> query(final String source,
                                      final Supplier<Mono<SearchResult<PackageSearchMetadata>>> call) {
        CircuitBreaker breaker = breakers.circuitBreaker(BREAKER_PREFIX + source);
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return Mono.defer(call)
                    .transformDeferred(CircuitBreakerOperator.of(breaker))
                    .switchIfEmpty(Mono.error(() -> new IllegalStateException("Source returned no page")))
                    .map(page -> SourceOutcome.completed(source, page, since(start)))
                    .onErrorResume(CancellationException.class,
                            ex -> Mono.just(SourceOutcome.cancelled(source, since(start))))
                    .onErrorResume(ex -> {
                        log.warn("Package source {} failed: {}", source, ex.toString());
                        return Mono.just(SourceOutcome.failed(source, since(start)));
                    });
        }).subscribeOn(scheduler);
    }

    private SearchResult<PackageSearchMetadata> combine(final String searchText,
                                                        final SearchFilter filter,
                                                        final List<SourceOutcome> outcomes,
                                                        final Map<String, ContinuationToken> carriedTokens,
                                                        final Map<String, LoadingStatus> carriedStatuses) {
        long start = System.nanoTime();
        Map<String, SourceOutcome> bySource = outcomes.stream()
                .collect(Collectors.toMap(SourceOutcome::source, Function.identity()));

        List<PackageSearchMetadata> rows = merger.merge(outcomes.stream().map(o -> o.page().items()).toList());

        Map<String, LoadingStatus> statuses = new LinkedHashMap<>();
        Map<String, ContinuationToken> nextTokens = new LinkedHashMap<>();
        Map<String, RefreshToken> refreshTokens = new LinkedHashMap<>();
        Map<String, Duration> durations = new LinkedHashMap<>();

        for (PackageSourceFeed s : sources) {
            String name = s.name();
            SourceOutcome outcome = bySource.get(name);
            if (outcome == null) {
                // not queried in this step: carry its earlier state over
                if (carriedTokens.containsKey(name)) {
                    nextTokens.put(name, carriedTokens.get(name));
                }
                if (carriedStatuses.containsKey(name)) {
                    statuses.put(name, carriedStatuses.get(name));
                }
                continue;
            }
            statuses.put(name, outcome.status());
            durations.put(name, outcome.elapsed());
            if (outcome.page().nextToken() != null) {
                nextTokens.put(name, outcome.page().nextToken());
            }
            if (outcome.page().refreshToken() != null) {
                refreshTokens.put(name, outcome.page().refreshToken());
            }
        }

        Map<String, LoadingStatus> notContinued = new LinkedHashMap<>(statuses);
        notContinued.keySet().removeAll(nextTokens.keySet());
        Map<String, ContinuationToken> notRefreshedTokens = new LinkedHashMap<>(nextTokens);
        notRefreshedTokens.keySet().removeAll(refreshTokens.keySet());
        Map<String, LoadingStatus> notRefreshed = new LinkedHashMap<>(statuses);
        notRefreshed.keySet().removeAll(refreshTokens.keySet());

        SearchResult<PackageSearchMetadata> page = SearchResult.<PackageSearchMetadata>builder()
                .items(rows)
                .sourceSearchStatus(statuses)
                .nextToken(nextTokens.isEmpty() ? null
                        : new AggregateContinuationToken(feedId, searchText, filter, nextTokens, notContinued))
                .refreshToken(refreshTokens.isEmpty() ? null
                        : new AggregateRefreshToken(feedId, searchText, filter, refreshTokens,
                                notRefreshedTokens, notRefreshed))
                .sourceDurations(durations)
                .aggregationDuration(since(start))
                .build();

        log.debug("Aggregated {} sources into {} rows, statuses={}, merge={} ms",
                outcomes.size(), rows.size(), statuses, page.aggregationDuration().toMillis());
        return page;
    }

    private static Duration since(final long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
