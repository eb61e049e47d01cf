package com.packages.search.feed.aggregate;

import com.packages.search.feed.CancellationSignal;
import com.packages.search.feed.PackageSourceFeed;
import com.packages.search.feed.ScriptedPackageFeed;
import com.packages.search.model.ContinuationToken;
import com.packages.search.model.LoadingStatus;
import com.packages.search.model.PackageIdentity;
import com.packages.search.model.PackageSearchMetadata;
import com.packages.search.model.PackageSource;
import com.packages.search.model.SearchFilter;
import com.packages.search.model.SearchResult;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;

class MultiSourcePackageFeedTest {

    private static final SearchFilter FILTER = SearchFilter.of(false);

    private final CircuitBreakerRegistry breakers = CircuitBreakerRegistry.ofDefaults();

    private MultiSourcePackageFeed feedOf(final ScriptedPackageFeed... feeds) {
        List<PackageSourceFeed> sources = Arrays.stream(feeds)
                .map(f -> new PackageSourceFeed(new PackageSource(f.source(), "classpath:" + f.source()), f))
                .toList();
        return new MultiSourcePackageFeed(sources, breakers, Schedulers.boundedElastic());
    }

    private static PackageSearchMetadata row(final String id, final String version, final boolean reserved) {
        return PackageSearchMetadata.builder()
                .identity(new PackageIdentity(id, version))
                .prefixReserved(reserved)
                .build();
    }

    @Test
    void mergesSourcesByRankAndDeduplicatesInFavourOfHigherPriority() {
        ScriptedPackageFeed a = new ScriptedPackageFeed("a",
                List.of(row("X", "1.0.0", false), row("Shared", "2.0.0", false)));
        ScriptedPackageFeed b = new ScriptedPackageFeed("b",
                List.of(row("shared", "1.5.0", false), row("Z", "1.0.0", false)));

        StepVerifier.create(feedOf(a, b).search("q", FILTER, CancellationSignal.none()))
                .assertNext(page -> {
                    assertThat(page.items())
                            .extracting(m -> m.identity().toString())
                            .containsExactly("X@1.0.0", "Shared@2.0.0", "Z@1.0.0");
                    assertThat(page.sourceSearchStatus())
                            .containsEntry("a", LoadingStatus.NO_MORE_ITEMS)
                            .containsEntry("b", LoadingStatus.NO_MORE_ITEMS);
                    assertThat(page.sourceDurations()).containsOnlyKeys("a", "b");
                    assertThat(page.nextToken()).isNull();
                    assertThat(LoadingStatusReducer.reduce(page)).isEqualTo(LoadingStatus.NO_MORE_ITEMS);
                })
                .verifyComplete();
    }

    @Test
    void clearsVerifiedPrefixWhenSourcesDisagree() {
        ScriptedPackageFeed a = new ScriptedPackageFeed("a", List.of(row("Contoso.Core", "1.0.0", true)));
        ScriptedPackageFeed b = new ScriptedPackageFeed("b", List.of(row("Contoso.Core", "1.0.0", false)));

        SearchResult<PackageSearchMetadata> page = feedOf(a, b)
                .search("contoso", FILTER, CancellationSignal.none())
                .block(Duration.ofSeconds(5));

        assertThat(page).isNotNull();
        assertThat(page.items()).hasSize(1);
        assertThat(page.items().get(0).prefixReserved()).isFalse();
    }

    @Test
    void failingSourceDoesNotFailThePage() {
        ScriptedPackageFeed ok = ScriptedPackageFeed.generated("ok", "Ok", 2, 3);
        ScriptedPackageFeed broken = new ScriptedPackageFeed("broken")
                .failingWith(new IllegalStateException("503 Service Unavailable"));

        StepVerifier.create(feedOf(broken, ok).search("", FILTER, CancellationSignal.none()))
                .assertNext(page -> {
                    assertThat(page.items()).hasSize(3);
                    assertThat(page.sourceSearchStatus())
                            .containsEntry("broken", LoadingStatus.ERROR_OCCURRED)
                            .containsEntry("ok", LoadingStatus.READY);
                    assertThat(LoadingStatusReducer.reduce(page)).isEqualTo(LoadingStatus.READY);
                })
                .verifyComplete();
    }

    @Test
    void everySourceFailingYieldsAnEmptyErrorPage() {
        ScriptedPackageFeed a = new ScriptedPackageFeed("a").failingWith(new IllegalStateException("boom"));
        ScriptedPackageFeed b = new ScriptedPackageFeed("b").failingWith(new IllegalStateException("boom"));

        StepVerifier.create(feedOf(a, b).search("", FILTER, CancellationSignal.none()))
                .assertNext(page -> {
                    assertThat(page.items()).isEmpty();
                    assertThat(LoadingStatusReducer.reduce(page)).isEqualTo(LoadingStatus.ERROR_OCCURRED);
                })
                .verifyComplete();
    }

    @Test
    void continuationDrivesOnlySourcesWithMorePagesAndKeepsExhaustedStatuses() {
        ScriptedPackageFeed paged = ScriptedPackageFeed.generated("paged", "P", 2, 2);
        ScriptedPackageFeed single = ScriptedPackageFeed.generated("single", "S", 1, 2);
        MultiSourcePackageFeed feed = feedOf(paged, single);

        SearchResult<PackageSearchMetadata> first = feed.search("", FILTER, CancellationSignal.none())
                .block(Duration.ofSeconds(5));
        assertThat(first).isNotNull();
        assertThat(LoadingStatusReducer.reduce(first)).isEqualTo(LoadingStatus.READY);
        assertThat(first.nextToken()).isNotNull();

        SearchResult<PackageSearchMetadata> second = feed.continueSearch(first.nextToken(), CancellationSignal.none())
                .block(Duration.ofSeconds(5));
        assertThat(second).isNotNull();
        assertThat(second.items()).extracting(m -> m.identity().id()).containsExactly("P.2", "P.3");
        assertThat(second.sourceSearchStatus())
                .containsEntry("paged", LoadingStatus.NO_MORE_ITEMS)
                .containsEntry("single", LoadingStatus.NO_MORE_ITEMS);
        assertThat(second.nextToken()).isNull();
        assertThat(single.continuationCount()).isZero();
        assertThat(paged.continuationCount()).isEqualTo(1);
    }

    @Test
    void rejectsForeignContinuationToken() {
        MultiSourcePackageFeed feed = feedOf(ScriptedPackageFeed.generated("a", "A", 1, 1));

        StepVerifier.create(feed.continueSearch(new ContinuationToken() { }, CancellationSignal.none()))
                .expectError(IllegalArgumentException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void cancellationAbortsTheStepWhileASourceHangs() {
        ScriptedPackageFeed hanging = new ScriptedPackageFeed("hanging").neverAnswering();
        ScriptedPackageFeed fast = ScriptedPackageFeed.generated("fast", "F", 1, 1);
        CancellationSignal signal = CancellationSignal.create();

        StepVerifier.create(feedOf(hanging, fast).search("", FILTER, signal))
                .expectSubscription()
                .then(signal::cancel)
                .expectError(CancellationException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void openCircuitBreakerSkipsTheSource() {
        ScriptedPackageFeed flaky = ScriptedPackageFeed.generated("flaky", "F", 1, 1);
        ScriptedPackageFeed healthy = ScriptedPackageFeed.generated("healthy", "H", 1, 1);
        MultiSourcePackageFeed feed = feedOf(flaky, healthy);
        breakers.circuitBreaker(MultiSourcePackageFeed.BREAKER_PREFIX + "flaky").transitionToOpenState();

        StepVerifier.create(feed.search("", FILTER, CancellationSignal.none()))
                .assertNext(page -> {
                    assertThat(page.sourceSearchStatus()).containsEntry("flaky", LoadingStatus.ERROR_OCCURRED);
                    assertThat(page.items()).extracting(m -> m.identity().id()).containsExactly("H.0");
                })
                .verifyComplete();
        assertThat(flaky.searchCount()).isZero();
    }

    @Test
    void reportsMultiSourceOnlyForMoreThanOneSource() {
        assertThat(feedOf(ScriptedPackageFeed.generated("a", "A", 1, 1)).isMultiSource()).isFalse();
        assertThat(feedOf(ScriptedPackageFeed.generated("a", "A", 1, 1),
                ScriptedPackageFeed.generated("b", "B", 1, 1)).isMultiSource()).isTrue();
    }
}
