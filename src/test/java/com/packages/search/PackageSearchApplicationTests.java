package com.packages.search;

import com.packages.search.feed.CancellationSignal;
import com.packages.search.feed.PackageSourceFeedRegistry;
import com.packages.search.feed.aggregate.MultiSourcePackageFeed;
import com.packages.search.loader.PackageItem;
import com.packages.search.loader.PackageItemLoader;
import com.packages.search.loader.PackageItemLoaderFactory;
import com.packages.search.model.LoadingStatus;
import com.packages.search.model.PackageSource;
import com.packages.search.telemetry.SearchTelemetryEvents;
import com.packages.search.telemetry.TelemetryEvent;
import com.packages.search.telemetry.TelemetryService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.verify;

@SpringBootTest
class PackageSearchApplicationTests {

    @Autowired
    private PackageSourceFeedRegistry registry;

    @Autowired
    private MultiSourcePackageFeed feed;

    @Autowired
    private PackageItemLoaderFactory loaders;

    @MockBean
    private TelemetryService telemetry;

    @Test
    void registersEnabledSourcesInConfigurationOrder() {
        assertThat(registry.sources()).extracting(PackageSource::name).containsExactly("primary", "secondary");
        assertThat(registry.find("RETIRED")).isEmpty();
        assertThat(feed.getSources()).isEqualTo(registry.sources());
        assertThat(feed.isMultiSource()).isTrue();
    }

    @Test
    void searchesEveryConfiguredCatalog() throws Exception {
        PackageItemLoader loader = loaders.create("json", false);

        loader.loadNext(null, CancellationSignal.none());
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (loader.getState().loadingStatus() == LoadingStatus.LOADING) {
            if (System.nanoTime() > deadline) {
                fail("Search did not complete");
            }
            Thread.sleep(20);
            loader.updateState(CancellationSignal.none());
        }

        assertThat(loader.getState().loadingStatus()).isEqualTo(LoadingStatus.NO_MORE_ITEMS);
        assertThat(loader.getCurrent()).extracting(item -> item.identity().toString())
                .containsExactly("Json.Core@2.0.0", "Json.Patch@0.3.0", "Json.Schema@1.4.0");
        assertThat(loader.getCurrent()).noneMatch(PackageItem::prefixReserved);

        ArgumentCaptor<TelemetryEvent> events = ArgumentCaptor.forClass(TelemetryEvent.class);
        verify(telemetry, atLeast(3)).emit(events.capture());
        assertThat(events.getAllValues()).extracting(TelemetryEvent::getName)
                .containsSubsequence(SearchTelemetryEvents.SEARCH, SearchTelemetryEvents.SOURCE_SUMMARY,
                        SearchTelemetryEvents.SEARCH_PAGE);
    }
}
