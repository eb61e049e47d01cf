package com.packages.search.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.packages.search.feed.PackageSourceFeedRegistry;
import com.packages.search.feed.aggregate.MultiSourcePackageFeed;
import com.packages.search.loader.PackageItemLoaderFactory;
import com.packages.search.loader.PackageLoadContext;
import com.packages.search.telemetry.LoggingTelemetryService;
import com.packages.search.telemetry.SearchTelemetryEvents;
import com.packages.search.telemetry.TelemetryService;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Wires the search engine: the multi-source feed over every registered source,
 * the telemetry sink and the loader factory.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PackageSearchProperties.class)
public class PackageSearchConfiguration {

    /**
     * Scheduler source queries and loader fetches run on.
     *
     * @return a bounded elastic scheduler, disposed with the context
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler packageSearchScheduler() {
        return Schedulers.newBoundedElastic(Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "package-search");
    }

    @Bean
    public MultiSourcePackageFeed multiSourcePackageFeed(final PackageSourceFeedRegistry registry,
                                                         final CircuitBreakerRegistry breakers,
                                                         final Scheduler packageSearchScheduler) {
        return new MultiSourcePackageFeed(registry.feeds(), breakers, packageSearchScheduler);
    }

    @Bean
    @ConditionalOnMissingBean(TelemetryService.class)
    @ConditionalOnProperty(prefix = "packages.telemetry", name = "enabled",
            havingValue = "true", matchIfMissing = true)
    public TelemetryService loggingTelemetryService() {
        return new LoggingTelemetryService();
    }

    @Bean
    public SearchTelemetryEvents searchTelemetryEvents(@Qualifier("searchObjectMapper") final ObjectMapper mapper,
                                                       final PackageSearchProperties properties) {
        return new SearchTelemetryEvents(mapper, properties.getTelemetry().getDefaultCatalogHost());
    }

    /**
     * @param feed      the application's feed
     * @param telemetry telemetry sink, absent when telemetry is disabled
     * @param events    telemetry event factory
     * @param scheduler background scheduler
     * @return the context shared by every loader
     */
    @Bean
    public PackageLoadContext packageLoadContext(final MultiSourcePackageFeed feed,
                                                 final ObjectProvider<TelemetryService> telemetry,
                                                 final SearchTelemetryEvents events,
                                                 final Scheduler packageSearchScheduler) {
        TelemetryService sink = telemetry.getIfAvailable();
        if (sink == null) {
            log.info("Search telemetry is disabled");
        }
        return PackageLoadContext.builder()
                .sources(feed.getSources())
                .telemetryService(sink)
                .events(events)
                .scheduler(packageSearchScheduler)
                .build();
    }

    @Bean
    public PackageItemLoaderFactory packageItemLoaderFactory(final PackageLoadContext context,
                                                             final MultiSourcePackageFeed feed) {
        return new PackageItemLoaderFactory(context, feed);
    }
}
