package com.packages.search.loader;

import com.packages.search.model.PackageSource;
import com.packages.search.telemetry.SearchTelemetryEvents;
import com.packages.search.telemetry.TelemetryService;
import lombok.Builder;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;

/**
 * Collaborators shared by the loaders of one application.
 *
 * @param sources          sources behind the feed, reported in the source summary event
 * @param telemetryService telemetry sink; {@code null} disables telemetry
 * @param events           factory for the search telemetry events
 * @param scheduler        scheduler background fetches are subscribed on
 */
@Builder
public record PackageLoadContext(List<PackageSource> sources,
                                 TelemetryService telemetryService,
                                 SearchTelemetryEvents events,
                                 Scheduler scheduler) {

    public PackageLoadContext {
        sources = sources == null ? List.of() : List.copyOf(sources);
        scheduler = scheduler == null ? Schedulers.boundedElastic() : scheduler;
        if (telemetryService != null && events == null) {
            throw new IllegalArgumentException("A telemetry service needs a SearchTelemetryEvents factory");
        }
    }

    public Optional<TelemetryService> telemetry() {
        return Optional.ofNullable(telemetryService);
    }
}
