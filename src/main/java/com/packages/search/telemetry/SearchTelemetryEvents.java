package com.packages.search.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.packages.search.feed.FeedType;
import com.packages.search.model.LoadingStatus;
import com.packages.search.model.PackageSource;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Builds the telemetry events that describe one logical search.
 *
 * <p>Order for a search: {@value #SEARCH}, {@value #SOURCE_SUMMARY}, then one
 * {@value #SEARCH_PAGE} per completed page. Every event after the first carries the
 * search's operation id as {@code ParentId}.</p>
 */
public class SearchTelemetryEvents {

    public static final String SEARCH = "Search";

    public static final String SOURCE_SUMMARY = "SearchPackageSourceSummary";

    public static final String SEARCH_PAGE = "SearchPage";

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final ObjectMapper mapper;

    private final String defaultCatalogHost;

    /**
     * @param mapper             mapper used to encode per-source durations
     * @param defaultCatalogHost host of the default public catalog, e.g. {@code api.nuget.org}
     */
    public SearchTelemetryEvents(final ObjectMapper mapper, final String defaultCatalogHost) {
        this.mapper = mapper;
        this.defaultCatalogHost = defaultCatalogHost;
    }

    public TelemetryEvent search(final UUID operationId, final String query, final boolean includePrerelease) {
        return new TelemetryEvent(SEARCH)
                .with("OperationId", operationId.toString())
                .with("IncludePrerelease", includePrerelease)
                .withPii("Query", query == null ? "" : query);
    }

    public TelemetryEvent sourceSummary(final UUID operationId, final Collection<PackageSource> sources) {
        Map<FeedType, Integer> counts = new EnumMap<>(FeedType.class);
        for (FeedType type : FeedType.values()) {
            counts.put(type, 0);
        }
        sources.forEach(s -> counts.merge(s.feedType(), 1, Integer::sum));

        return new TelemetryEvent(SOURCE_SUMMARY)
                .with("ParentId", operationId.toString())
                .with("NumLocalFeeds", counts.get(FeedType.LOCAL))
                .with("NumHTTPv2Feeds", counts.get(FeedType.HTTP_V2))
                .with("NumHTTPv3Feeds", counts.get(FeedType.HTTP_V3))
                .with("NumUnknownFeeds", counts.get(FeedType.UNKNOWN))
                .with("DefaultCatalog", defaultCatalog(sources));
    }

    /**
     * @param operationId         id of the logical search
     * @param pageIndex           0-based index of the completed page
     * @param status              composite state after the page
     * @param resultCount         rows in the page
     * @param duration            total fetch time
     * @param aggregationDuration merge time inside the multi-source feed
     * @param sourceDurations     per-source fetch time, in source order
     * @return the page event
     */
    public TelemetryEvent searchPage(final UUID operationId,
                                     final int pageIndex,
                                     final LoadingStatus status,
                                     final int resultCount,
                                     final Duration duration,
                                     final Duration aggregationDuration,
                                     final Collection<Duration> sourceDurations) {
        return new TelemetryEvent(SEARCH_PAGE)
                .with("ParentId", operationId.toString())
                .with("PageIndex", pageIndex)
                .with("LoadingStatus", status.getDisplayName())
                .with("ResultCount", resultCount)
                .with("Duration", seconds(duration))
                .with("ResultsAggregationDuration", seconds(aggregationDuration))
                .with("IndividualSourceDurations", toJson(sourceDurations.stream().map(this::seconds).toList()));
    }

    private String defaultCatalog(final Collection<PackageSource> sources) {
        if (defaultCatalogHost == null) {
            return "NotPresent";
        }
        Optional<PackageSource> catalog = sources.stream()
                .filter(s -> s.host().map(defaultCatalogHost::equalsIgnoreCase).orElse(false))
                .findFirst();
        if (catalog.isEmpty()) {
            return "NotPresent";
        }
        return catalog.get().feedType() == FeedType.HTTP_V3 ? "YesV3" : "YesV2";
    }

    private double seconds(final Duration duration) {
        return duration == null ? 0d : duration.toNanos() / NANOS_PER_SECOND;
    }

    private String toJson(final List<Double> values) {
        try {
            return mapper.writeValueAsString(values);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot encode source durations", ex);
        }
    }
}
