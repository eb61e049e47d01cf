package com.packages.search.feed;

import com.packages.search.model.ContinuationToken;
import com.packages.search.model.LoadingStatus;
import com.packages.search.model.PackageSearchMetadata;
import com.packages.search.model.PackageSource;
import com.packages.search.model.RefreshToken;
import com.packages.search.model.SearchFilter;
import com.packages.search.model.SearchResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * <h2>Local catalog feed</h2>
 *
 * <p>Answers searches from an in-memory package catalog, typically parsed from a JSON
 * file shipped with the application or sitting on disk.</p>
 *
 * <ul>
 *   <li>Blank queries match every row; otherwise the query is matched case-insensitively
 *       against id, title and tags.</li>
 *   <li>Results are ranked: exact id, id prefix, id substring, other matches. Ties go to
 *       the higher download count.</li>
 *   <li>Pages are {@code pageSize} rows long. Continuation tokens are bound to this source.</li>
 * </ul>
 */
@Slf4j
public class LocalCatalogPackageFeed implements PackageFeed {

    /** Rank of a row that does not match the query at all. */
    private static final int NO_MATCH = 4;

    @Getter
    private final PackageSource source;

    private final List<PackageSearchMetadata> catalog;

    @Getter
    private final int pageSize;

    /**
     * @param source   source the catalog was loaded from
     * @param catalog  catalog rows
     * @param pageSize maximum rows per page, at least 1
     */
    public LocalCatalogPackageFeed(final PackageSource source,
                                   final List<PackageSearchMetadata> catalog,
                                   final int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive, got " + pageSize);
        }
        this.source = source;
        this.catalog = List.copyOf(catalog);
        this.pageSize = pageSize;
    }

    @Override
    public boolean isMultiSource() {
        return false;
    }

    @Override
    public Mono<SearchResult<PackageSearchMetadata>> search(final String searchText,
                                                             final SearchFilter filter,
                                                             final CancellationSignal signal) {
        return Mono.fromCallable(() -> page(new LocalToken(source.name(),
                StringUtils.trimToEmpty(searchText), filter, 0), signal));
    }

    @Override
    public Mono<SearchResult<PackageSearchMetadata>> continueSearch(final ContinuationToken token,
                                                                     final CancellationSignal signal) {
        return Mono.fromCallable(() -> page(ownToken(token), signal));
    }

    @Override
    public Mono<SearchResult<PackageSearchMetadata>> refreshSearch(final RefreshToken token,
                                                                    final CancellationSignal signal) {
        return Mono.error(new IllegalArgumentException(
                "Source " + source.name() + " does not issue refresh tokens"));
    }

    private SearchResult<PackageSearchMetadata> page(final LocalToken token, final CancellationSignal signal) {
        signal.throwIfCancelled();
        long start = System.nanoTime();

        List<PackageSearchMetadata> matches = catalog.stream()
                .filter(row -> accepts(row, token.filter()))
                .filter(row -> rank(row, token.query()) < NO_MATCH)
                .sorted(relevance(token.query()))
                .toList();

        int from = Math.min(token.offset(), matches.size());
        int to = Math.min(from + pageSize, matches.size());
        boolean more = to < matches.size();

        log.debug("Source {} query='{}' offset={} -> {} of {} rows", source.name(), token.query(),
                from, to - from, matches.size());

        return SearchResult.<PackageSearchMetadata>builder()
                .items(matches.subList(from, to))
                .sourceStatus(source.name(), more ? LoadingStatus.READY : LoadingStatus.NO_MORE_ITEMS)
                .nextToken(more ? new LocalToken(source.name(), token.query(), token.filter(), to) : null)
                .sourceDuration(source.name(), Duration.ofNanos(System.nanoTime() - start))
                .build();
    }

    private LocalToken ownToken(final ContinuationToken token) {
        if (token instanceof LocalToken local && local.sourceName().equals(source.name())) {
            return local;
        }
        throw new IllegalArgumentException("Continuation token was not issued by source " + source.name());
    }

    private static boolean accepts(final PackageSearchMetadata row, final SearchFilter filter) {
        SearchFilter f = filter == null ? SearchFilter.of(false) : filter;
        if (row.identity().isPrerelease() && !f.includePrerelease()) {
            return false;
        }
        if (row.unlisted() && !f.includeDelisted()) {
            return false;
        }
        return f.packageTypes().isEmpty()
                || f.packageTypes().stream().anyMatch(t -> t.equalsIgnoreCase(row.packageType()));
    }

    private static int rank(final PackageSearchMetadata row, final String query) {
        if (query.isEmpty()) {
            return 0;
        }
        String id = row.identity().id();
        if (id.equalsIgnoreCase(query)) {
            return 0;
        }
        if (id.toLowerCase(Locale.ROOT).startsWith(query.toLowerCase(Locale.ROOT))) {
            return 1;
        }
        if (StringUtils.containsIgnoreCase(id, query)) {
            return 2;
        }
        if (StringUtils.containsIgnoreCase(row.title(), query)
                || row.tags().stream().anyMatch(tag -> StringUtils.containsIgnoreCase(tag, query))) {
            return 3;
        }
        return NO_MATCH;
    }

    private static Comparator<PackageSearchMetadata> relevance(final String query) {
        return Comparator.<PackageSearchMetadata>comparingInt(row -> rank(row, query))
                .thenComparing(Comparator.comparingLong(PackageSearchMetadata::downloadCount).reversed())
                .thenComparing(row -> row.identity().key());
    }

    /**
     * Offset-based continuation bound to one source and one logical search.
     */
    private record LocalToken(String sourceName, String query, SearchFilter filter, int offset)
            implements ContinuationToken {
    }
}
