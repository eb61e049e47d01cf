package com.packages.search.feed.aggregate;

import com.packages.search.model.PackageSearchMetadata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the pages of several sources into one ordered, de-duplicated list.
 *
 * <p>Rows are interleaved by rank: the first row of every source (in priority order),
 * then the second row of every source, and so on, so each source's own relevance order
 * is kept. Rows sharing a package id collapse into one entry that keeps the earliest
 * position, carries the row of the highest-priority source, and loses its
 * verified-prefix flag when the sources disagree on it.</p>
 */
class SearchResultMerger {

    /**
     * @param pages source pages, highest priority first
     * @return merged rows
     */
    List<PackageSearchMetadata> merge(final List<List<PackageSearchMetadata>> pages) {
        int depth = pages.stream().mapToInt(List::size).max().orElse(0);
        Map<String, Entry> merged = new LinkedHashMap<>();

        for (int rank = 0; rank < depth; rank++) {
            for (int priority = 0; priority < pages.size(); priority++) {
                List<PackageSearchMetadata> page = pages.get(priority);
                if (rank >= page.size()) {
                    continue;
                }
                PackageSearchMetadata row = page.get(rank);
                // replacing an existing key keeps its insertion position
                merged.merge(row.identity().key(), new Entry(row, priority), Entry::combine);
            }
        }

        List<PackageSearchMetadata> rows = new ArrayList<>(merged.size());
        merged.values().forEach(e -> rows.add(e.row()));
        return rows;
    }

    private record Entry(PackageSearchMetadata row, int priority) {

        Entry combine(final Entry other) {
            Entry winner = priority <= other.priority ? this : other;
            boolean disagree = row.prefixReserved() != other.row.prefixReserved();
            return disagree ? new Entry(winner.row.withPrefixReserved(false), winner.priority) : winner;
        }
    }
}
