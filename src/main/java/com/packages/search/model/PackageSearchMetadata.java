package com.packages.search.model;

import lombok.Builder;
import lombok.Singular;

import java.util.List;
import java.util.Objects;

/**
 * One package search hit as produced by a feed.
 *
 * @param identity       package id and version
 * @param title          display title; falls back to the id when the source has none
 * @param summary        short description
 * @param authors        comma separated author list as published
 * @param tags           search tags
 * @param downloadCount  total downloads reported by the source
 * @param packageType    package type name, e.g. {@code Dependency} or {@code Template}
 * @param prefixReserved whether the id prefix is verified-reserved on the source
 * @param unlisted       whether the version is hidden from default searches
 */
@Builder(toBuilder = true)
public record PackageSearchMetadata(
        PackageIdentity identity,
        String title,
        String summary,
        String authors,
        @Singular List<String> tags,
        long downloadCount,
        String packageType,
        boolean prefixReserved,
        boolean unlisted
) {

    public PackageSearchMetadata {
        Objects.requireNonNull(identity, "identity");
        tags = tags == null ? List.of() : List.copyOf(tags);
        if (title == null || title.isBlank()) {
            title = identity.id();
        }
    }

    /**
     * Shortcut for a metadata row that only carries an identity.
     *
     * @param id      package id
     * @param version package version
     * @return metadata with default display fields
     */
    public static PackageSearchMetadata of(final String id, final String version) {
        return builder().identity(new PackageIdentity(id, version)).build();
    }

    /**
     * @param reserved new value of the verified-prefix flag
     * @return this row when the flag already matches, otherwise a copy
     */
    public PackageSearchMetadata withPrefixReserved(final boolean reserved) {
        return reserved == prefixReserved ? this : toBuilder().prefixReserved(reserved).build();
    }
}
