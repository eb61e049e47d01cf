package com.packages.search.loader;

import com.packages.search.model.PackageIdentity;
import com.packages.search.model.PackageSearchMetadata;

import java.util.List;

/**
 * A row of the loader's result list, as handed to callers.
 *
 * @param identity       package id and version
 * @param title          display title
 * @param summary        short description
 * @param authors        author list
 * @param tags           search tags
 * @param downloadCount  total downloads
 * @param prefixReserved verified-prefix flag; always {@code false} for multi-source searches
 */
public record PackageItem(PackageIdentity identity,
                          String title,
                          String summary,
                          String authors,
                          List<String> tags,
                          long downloadCount,
                          boolean prefixReserved) {

    /**
     * @param metadata    feed row
     * @param multiSource whether the row came from a multi-source search
     * @return the caller-facing row
     */
    static PackageItem from(final PackageSearchMetadata metadata, final boolean multiSource) {
        return new PackageItem(metadata.identity(), metadata.title(), metadata.summary(), metadata.authors(),
                metadata.tags(), metadata.downloadCount(), metadata.prefixReserved() && !multiSource);
    }

    public String id() {
        return identity.id();
    }

    public String version() {
        return identity.version();
    }
}
