package com.packages.search.feed;

import com.packages.search.model.PackageSource;

import java.util.Objects;

/**
 * A package source paired with the feed that queries it.
 *
 * @param source configured source
 * @param feed   feed bound to that source
 */
public record PackageSourceFeed(PackageSource source, PackageFeed feed) {

    public PackageSourceFeed {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(feed, "feed");
    }

    public String name() {
        return source.name();
    }
}
