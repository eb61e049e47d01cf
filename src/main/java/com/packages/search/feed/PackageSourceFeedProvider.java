package com.packages.search.feed;

import com.packages.search.config.PackageSourceCfg;
import com.packages.search.model.PackageSource;

/**
 * Creates the {@link PackageFeed} for a configured package source.
 * <p>
 * Implementations encapsulate one way of reaching a source, e.g. a local catalog file
 * or a particular HTTP protocol. Every provider bean is consulted in order by
 * {@link PackageSourceFeedRegistry}.
 * </p>
 */
public interface PackageSourceFeedProvider {

    /**
     * @param source candidate source
     * @return {@code true} when this provider can build a feed for {@code source}
     */
    boolean supports(PackageSource source);

    /**
     * @param cfg configuration of a source this provider {@link #supports(PackageSource) supports}
     * @return a feed bound to that source
     * @throws IllegalStateException if the source cannot be opened
     */
    PackageFeed create(PackageSourceCfg cfg);
}
