package com.packages.search.loader;

import com.packages.search.feed.PackageFeed;
import lombok.RequiredArgsConstructor;

/**
 * Creates loaders bound to the application's feed and collaborators.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * @Autowired
 * private PackageItemLoaderFactory loaders;
 *
 * PackageItemLoader loader = loaders.create("serilog", true);
 * }</pre>
 */
@RequiredArgsConstructor
public class PackageItemLoaderFactory {

    private final PackageLoadContext context;

    private final PackageFeed feed;

    /**
     * @param searchText        query text
     * @param includePrerelease whether pre-release versions are searched by default
     * @return a new loader in state {@code UNKNOWN}
     */
    public PackageItemLoader create(final String searchText, final boolean includePrerelease) {
        return new PackageItemLoader(context, feed, searchText, includePrerelease);
    }
}
