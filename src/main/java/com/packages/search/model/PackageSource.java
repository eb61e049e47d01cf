package com.packages.search.model;

import com.packages.search.feed.FeedType;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;

/**
 * A configured package source.
 *
 * @param name     unique source name, used as key in status and duration maps
 * @param location URL, {@code classpath:}/{@code file:} resource or filesystem path
 */
public record PackageSource(String name, String location) {

    private static final String V3_INDEX = "/index.json";

    public PackageSource {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Package source name must not be blank");
        }
        if (StringUtils.isBlank(location)) {
            throw new IllegalArgumentException("Package source " + name + " has no location");
        }
    }

    /**
     * Classifies the source by its location.
     *
     * @return the feed protocol implied by {@link #location()}
     */
    public FeedType feedType() {
        String loc = location.trim().toLowerCase(Locale.ROOT);
        if (loc.startsWith("http://") || loc.startsWith("https://")) {
            return loc.endsWith(V3_INDEX) ? FeedType.HTTP_V3 : FeedType.HTTP_V2;
        }
        if (loc.startsWith("classpath:") || loc.startsWith("file:")
                || loc.startsWith("/") || loc.startsWith(".") || loc.matches("^[a-z]:[\\\\/].*")) {
            return FeedType.LOCAL;
        }
        return FeedType.UNKNOWN;
    }

    /**
     * @return the host of an HTTP source, empty for every other kind
     */
    public Optional<String> host() {
        if (!feedType().isHttp()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(URI.create(location.trim()).getHost());
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
