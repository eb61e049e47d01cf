package com.packages.search.feed;

/**
 * Protocol family of a package source, derived from its location.
 */
public enum FeedType {
    LOCAL,
    HTTP_V2,
    HTTP_V3,
    UNKNOWN;

    public boolean isHttp() {
        return this == HTTP_V2 || this == HTTP_V3;
    }
}
