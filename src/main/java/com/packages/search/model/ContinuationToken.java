package com.packages.search.model;

/**
 * Opaque handle that lets a feed resume paging where a previous page stopped.
 * Only the feed that issued a token interprets it.
 */
public interface ContinuationToken {
}
