package com.packages.search.model;

/**
 * Opaque handle that lets a feed re-poll the same logical page set for results
 * that were not available yet when the page was produced.
 * Only the feed that issued a token interprets it.
 */
public interface RefreshToken {
}
