package com.packages.search.model;

import lombok.Builder;
import lombok.Singular;

import java.util.Set;

/**
 * Options applied to a search in addition to the query text.
 *
 * @param includePrerelease whether pre-release versions are returned
 * @param includeDelisted   whether unlisted packages are returned
 * @param packageTypes      package types to keep; empty keeps every type
 */
@Builder(toBuilder = true)
public record SearchFilter(boolean includePrerelease,
                           boolean includeDelisted,
                           @Singular Set<String> packageTypes) {

    public SearchFilter {
        packageTypes = packageTypes == null ? Set.of() : Set.copyOf(packageTypes);
    }

    /**
     * @param includePrerelease whether pre-release versions are returned
     * @return a filter with only the pre-release flag set as requested
     */
    public static SearchFilter of(final boolean includePrerelease) {
        return builder().includePrerelease(includePrerelease).build();
    }
}
