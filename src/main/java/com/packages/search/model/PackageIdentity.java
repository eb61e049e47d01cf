package com.packages.search.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Objects;

/**
 * Stable identity of a package: its id and version.
 *
 * <p>Ids compare case-insensitively; versions are kept as published by the source.</p>
 *
 * @param id      package id, never blank
 * @param version package version, never blank
 */
public record PackageIdentity(String id, String version) {

    public PackageIdentity {
        if (StringUtils.isBlank(id)) {
            throw new IllegalArgumentException("Package id must not be blank");
        }
        if (StringUtils.isBlank(version)) {
            throw new IllegalArgumentException("Package version must not be blank for " + id);
        }
    }

    /**
     * @return the id folded to lower case, used as the de-duplication key
     */
    public String key() {
        return id.toLowerCase(Locale.ROOT);
    }

    /**
     * @return {@code true} when the version carries a pre-release label ({@code 1.0.0-beta})
     */
    public boolean isPrerelease() {
        return version.indexOf('-') > 0;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PackageIdentity other)) {
            return false;
        }
        return id.equalsIgnoreCase(other.id) && version.equalsIgnoreCase(other.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key(), version.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return id + "@" + version;
    }
}
