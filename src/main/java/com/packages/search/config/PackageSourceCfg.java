package com.packages.search.config;

import com.packages.search.model.PackageSource;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

/**
 * Configuration of one package source.
 * <p>
 * Sources are queried in the order they are declared; that order is also the priority
 * used when two sources return the same package.
 * </p>
 */
@Getter
@Setter
public class PackageSourceCfg {

    /**
     * Unique source name, e.g. "nuget.org" or "local-mirror".
     */
    @NotBlank
    private String name;

    /**
     * Where the source lives.
     * <p>For example "https://api.nuget.org/v3/index.json" or "classpath:catalogs/local.json".</p>
     */
    @NotBlank
    private String location;

    /**
     * Whether the source takes part in searches
     */
    private boolean enabled = true;

    /**
     * Rows per page requested from the source
     */
    @Min(1)
    private int pageSize = 25;

    /**
     * @return the immutable source descriptor for this entry
     */
    public PackageSource toSource() {
        return new PackageSource(name, location);
    }
}
