package com.packages.search.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.packages.search.model.PackageSearchMetadata;

import java.util.List;

/**
 * Converts a catalog document into package search rows.
 */
@FunctionalInterface
public interface CatalogParser {

    /**
     * @param root complete JSON document of the catalog
     * @return rows in document order; may be empty but never {@code null}
     */
    List<PackageSearchMetadata> parse(JsonNode root);

}
