package com.packages.search.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.packages.search.model.PackageIdentity;
import com.packages.search.model.PackageSearchMetadata;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * <h2>JSON catalog parser</h2>
 *
 * <p>Reads the package catalog format used by local sources:</p>
 * <pre>{@code
 * {
 *   "packages": [
 *     {
 *       "id": "Serilog",
 *       "version": "3.1.1",
 *       "title": "Serilog",
 *       "summary": "Simple .NET logging with fully-structured events",
 *       "authors": "Serilog Contributors",
 *       "tags": ["logging", "serilog"],
 *       "downloadCount": 1200000,
 *       "packageType": "Dependency",
 *       "prefixReserved": true,
 *       "listed": true
 *     }
 *   ]
 * }
 * }</pre>
 *
 * <p>Rows without an id or a version are skipped with a warning.</p>
 */
@Slf4j
@Component
public class JsonCatalogParser implements CatalogParser {

    private static final String DEFAULT_PACKAGE_TYPE = "Dependency";

    @Override
    public List<PackageSearchMetadata> parse(final JsonNode root) {
        JsonNode packages = root == null ? null : root.path("packages");
        if (packages == null || !packages.isArray()) {
            log.warn("Catalog document has no 'packages' array");
            return List.of();
        }

        List<PackageSearchMetadata> rows = new ArrayList<>(packages.size());
        for (JsonNode node : packages) {
            String id = text(node, "id");
            String version = text(node, "version");
            if (StringUtils.isAnyBlank(id, version)) {
                log.warn("Skipping catalog row without id/version: {}", node);
                continue;
            }

            PackageSearchMetadata.PackageSearchMetadataBuilder row = PackageSearchMetadata.builder()
                    .identity(new PackageIdentity(id, version))
                    .title(text(node, "title"))
                    .summary(text(node, "summary"))
                    .authors(authors(node.path("authors")))
                    .downloadCount(node.path("downloadCount").asLong(0L))
                    .packageType(StringUtils.defaultIfBlank(text(node, "packageType"), DEFAULT_PACKAGE_TYPE))
                    .prefixReserved(node.path("prefixReserved").asBoolean(false))
                    .unlisted(!node.path("listed").asBoolean(true));

            node.path("tags").forEach(tag -> {
                if (StringUtils.isNotBlank(tag.asText())) {
                    row.tag(tag.asText().trim());
                }
            });
            rows.add(row.build());
        }
        return rows;
    }

    private static String text(final JsonNode node, final String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : StringUtils.trimToNull(value.asText());
    }

    // "authors" is either a plain string or an array of names
    private static String authors(final JsonNode node) {
        if (node.isArray()) {
            List<String> names = new ArrayList<>();
            node.forEach(n -> names.add(n.asText()));
            return String.join(", ", names);
        }
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
