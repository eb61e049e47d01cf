package com.packages.search.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.packages.search.config.PackageSourceCfg;
import com.packages.search.model.PackageSearchMetadata;
import com.packages.search.model.PackageSource;
import com.packages.search.parser.CatalogParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Builds {@link LocalCatalogPackageFeed}s for {@link FeedType#LOCAL} sources by loading
 * and parsing their catalog document once, at startup.
 */
@Slf4j
@Component
public class LocalPackageSourceFeedProvider implements PackageSourceFeedProvider {

    private final ResourceLoader resourceLoader;

    private final CatalogParser parser;

    private final ObjectMapper mapper;

    public LocalPackageSourceFeedProvider(final ResourceLoader resourceLoader,
                                          final CatalogParser parser,
                                          @Qualifier("searchObjectMapper") final ObjectMapper mapper) {
        this.resourceLoader = resourceLoader;
        this.parser = parser;
        this.mapper = mapper;
    }

    @Override
    public boolean supports(final PackageSource source) {
        return source.feedType() == FeedType.LOCAL;
    }

    @Override
    public PackageFeed create(final PackageSourceCfg cfg) {
        PackageSource source = cfg.toSource();
        Resource resource = resourceLoader.getResource(resourceLocation(source.location()));
        if (!resource.exists()) {
            throw new IllegalStateException("Catalog for source " + source.name()
                    + " not found at " + source.location());
        }

        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = mapper.readTree(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot read catalog of source " + source.name(), ex);
        }

        List<PackageSearchMetadata> rows = parser.parse(root);
        log.info("Loaded {} catalog rows for source {}", rows.size(), source.name());
        return new LocalCatalogPackageFeed(source, rows, cfg.getPageSize());
    }

    // bare filesystem paths would otherwise be resolved against the classpath
    private static String resourceLocation(final String location) {
        String loc = location.trim();
        if (loc.startsWith("classpath:") || loc.startsWith("file:")) {
            return loc;
        }
        return "file:" + loc;
    }
}
