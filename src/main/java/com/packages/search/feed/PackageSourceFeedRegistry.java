package com.packages.search.feed;

import com.packages.search.config.PackageSearchProperties;
import com.packages.search.config.PackageSourceCfg;
import com.packages.search.model.PackageSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Registry that turns the configured package sources into feeds.
 * Central registry – inject this where you need the ordered list of source feeds.
 */
@Slf4j
@Component
public class PackageSourceFeedRegistry {

    private final List<PackageSourceFeed> feeds;

    public PackageSourceFeedRegistry(final PackageSearchProperties properties,
                                     final List<PackageSourceFeedProvider> providers) {
        Set<String> names = new HashSet<>();
        List<PackageSourceFeed> resolved = new ArrayList<>();

        for (PackageSourceCfg cfg : properties.getSources()) {
            if (!names.add(cfg.getName().toLowerCase(Locale.ROOT))) {
                throw new IllegalStateException("Duplicate package source name: " + cfg.getName());
            }
            if (!cfg.isEnabled()) {
                log.info("Package source {} is disabled", cfg.getName());
                continue;
            }

            PackageSource source = cfg.toSource();
            Optional<PackageSourceFeedProvider> provider = providers.stream()
                    .filter(p -> p.supports(source))
                    .findFirst();
            if (provider.isEmpty()) {
                log.warn("No feed provider for package source {} ({}, {}); skipping",
                        source.name(), source.feedType(), source.location());
                continue;
            }
            resolved.add(new PackageSourceFeed(source, provider.get().create(cfg)));
        }

        this.feeds = List.copyOf(resolved);
        log.info("Registered package sources: {}", feeds.stream().map(PackageSourceFeed::name).toList());
    }

    /**
     * @return enabled source feeds, highest priority first
     */
    public List<PackageSourceFeed> feeds() {
        return feeds;
    }

    /**
     * @return enabled sources, highest priority first
     */
    public List<PackageSource> sources() {
        return feeds.stream().map(PackageSourceFeed::source).toList();
    }

    public Optional<PackageSourceFeed> find(final String name) {
        return feeds.stream().filter(f -> f.name().equalsIgnoreCase(name)).findFirst();
    }
}
