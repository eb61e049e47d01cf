package com.packages.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the package search engine.
 *
 * <p>This Spring Boot application wires:
 * <ul>
 *   <li>one feed per configured package source (local catalogs out of the box),</li>
 *   <li>the multi-source feed that fans every query out to all of them,</li>
 *   <li>the {@link com.packages.search.loader.PackageItemLoaderFactory} that hosts use
 *       to create incremental loaders.</li>
 * </ul>
 * Sources are declared under <code>packages.sources</code> in
 * <code>application.yml</code>.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   mvn spring-boot:run
 * }</pre>
 */
@SpringBootApplication
public class PackageSearchApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(PackageSearchApplication.class, args);
    }
}
