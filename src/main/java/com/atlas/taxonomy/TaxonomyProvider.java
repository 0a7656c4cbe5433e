package com.atlas.taxonomy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link TaxonomyIndex} and swaps it atomically on reload.
 *
 * Callers take one reference via {@link #current()} at the start of a request
 * and use it throughout, so a reload never changes the taxonomy under a
 * running computation.
 */
@Component
public class TaxonomyProvider {

    private static final Logger log = LoggerFactory.getLogger(TaxonomyProvider.class);

    private final AtomicReference<TaxonomyIndex> current = new AtomicReference<>(TaxonomyIndex.empty());
    private final TaxonomyProperties properties;
    private final ResourceLoader resourceLoader;
    private final StixTaxonomyParser parser;

    public TaxonomyProvider(TaxonomyProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
        this.parser = new StixTaxonomyParser(objectMapper);
        reload();
    }

    public TaxonomyIndex current() {
        return current.get();
    }

    /**
     * Replace the current taxonomy with a supplied snapshot.
     */
    public void replace(TaxonomyIndex index) {
        if (index == null) {
            throw new IllegalArgumentException("Taxonomy index must not be null");
        }
        current.set(index);
        log.info("Taxonomy snapshot replaced: {} tactics, {} techniques",
            index.getTacticCount(), index.getTechniqueCount());
    }

    /**
     * Reload from the configured location. An unreadable bundle keeps the
     * previous snapshot if there is one, otherwise the built-in tactics are used.
     *
     * @return true if the configured bundle was loaded
     */
    public boolean reload() {
        String location = properties.getLocation();
        if (location == null || location.isBlank()) {
            log.warn("No MITRE ATT&CK bundle configured, using built-in tactic list");
            replace(StixTaxonomyParser.fallback(properties.getRemap()));
            return false;
        }

        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            replace(parser.parse(in, properties.getRemap()));
            return true;
        } catch (IOException e) {
            log.error("Failed to load MITRE ATT&CK bundle from {}: {}", location, e.getMessage());
            if (current.get().getTechniqueCount() == 0) {
                replace(StixTaxonomyParser.fallback(properties.getRemap()));
            } else {
                log.info("Keeping previous taxonomy snapshot");
            }
            return false;
        }
    }
}
