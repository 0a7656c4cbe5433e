package com.atlas;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Detection Atlas.
 *
 * Detection Atlas loads normalized detection rules from several vendor
 * repositories and compares their coverage against the MITRE ATT&CK taxonomy.
 *
 * Key Features:
 * - Faceted search, sorting and pagination over the rule collection
 * - Tactic x technique x source coverage matrix
 * - Pairwise coverage gaps between sources
 * - Side-by-side field diffs of 2 to 6 rules
 * - Streaming JSON and CSV export
 */
@SpringBootApplication
public class AtlasApplication {

    /**
     * Main entry point for the Detection Atlas service.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(AtlasApplication.class, args);
    }
}
