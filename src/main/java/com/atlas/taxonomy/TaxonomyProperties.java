package com.atlas.taxonomy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * Settings for loading the ATT&CK taxonomy snapshot.
 */
@Configuration
@ConfigurationProperties(prefix = "atlas.taxonomy")
public class TaxonomyProperties {

    /**
     * Spring resource location of the STIX bundle; blank means the built-in tactic list.
     */
    private String location = "";

    /**
     * Additional deprecated-to-current technique mappings, applied on top of the
     * revoked-by relationships of the bundle.
     */
    private Map<String, String> remap = new HashMap<>();

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public Map<String, String> getRemap() {
        return remap;
    }

    public void setRemap(Map<String, String> remap) {
        this.remap = remap;
    }
}
