package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A MITRE ATT&CK tactic (adversary goal), e.g. TA0002 Execution.
 */
public final class Tactic {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("short_name")
    private final String shortName;

    @JsonProperty("deprecated")
    private final boolean deprecated;

    public Tactic(String id, String name, String shortName, boolean deprecated) {
        this.id = Objects.requireNonNull(id, "tactic id");
        this.name = name != null ? name : "";
        this.shortName = shortName != null ? shortName : "";
        this.deprecated = deprecated;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getShortName() {
        return shortName;
    }

    public boolean isDeprecated() {
        return deprecated;
    }

    @JsonProperty("url")
    public String getUrl() {
        return "https://attack.mitre.org/tactics/" + id + "/";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tactic)) {
            return false;
        }
        Tactic tactic = (Tactic) o;
        return deprecated == tactic.deprecated
            && id.equals(tactic.id)
            && name.equals(tactic.name)
            && shortName.equals(tactic.shortName);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id + " " + name;
    }
}
