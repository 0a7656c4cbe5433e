package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A MITRE ATT&CK technique or sub-technique.
 *
 * A sub-technique always carries its parent's id; a top-level technique never does.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Technique {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("tactics")
    private final Set<String> tactics;

    @JsonProperty("is_subtechnique")
    private final boolean subtechnique;

    @JsonProperty("parent_id")
    private final String parentId;

    @JsonProperty("deprecated")
    private final boolean deprecated;

    public Technique(String id, String name, Collection<String> tactics, String parentId, boolean deprecated) {
        this.id = Objects.requireNonNull(id, "technique id");
        this.name = name != null ? name : "";
        this.tactics = tactics != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(tactics))
            : Collections.emptySet();
        this.parentId = parentId;
        this.subtechnique = parentId != null;
        this.deprecated = deprecated;
    }

    /**
     * Copy of this technique with a different tactic set, used when a
     * sub-technique inherits its parent's tactics.
     */
    public Technique withTactics(Collection<String> newTactics) {
        return new Technique(id, name, newTactics, parentId, deprecated);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Set<String> getTactics() {
        return tactics;
    }

    public boolean isSubtechnique() {
        return subtechnique;
    }

    public String getParentId() {
        return parentId;
    }

    public boolean isDeprecated() {
        return deprecated;
    }

    @JsonProperty("url")
    public String getUrl() {
        return "https://attack.mitre.org/techniques/" + id.replace('.', '/') + "/";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Technique)) {
            return false;
        }
        Technique that = (Technique) o;
        return deprecated == that.deprecated
            && id.equals(that.id)
            && name.equals(that.name)
            && tactics.equals(that.tactics)
            && Objects.equals(parentId, that.parentId);
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
