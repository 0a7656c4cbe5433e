package com.atlas.taxonomy;

import java.util.Objects;

/**
 * Outcome of resolving a technique id against the taxonomy.
 *
 * For an unresolvable id {@link #getTechniqueId()} returns the normalized
 * original so callers can still report it.
 */
public final class TechniqueResolution {

    public enum Status {
        /** The id names a current technique. */
        CURRENT,
        /** The id was deprecated or revoked and mapped to its replacement. */
        REMAPPED,
        /** Neither a current technique nor a mapped deprecated one. */
        UNRESOLVABLE
    }

    private final String originalId;
    private final String techniqueId;
    private final Status status;

    TechniqueResolution(String originalId, String techniqueId, Status status) {
        this.originalId = originalId;
        this.techniqueId = techniqueId;
        this.status = status;
    }

    public String getOriginalId() {
        return originalId;
    }

    public String getTechniqueId() {
        return techniqueId;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isResolved() {
        return status != Status.UNRESOLVABLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TechniqueResolution)) {
            return false;
        }
        TechniqueResolution that = (TechniqueResolution) o;
        return Objects.equals(originalId, that.originalId)
            && Objects.equals(techniqueId, that.techniqueId)
            && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(originalId, techniqueId, status);
    }

    @Override
    public String toString() {
        return originalId + " -> " + techniqueId + " (" + status + ")";
    }
}
