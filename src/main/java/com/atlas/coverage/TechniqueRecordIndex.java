package com.atlas.coverage;

import com.atlas.domain.DetectionRecord;
import com.atlas.domain.DetectionSource;
import com.atlas.domain.Tactic;
import com.atlas.domain.Technique;
import com.atlas.taxonomy.TaxonomyIndex;
import com.atlas.taxonomy.TechniqueResolution;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Records of a snapshot indexed by resolved technique id and source.
 *
 * Built in one pass over the records; the coverage matrix and the gap
 * analysis aggregate from this index instead of joining every record against
 * the whole taxonomy. Technique ids are resolved through the taxonomy first,
 * so deprecated ids count under their replacement. Ids that cannot be
 * resolved keep their original spelling in the per-source sets and are
 * collected in {@link #getUnresolvable()}.
 */
final class TechniqueRecordIndex {

    private final Map<String, Map<DetectionSource, Set<String>>> recordsByTechnique = new HashMap<>();
    private final Map<DetectionSource, Set<String>> techniquesBySource = new EnumMap<>(DetectionSource.class);
    private final Map<String, Set<String>> placementsByTactic = new HashMap<>();
    private final TreeSet<String> unresolvable = new TreeSet<>();
    private int remappedCount;

    private TechniqueRecordIndex() {
    }

    /**
     * @param records records to index
     * @param taxonomy taxonomy to resolve technique and tactic references against
     * @param sources sources to include; empty means all
     */
    static TechniqueRecordIndex build(Collection<DetectionRecord> records, TaxonomyIndex taxonomy,
                                      Set<DetectionSource> sources) {
        TechniqueRecordIndex index = new TechniqueRecordIndex();
        for (DetectionRecord record : records) {
            if (!sources.isEmpty() && !sources.contains(record.getSource())) {
                continue;
            }
            index.add(record, taxonomy);
        }
        return index;
    }

    private void add(DetectionRecord record, TaxonomyIndex taxonomy) {
        Set<String> resolvedIds = new HashSet<>();
        Set<String> sourceTechniques =
            techniquesBySource.computeIfAbsent(record.getSource(), k -> new TreeSet<>());

        for (String reference : record.getMitreTechniques()) {
            TechniqueResolution resolution = taxonomy.resolve(reference);
            String techniqueId = resolution.getTechniqueId();
            if (techniqueId.isEmpty()) {
                continue;
            }
            sourceTechniques.add(techniqueId);
            if (!resolution.isResolved()) {
                unresolvable.add(techniqueId);
                continue;
            }
            if (resolution.getStatus() == TechniqueResolution.Status.REMAPPED) {
                remappedCount++;
            }
            resolvedIds.add(techniqueId);
            recordsByTechnique
                .computeIfAbsent(techniqueId, k -> new EnumMap<>(DetectionSource.class))
                .computeIfAbsent(record.getSource(), k -> new HashSet<>())
                .add(record.getId());
        }

        Set<String> recordTactics = new HashSet<>();
        for (String tacticReference : record.getMitreTactics()) {
            Optional<Tactic> tactic = taxonomy.resolveTacticReference(tacticReference);
            tactic.ifPresent(t -> recordTactics.add(t.getId()));
        }
        if (recordTactics.isEmpty()) {
            return;
        }

        // a technique is placed off-canon only when none of the record's tactics is one of its own
        for (String techniqueId : resolvedIds) {
            if (sharesTactic(taxonomy, techniqueId, recordTactics)) {
                continue;
            }
            for (String tacticId : recordTactics) {
                placementsByTactic.computeIfAbsent(tacticId, k -> new HashSet<>()).add(techniqueId);
            }
        }
    }

    private static boolean sharesTactic(TaxonomyIndex taxonomy, String techniqueId, Set<String> tacticIds) {
        Optional<Technique> technique = taxonomy.getTechnique(techniqueId);
        if (technique.isEmpty()) {
            return false;
        }
        for (String canonical : technique.get().getTactics()) {
            if (tacticIds.contains(canonical)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Ids of records from the source mapped directly to the technique.
     */
    Set<String> recordIds(String techniqueId, DetectionSource source) {
        Map<DetectionSource, Set<String>> bySource = recordsByTechnique.get(techniqueId);
        if (bySource == null) {
            return Collections.emptySet();
        }
        return bySource.getOrDefault(source, Collections.emptySet());
    }

    /**
     * Distinct technique ids referenced by a source, resolved where possible.
     */
    Set<String> techniquesOf(DetectionSource source) {
        return techniquesBySource.getOrDefault(source, Collections.emptySet());
    }

    Set<String> placementsFor(String tacticId) {
        return placementsByTactic.getOrDefault(tacticId, Collections.emptySet());
    }

    TreeSet<String> getUnresolvable() {
        return unresolvable;
    }

    int getRemappedCount() {
        return remappedCount;
    }
}
