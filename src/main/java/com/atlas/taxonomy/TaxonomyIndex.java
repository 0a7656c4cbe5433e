package com.atlas.taxonomy;

import com.atlas.domain.Tactic;
import com.atlas.domain.Technique;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immutable, hash-indexed snapshot of the MITRE ATT&CK enterprise taxonomy.
 *
 * Built once per taxonomy load. The parent/child adjacency, the per-tactic
 * technique listings and the deprecated-to-current remap table are all
 * computed in the constructor, so every lookup afterwards is a map read and
 * the instance can be shared freely between threads.
 */
public final class TaxonomyIndex {

    private static final Logger log = LoggerFactory.getLogger(TaxonomyIndex.class);

    /**
     * Kill-chain order of the enterprise tactics. Tactics missing from this
     * list are appended after it in id order.
     */
    public static final List<String> KILL_CHAIN_ORDER = List.of(
        "TA0043", // Reconnaissance
        "TA0042", // Resource Development
        "TA0001", // Initial Access
        "TA0002", // Execution
        "TA0003", // Persistence
        "TA0004", // Privilege Escalation
        "TA0005", // Defense Evasion
        "TA0006", // Credential Access
        "TA0007", // Discovery
        "TA0008", // Lateral Movement
        "TA0009", // Collection
        "TA0011", // Command and Control
        "TA0010", // Exfiltration
        "TA0040"  // Impact
    );

    private static final int MAX_REMAP_HOPS = 8;
    private static final AtomicLong GENERATIONS = new AtomicLong();

    /** Parents first, then by id. */
    public static final Comparator<Technique> TECHNIQUE_ORDER =
        Comparator.comparing(Technique::isSubtechnique).thenComparing(Technique::getId);

    private final long generation;
    private final Map<String, Tactic> tactics;
    private final Map<String, String> tacticIdsByName;
    private final Map<String, Technique> techniques;
    private final Map<String, List<String>> children;
    private final Map<String, List<Technique>> techniquesByTactic;
    private final Map<String, String> remap;

    public TaxonomyIndex(Collection<Tactic> tactics, Collection<Technique> techniques, Map<String, String> remap) {
        this.generation = GENERATIONS.incrementAndGet();
        this.tactics = indexTactics(tactics);
        this.tacticIdsByName = indexTacticNames(this.tactics);
        this.techniques = indexTechniques(techniques);
        this.children = buildChildren(this.techniques);
        this.techniquesByTactic = buildTacticListings(this.tactics, this.techniques);
        this.remap = normalizeRemap(remap);
    }

    public static TaxonomyIndex empty() {
        return new TaxonomyIndex(Collections.emptyList(), Collections.emptyList(), Collections.emptyMap());
    }

    /**
     * Normalize a technique or tactic id: trims, upper-cases and strips the
     * Sigma-style {@code attack.} prefix.
     */
    public static String normalizeId(String id) {
        if (id == null) {
            return "";
        }
        String normalized = id.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("ATTACK.")) {
            normalized = normalized.substring("ATTACK.".length());
        }
        return normalized;
    }

    // Lookups

    public Optional<Tactic> resolveTactic(String tacticId) {
        return Optional.ofNullable(tactics.get(normalizeId(tacticId)));
    }

    /**
     * Resolve a tactic given either as an id (TA0002) or as a name as rule
     * authors write it ("execution", "Defense Evasion", "attack.defense_evasion").
     */
    public Optional<Tactic> resolveTacticReference(String reference) {
        Optional<Tactic> byId = resolveTactic(reference);
        if (byId.isPresent()) {
            return byId;
        }
        String id = tacticIdsByName.get(nameKey(reference));
        return id != null ? Optional.of(tactics.get(id)) : Optional.empty();
    }

    /**
     * Resolve a technique id to its current technique, following the remap
     * table for deprecated or revoked ids.
     */
    public Optional<Technique> resolveTechnique(String techniqueId) {
        TechniqueResolution resolution = resolve(techniqueId);
        if (!resolution.isResolved()) {
            return Optional.empty();
        }
        return Optional.ofNullable(techniques.get(resolution.getTechniqueId()));
    }

    /**
     * Look up a technique by its exact id without remapping, deprecated entries included.
     */
    public Optional<Technique> getTechnique(String techniqueId) {
        return Optional.ofNullable(techniques.get(normalizeId(techniqueId)));
    }

    public TechniqueResolution resolve(String techniqueId) {
        String id = normalizeId(techniqueId);
        Technique direct = techniques.get(id);
        if (direct != null && !direct.isDeprecated()) {
            return new TechniqueResolution(id, id, TechniqueResolution.Status.CURRENT);
        }

        String current = id;
        Set<String> seen = new HashSet<>();
        for (int hop = 0; hop < MAX_REMAP_HOPS; hop++) {
            String next = remap.get(current);
            if (next == null || !seen.add(next)) {
                break;
            }
            Technique target = techniques.get(next);
            if (target != null && !target.isDeprecated()) {
                return new TechniqueResolution(id, next, TechniqueResolution.Status.REMAPPED);
            }
            current = next;
        }
        return new TechniqueResolution(id, id, TechniqueResolution.Status.UNRESOLVABLE);
    }

    /**
     * Non-deprecated techniques of a tactic, parents first and then by id.
     *
     * @param tacticId the tactic id, e.g. TA0002
     * @param includeSubtechniques whether sub-techniques are listed
     * @return the ordered listing, empty for an unknown tactic
     */
    public List<Technique> listTechniquesByTactic(String tacticId, boolean includeSubtechniques) {
        List<Technique> listing = techniquesByTactic.getOrDefault(normalizeId(tacticId), Collections.emptyList());
        if (includeSubtechniques) {
            return listing;
        }
        List<Technique> topLevel = new ArrayList<>();
        for (Technique technique : listing) {
            if (!technique.isSubtechnique()) {
                topLevel.add(technique);
            }
        }
        return Collections.unmodifiableList(topLevel);
    }

    /**
     * Ids of the sub-techniques of a parent technique, sorted.
     */
    public List<String> getSubtechniqueIds(String parentId) {
        return children.getOrDefault(normalizeId(parentId), Collections.emptyList());
    }

    /**
     * All tactics, kill-chain order first.
     */
    public List<Tactic> getTactics() {
        return new ArrayList<>(tactics.values());
    }

    public Collection<Technique> getTechniques() {
        return Collections.unmodifiableCollection(techniques.values());
    }

    public Map<String, String> getRemapTable() {
        return remap;
    }

    public int getTacticCount() {
        return tactics.size();
    }

    public int getTechniqueCount() {
        return techniques.size();
    }

    public int getSubtechniqueCount() {
        int count = 0;
        for (Technique technique : techniques.values()) {
            if (technique.isSubtechnique()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Unique per constructed index; lets caches tell taxonomy snapshots apart.
     */
    public long getGeneration() {
        return generation;
    }

    // Construction helpers

    private static String nameKey(String name) {
        if (name == null) {
            return "";
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        if (key.startsWith("attack.")) {
            key = key.substring("attack.".length());
        }
        return key.replace('_', '-').replace(' ', '-');
    }

    private static Map<String, String> indexTacticNames(Map<String, Tactic> tactics) {
        Map<String, String> byName = new HashMap<>();
        for (Tactic tactic : tactics.values()) {
            byName.put(nameKey(tactic.getName()), tactic.getId());
            if (!tactic.getShortName().isEmpty()) {
                byName.put(nameKey(tactic.getShortName()), tactic.getId());
            }
        }
        return Collections.unmodifiableMap(byName);
    }

    private static Map<String, Tactic> indexTactics(Collection<Tactic> source) {
        Map<String, Tactic> byId = new HashMap<>();
        for (Tactic tactic : source) {
            byId.put(normalizeId(tactic.getId()), tactic);
        }
        List<String> ordered = new ArrayList<>();
        for (String id : KILL_CHAIN_ORDER) {
            if (byId.containsKey(id)) {
                ordered.add(id);
            }
        }
        List<String> rest = new ArrayList<>(byId.keySet());
        rest.removeAll(ordered);
        Collections.sort(rest);
        ordered.addAll(rest);

        Map<String, Tactic> result = new LinkedHashMap<>();
        for (String id : ordered) {
            result.put(id, byId.get(id));
        }
        return Collections.unmodifiableMap(result);
    }

    private static Map<String, Technique> indexTechniques(Collection<Technique> source) {
        Map<String, Technique> byId = new HashMap<>();
        for (Technique technique : source) {
            byId.put(normalizeId(technique.getId()), technique);
        }
        // sub-techniques without their own tactics inherit the parent's
        for (Map.Entry<String, Technique> entry : byId.entrySet()) {
            Technique technique = entry.getValue();
            if (technique.isSubtechnique() && technique.getTactics().isEmpty()) {
                Technique parent = byId.get(normalizeId(technique.getParentId()));
                if (parent != null) {
                    entry.setValue(technique.withTactics(parent.getTactics()));
                }
            }
        }
        for (Technique technique : byId.values()) {
            if (!technique.isDeprecated() && technique.getTactics().isEmpty()) {
                log.warn("Technique {} has no tactic membership", technique.getId());
            }
        }
        return Collections.unmodifiableMap(byId);
    }

    private static Map<String, List<String>> buildChildren(Map<String, Technique> techniques) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (Technique technique : techniques.values()) {
            if (technique.isSubtechnique() && !technique.isDeprecated()) {
                adjacency.computeIfAbsent(normalizeId(technique.getParentId()), k -> new ArrayList<>())
                    .add(technique.getId());
            }
        }
        Map<String, List<String>> result = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : adjacency.entrySet()) {
            List<String> ids = entry.getValue();
            Collections.sort(ids);
            result.put(entry.getKey(), Collections.unmodifiableList(ids));
        }
        return Collections.unmodifiableMap(result);
    }

    private static Map<String, List<Technique>> buildTacticListings(
            Map<String, Tactic> tactics, Map<String, Technique> techniques) {
        Map<String, List<Technique>> listings = new HashMap<>();
        for (Technique technique : techniques.values()) {
            if (technique.isDeprecated()) {
                continue;
            }
            for (String tacticId : technique.getTactics()) {
                listings.computeIfAbsent(normalizeId(tacticId), k -> new ArrayList<>()).add(technique);
            }
        }
        Map<String, List<Technique>> result = new HashMap<>();
        for (Map.Entry<String, List<Technique>> entry : listings.entrySet()) {
            if (!tactics.containsKey(entry.getKey())) {
                log.warn("Techniques reference unknown tactic {}", entry.getKey());
            }
            List<Technique> ordered = entry.getValue();
            ordered.sort(TECHNIQUE_ORDER);
            result.put(entry.getKey(), Collections.unmodifiableList(ordered));
        }
        return Collections.unmodifiableMap(result);
    }

    private static Map<String, String> normalizeRemap(Map<String, String> source) {
        Map<String, String> result = new HashMap<>();
        if (source != null) {
            for (Map.Entry<String, String> entry : source.entrySet()) {
                if (entry.getKey() != null && entry.getValue() != null) {
                    result.put(normalizeId(entry.getKey()), normalizeId(entry.getValue()));
                }
            }
        }
        return Collections.unmodifiableMap(result);
    }
}
