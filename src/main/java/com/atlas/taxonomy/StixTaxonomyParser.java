package com.atlas.taxonomy;

import com.atlas.domain.Tactic;
import com.atlas.domain.Technique;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses a MITRE ATT&CK STIX 2.x bundle (enterprise-attack.json) into a {@link TaxonomyIndex}.
 *
 * Handled object types:
 * - x-mitre-tactic: tactic id from the TA external reference, short name for kill-chain lookup
 * - attack-pattern: technique id from the T external reference, tactics from kill_chain_phases
 * - relationship with relationship_type revoked-by: feeds the deprecated-to-current remap table
 *
 * Objects missing an external id are skipped; a malformed object never aborts the parse.
 */
public class StixTaxonomyParser {

    private static final Logger log = LoggerFactory.getLogger(StixTaxonomyParser.class);
    private static final String KILL_CHAIN_NAME = "mitre-attack";

    private final ObjectMapper objectMapper;

    public StixTaxonomyParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TaxonomyIndex parse(InputStream bundle, Map<String, String> extraRemap) throws IOException {
        JsonNode root = objectMapper.readTree(bundle);
        return parse(root, extraRemap);
    }

    public TaxonomyIndex parse(JsonNode root, Map<String, String> extraRemap) {
        JsonNode objects = root.path("objects");

        Map<String, Tactic> tactics = new LinkedHashMap<>();
        Map<String, String> tacticIdByShortName = new HashMap<>();
        Map<String, String> externalIdByStixId = new HashMap<>();
        List<JsonNode> attackPatterns = new ArrayList<>();
        List<JsonNode> revocations = new ArrayList<>();

        for (JsonNode obj : objects) {
            String type = obj.path("type").asText("");
            switch (type) {
                case "x-mitre-tactic":
                    Tactic tactic = parseTactic(obj);
                    if (tactic != null) {
                        tactics.put(tactic.getId(), tactic);
                        tacticIdByShortName.put(tactic.getShortName(), tactic.getId());
                    }
                    break;
                case "attack-pattern":
                    attackPatterns.add(obj);
                    break;
                case "relationship":
                    if ("revoked-by".equals(obj.path("relationship_type").asText())) {
                        revocations.add(obj);
                    }
                    break;
                default:
                    break;
            }
        }

        // Tactics first so kill-chain phase names can be mapped to tactic ids
        List<Technique> techniques = new ArrayList<>();
        for (JsonNode obj : attackPatterns) {
            String techniqueId = externalId(obj, "T");
            if (techniqueId == null) {
                log.debug("Skipping attack-pattern without technique id: {}", obj.path("id").asText());
                continue;
            }
            externalIdByStixId.put(obj.path("id").asText(), techniqueId);

            List<String> techniqueTactics = new ArrayList<>();
            for (JsonNode phase : obj.path("kill_chain_phases")) {
                if (KILL_CHAIN_NAME.equals(phase.path("kill_chain_name").asText())) {
                    String tacticId = tacticIdByShortName.get(phase.path("phase_name").asText());
                    if (tacticId != null) {
                        techniqueTactics.add(tacticId);
                    }
                }
            }

            boolean deprecated = obj.path("x_mitre_deprecated").asBoolean(false)
                || obj.path("revoked").asBoolean(false);
            String parentId = techniqueId.contains(".")
                ? techniqueId.substring(0, techniqueId.indexOf('.'))
                : null;
            techniques.add(new Technique(techniqueId, obj.path("name").asText(""),
                techniqueTactics, parentId, deprecated));
        }

        Map<String, String> remap = new HashMap<>();
        for (JsonNode relationship : revocations) {
            String from = externalIdByStixId.get(relationship.path("source_ref").asText());
            String to = externalIdByStixId.get(relationship.path("target_ref").asText());
            if (from != null && to != null && !from.equals(to)) {
                remap.put(from, to);
            }
        }
        if (extraRemap != null) {
            remap.putAll(extraRemap);
        }

        log.info("Parsed MITRE ATT&CK bundle: {} tactics, {} techniques, {} remapped ids",
            tactics.size(), techniques.size(), remap.size());
        return new TaxonomyIndex(tactics.values(), techniques, remap);
    }

    /**
     * The fourteen enterprise tactics without techniques, used when no bundle
     * is configured or the configured one cannot be read.
     */
    public static TaxonomyIndex fallback(Map<String, String> extraRemap) {
        List<Tactic> tactics = List.of(
            new Tactic("TA0043", "Reconnaissance", "reconnaissance", false),
            new Tactic("TA0042", "Resource Development", "resource-development", false),
            new Tactic("TA0001", "Initial Access", "initial-access", false),
            new Tactic("TA0002", "Execution", "execution", false),
            new Tactic("TA0003", "Persistence", "persistence", false),
            new Tactic("TA0004", "Privilege Escalation", "privilege-escalation", false),
            new Tactic("TA0005", "Defense Evasion", "defense-evasion", false),
            new Tactic("TA0006", "Credential Access", "credential-access", false),
            new Tactic("TA0007", "Discovery", "discovery", false),
            new Tactic("TA0008", "Lateral Movement", "lateral-movement", false),
            new Tactic("TA0009", "Collection", "collection", false),
            new Tactic("TA0011", "Command and Control", "command-and-control", false),
            new Tactic("TA0010", "Exfiltration", "exfiltration", false),
            new Tactic("TA0040", "Impact", "impact", false));
        return new TaxonomyIndex(tactics, List.of(), extraRemap);
    }

    private Tactic parseTactic(JsonNode obj) {
        String tacticId = externalId(obj, "TA");
        String name = obj.path("name").asText("");
        if (tacticId == null || name.isEmpty()) {
            return null;
        }
        return new Tactic(tacticId, name, obj.path("x_mitre_shortname").asText(""),
            obj.path("x_mitre_deprecated").asBoolean(false));
    }

    private static String externalId(JsonNode obj, String prefix) {
        for (JsonNode ref : obj.path("external_references")) {
            String externalId = ref.path("external_id").asText("");
            if (!"mitre-attack".equals(ref.path("source_name").asText("mitre-attack"))) {
                continue;
            }
            if (externalId.startsWith(prefix) && (!"T".equals(prefix) || !externalId.startsWith("TA"))) {
                return externalId;
            }
        }
        return null;
    }
}
