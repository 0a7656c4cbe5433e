package com.atlas.api;

import com.atlas.domain.Tactic;
import com.atlas.domain.Technique;
import com.atlas.exception.RecordNotFoundException;
import com.atlas.taxonomy.TaxonomyIndex;
import com.atlas.taxonomy.TaxonomyProvider;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the loaded ATT&CK taxonomy.
 */
@RestController
@RequestMapping("/api/mitre")
public class MitreController {

    private final TaxonomyProvider taxonomyProvider;

    public MitreController(TaxonomyProvider taxonomyProvider) {
        this.taxonomyProvider = taxonomyProvider;
    }

    @GetMapping("/tactics")
    public List<Tactic> listTactics() {
        return taxonomyProvider.current().getTactics();
    }

    @GetMapping("/tactics/{tacticId}")
    public Tactic getTactic(@PathVariable String tacticId) {
        return taxonomyProvider.current().resolveTactic(tacticId)
            .orElseThrow(() -> new RecordNotFoundException("Tactic", tacticId));
    }

    @GetMapping("/techniques")
    public List<Technique> listTechniques(
        @RequestParam(required = false) String tactic,
        @RequestParam(name = "include_subtechniques", defaultValue = "true") boolean includeSubtechniques
    ) {
        TaxonomyIndex taxonomy = taxonomyProvider.current();
        if (tactic != null && !tactic.isBlank()) {
            Tactic resolved = taxonomy.resolveTactic(tactic)
                .orElseThrow(() -> new RecordNotFoundException("Tactic", tactic));
            return taxonomy.listTechniquesByTactic(resolved.getId(), includeSubtechniques);
        }

        List<Technique> techniques = new ArrayList<>();
        for (Technique technique : taxonomy.getTechniques()) {
            if (!technique.isDeprecated() && (includeSubtechniques || !technique.isSubtechnique())) {
                techniques.add(technique);
            }
        }
        techniques.sort(TaxonomyIndex.TECHNIQUE_ORDER);
        return techniques;
    }

    /**
     * Exact lookup; a deprecated id returns the deprecated entry, not its replacement.
     */
    @GetMapping("/techniques/{techniqueId}")
    public Technique getTechnique(@PathVariable String techniqueId) {
        return taxonomyProvider.current().getTechnique(techniqueId)
            .orElseThrow(() -> new RecordNotFoundException("Technique", techniqueId));
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        TaxonomyIndex taxonomy = taxonomyProvider.current();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("tactic_count", taxonomy.getTacticCount());
        stats.put("technique_count", taxonomy.getTechniqueCount() - taxonomy.getSubtechniqueCount());
        stats.put("subtechnique_count", taxonomy.getSubtechniqueCount());
        stats.put("remapped_technique_count", taxonomy.getRemapTable().size());
        return stats;
    }
}
