package com.atlas.taxonomy;

import com.atlas.TestData;
import com.atlas.domain.Tactic;
import com.atlas.domain.Technique;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StixTaxonomyParserTest {

    private StixTaxonomyParser parser;

    @BeforeEach
    void setUp() {
        parser = new StixTaxonomyParser(TestData.objectMapper());
    }

    private TaxonomyIndex parseBundle(Map<String, String> extraRemap) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/stix/enterprise-attack-mini.json")) {
            return parser.parse(in, extraRemap);
        }
    }

    @Test
    void testParse_ShouldReadTacticsAndTechniques() throws IOException {
        // Given: A bundle with three tactics and six attack patterns
        // When: Parsing it
        TaxonomyIndex taxonomy = parseBundle(Map.of());

        // Then: Tactics come out in kill-chain order and techniques carry tactic ids
        assertThat(taxonomy.getTactics()).extracting(Tactic::getId).containsExactly("TA0002", "TA0004", "TA0005");
        assertThat(taxonomy.getTechniqueCount()).isEqualTo(6);
        assertThat(taxonomy.getTechnique("T1055").orElseThrow().getTactics())
            .containsExactlyInAnyOrder("TA0005", "TA0004");
    }

    @Test
    void testParse_SubtechniqueIds_ShouldLinkParent() throws IOException {
        TaxonomyIndex taxonomy = parseBundle(Map.of());

        Technique powershell = taxonomy.getTechnique("T1059.001").orElseThrow();
        assertThat(powershell.isSubtechnique()).isTrue();
        assertThat(powershell.getParentId()).isEqualTo("T1059");
        assertThat(taxonomy.getSubtechniqueCount()).isEqualTo(2);
    }

    @Test
    void testParse_RevokedByRelationship_ShouldBecomeRemap() throws IOException {
        TaxonomyIndex taxonomy = parseBundle(Map.of());

        assertThat(taxonomy.getTechnique("T1064").orElseThrow().isDeprecated()).isTrue();
        assertThat(taxonomy.getRemapTable()).containsEntry("T1064", "T1059");
        assertThat(taxonomy.resolve("T1064").getStatus()).isEqualTo(TechniqueResolution.Status.REMAPPED);
    }

    @Test
    void testParse_ConfiguredRemap_ShouldApplyToDeprecatedTechnique() throws IOException {
        TaxonomyIndex withoutRemap = parseBundle(Map.of());
        TaxonomyIndex withRemap = parseBundle(Map.of("T1999", "T1055"));

        assertThat(withoutRemap.resolve("T1999").getStatus()).isEqualTo(TechniqueResolution.Status.UNRESOLVABLE);
        assertThat(withRemap.resolve("T1999").getTechniqueId()).isEqualTo("T1055");
    }

    @Test
    void testFallback_ShouldContainEnterpriseTactics() {
        TaxonomyIndex fallback = StixTaxonomyParser.fallback(null);

        assertThat(fallback.getTacticCount()).isEqualTo(14);
        assertThat(fallback.getTechniqueCount()).isZero();
        assertThat(fallback.getTactics().get(0).getId()).isEqualTo("TA0043");
    }
}
