package com.atlas.taxonomy;

import com.atlas.TestData;
import com.atlas.domain.Tactic;
import com.atlas.domain.Technique;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TaxonomyIndexTest {

    private TaxonomyIndex taxonomy;

    @BeforeEach
    void setUp() {
        taxonomy = TestData.taxonomy();
    }

    @Test
    void testResolve_CurrentTechnique_ShouldReturnCurrent() {
        // Given: A current technique id written the way Sigma tags carry it
        // When: Resolving it
        TechniqueResolution resolution = taxonomy.resolve("attack.t1059.001");

        // Then: The normalized id resolves directly
        assertThat(resolution.getStatus()).isEqualTo(TechniqueResolution.Status.CURRENT);
        assertThat(resolution.getTechniqueId()).isEqualTo("T1059.001");
        assertThat(resolution.isResolved()).isTrue();
    }

    @Test
    void testResolve_DeprecatedTechnique_ShouldFollowRemap() {
        TechniqueResolution resolution = taxonomy.resolve("T1064");

        assertThat(resolution.getStatus()).isEqualTo(TechniqueResolution.Status.REMAPPED);
        assertThat(resolution.getOriginalId()).isEqualTo("T1064");
        assertThat(resolution.getTechniqueId()).isEqualTo("T1059");
        assertThat(taxonomy.resolveTechnique("T1064")).map(Technique::getId).contains("T1059");
    }

    @Test
    void testResolve_UnknownTechnique_ShouldKeepOriginalId() {
        TechniqueResolution resolution = taxonomy.resolve("t9999");

        assertThat(resolution.getStatus()).isEqualTo(TechniqueResolution.Status.UNRESOLVABLE);
        assertThat(resolution.getTechniqueId()).isEqualTo("T9999");
        assertThat(taxonomy.resolveTechnique("T9999")).isEmpty();
    }

    @Test
    @DisplayName("Remap cycles terminate as unresolvable")
    void testResolve_RemapCycle_ShouldTerminate() {
        TaxonomyIndex cyclic = new TaxonomyIndex(List.of(), List.of(), Map.of("T1000", "T2000", "T2000", "T1000"));

        assertThat(cyclic.resolve("T1000").getStatus()).isEqualTo(TechniqueResolution.Status.UNRESOLVABLE);
    }

    @Test
    void testListTechniquesByTactic_ShouldOrderParentsFirst() {
        List<Technique> withSubs = taxonomy.listTechniquesByTactic("TA0002", true);
        List<Technique> topLevel = taxonomy.listTechniquesByTactic("TA0002", false);

        assertThat(withSubs).extracting(Technique::getId).containsExactly("T1059", "T1059.001");
        assertThat(topLevel).extracting(Technique::getId).containsExactly("T1059");
    }

    @Test
    void testListTechniquesByTactic_ShouldExcludeDeprecated() {
        assertThat(taxonomy.listTechniquesByTactic("TA0002", true))
            .extracting(Technique::getId)
            .doesNotContain("T1064");
    }

    @Test
    void testSubtechnique_WithoutTactics_ShouldInheritParentTactics() {
        Technique hollowing = taxonomy.getTechnique("T1055.012").orElseThrow();

        assertThat(hollowing.getTactics()).containsExactlyInAnyOrder("TA0005", "TA0004");
        assertThat(taxonomy.listTechniquesByTactic("TA0004", true))
            .extracting(Technique::getId)
            .containsExactly("T1055", "T1055.012");
    }

    @Test
    void testGetSubtechniqueIds_ShouldUseAdjacency() {
        assertThat(taxonomy.getSubtechniqueIds("T1055")).containsExactly("T1055.012");
        assertThat(taxonomy.getSubtechniqueIds("T1055.012")).isEmpty();
    }

    @Test
    void testGetTactics_ShouldFollowKillChainOrder() {
        assertThat(taxonomy.getTactics())
            .extracting(Tactic::getId)
            .containsExactly("TA0002", "TA0004", "TA0005");
    }

    @Test
    void testResolveTacticReference_ShouldAcceptNamesAndShortNames() {
        assertThat(taxonomy.resolveTacticReference("attack.defense_evasion")).map(Tactic::getId).contains("TA0005");
        assertThat(taxonomy.resolveTacticReference("Privilege Escalation")).map(Tactic::getId).contains("TA0004");
        assertThat(taxonomy.resolveTacticReference("ta0002")).map(Tactic::getId).contains("TA0002");
        assertThat(taxonomy.resolveTacticReference("lateral-movement")).isEmpty();
    }

    @Test
    void testGeneration_ShouldDifferPerIndex() {
        assertThat(TestData.taxonomy().getGeneration()).isNotEqualTo(taxonomy.getGeneration());
    }
}
