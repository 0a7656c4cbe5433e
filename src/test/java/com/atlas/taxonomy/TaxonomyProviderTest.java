package com.atlas.taxonomy;

import com.atlas.TestData;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.assertj.core.api.Assertions.assertThat;

class TaxonomyProviderTest {

    private TaxonomyProvider provider(String location) {
        TaxonomyProperties properties = new TaxonomyProperties();
        properties.setLocation(location);
        return new TaxonomyProvider(properties, new DefaultResourceLoader(), TestData.objectMapper());
    }

    @Test
    void testStartup_WithBundle_ShouldLoadIt() {
        TaxonomyProvider provider = provider("classpath:stix/enterprise-attack-mini.json");

        assertThat(provider.current().getTechniqueCount()).isEqualTo(6);
    }

    @Test
    void testStartup_WithoutLocation_ShouldUseBuiltInTactics() {
        TaxonomyProvider provider = provider("");

        assertThat(provider.current().getTacticCount()).isEqualTo(14);
        assertThat(provider.reload()).isFalse();
    }

    @Test
    void testReload_MissingBundle_ShouldKeepPreviousSnapshot() {
        // Given: A provider that loaded a bundle
        TaxonomyProperties properties = new TaxonomyProperties();
        properties.setLocation("classpath:stix/enterprise-attack-mini.json");
        TaxonomyProvider provider = new TaxonomyProvider(properties, new DefaultResourceLoader(),
            TestData.objectMapper());
        TaxonomyIndex loaded = provider.current();

        // When: The bundle location goes bad and the provider reloads
        properties.setLocation("classpath:stix/missing.json");
        boolean reloaded = provider.reload();

        // Then: The loaded snapshot stays in place
        assertThat(reloaded).isFalse();
        assertThat(provider.current()).isSameAs(loaded);
    }

    @Test
    void testReplace_ShouldSwapSnapshot() {
        TaxonomyProvider provider = provider("");
        TaxonomyIndex replacement = TestData.taxonomy();

        provider.replace(replacement);

        assertThat(provider.current()).isSameAs(replacement);
    }
}
