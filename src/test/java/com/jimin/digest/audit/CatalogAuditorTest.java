package com.jimin.digest.audit;

import com.jimin.digest.core.taxonomy.Taxonomy;
import com.jimin.digest.core.taxonomy.TaxonomyValidator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogAuditorTest {

    private final CatalogAuditor auditor =
            new CatalogAuditor(new TaxonomyValidator(new Taxonomy("t1", Set.of("keto", "sleep"))));

    @Test
    void collectsEveryInvalidTopicAcrossFeeds() {
        CatalogAuditReport report = auditor.audit(List.of(
                entry("Alpha", "keto", "nutrition"),
                entry("Beta", "ai", "sleep"),
                entry("Gamma", "ai", "nutrition", "ai")));

        assertThat(report.isClean()).isFalse();
        assertThat(report.feedCount()).isEqualTo(3);
        assertThat(report.vocabularySize()).isEqualTo(2);
        assertThat(report.totalInvalidAssignments()).isEqualTo(5);
        assertThat(report.invalidTopics())
                .extracting(CatalogAuditReport.InvalidTopicUsage::topic)
                .containsExactly("ai", "nutrition");
        assertThat(report.invalidTopics().get(0).feedNames()).containsExactly("Beta", "Gamma", "Gamma");
    }

    @Test
    void equalCountsKeepDiscoveryOrder() {
        CatalogAuditReport report = auditor.audit(List.of(
                entry("Alpha", "zeta"),
                entry("Beta", "alpha")));

        assertThat(report.invalidTopics())
                .extracting(CatalogAuditReport.InvalidTopicUsage::topic)
                .containsExactly("zeta", "alpha");
    }

    @Test
    void feedsWithoutTopicsAreClean() {
        CatalogAuditReport report = auditor.audit(List.of(
                new CatalogEntry("Empty", "https://e.example", "rss", null, "health", null, null)));

        assertThat(report.isClean()).isTrue();
        assertThat(report.uniqueInvalidTopics()).isZero();
    }

    private CatalogEntry entry(String name, String... topics) {
        return new CatalogEntry(name, "https://" + name.toLowerCase() + ".example", "rss", null, "health", null, List.of(topics));
    }
}
