package com.jimin.digest.core.taxonomy;

import com.jimin.digest.entity.Methodology;
import com.jimin.digest.entity.SourceType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MethodologyClassifierTest {

    private final MethodologyClassifier classifier = new MethodologyClassifier();

    @Test
    void declaredPublicationTypeWins() {
        ClassificationSignals signals = new ClassificationSignals(SourceType.JOURNAL,
                List.of("Journal Article", "Randomized Controlled Trial"), false, "a cohort of patients");

        assertThat(classifier.classify(signals)).isEqualTo(Methodology.RCT);
    }

    @Test
    void metaAnalysisOutranksOtherDeclaredTypes() {
        ClassificationSignals signals = new ClassificationSignals(SourceType.JOURNAL,
                List.of("Review", "Meta-Analysis"), false, null);

        assertThat(classifier.classify(signals)).isEqualTo(Methodology.META);
    }

    @Test
    void preprintFlagBeforeKeywords() {
        ClassificationSignals signals = new ClassificationSignals(SourceType.JOURNAL, List.of(), true,
                "randomized trial of fasting");

        assertThat(classifier.classify(signals)).isEqualTo(Methodology.PREPRINT);
    }

    @Test
    void communityAndVideoSourcesAreNotClassifiedByKeywords() {
        assertThat(classifier.classify(new ClassificationSignals(SourceType.REDDIT, null, false,
                "I read a randomized trial"))).isEqualTo(Methodology.NA);
        assertThat(classifier.classify(new ClassificationSignals(SourceType.YOUTUBE, null, false,
                "meta-analysis explained"))).isEqualTo(Methodology.NA);
    }

    @Test
    void excerptKeywordsForJournals() {
        assertThat(classify("A prospective cohort of 10,000 adults")).isEqualTo(Methodology.COHORT);
        assertThat(classify("We report a case study of SIBO")).isEqualTo(Methodology.CASE);
        assertThat(classify("A narrative review of ketosis")).isEqualTo(Methodology.REVIEW);
        assertThat(classify("We performed a meta-analysis")).isEqualTo(Methodology.META);
    }

    @Test
    void neverThrows() {
        assertThat(classifier.classify(null)).isEqualTo(Methodology.NA);
        assertThat(classifier.classify(new ClassificationSignals(null, null, false, null))).isEqualTo(Methodology.NA);
        assertThat(classify("")).isEqualTo(Methodology.NA);
    }

    private Methodology classify(String excerpt) {
        return classifier.classify(new ClassificationSignals(SourceType.JOURNAL, List.of(), false, excerpt));
    }
}
