package com.jimin.digest.core.taxonomy;

import com.jimin.digest.exception.InvalidTopicException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaxonomyValidatorTest {

    private final TaxonomyValidator validator =
            new TaxonomyValidator(new Taxonomy("test-1", Set.of("genomics", "keto", "longevity")));

    @Test
    void validTopicsPassThroughInOrder() {
        assertThat(validator.validate(List.of("keto", "genomics"))).containsExactly("keto", "genomics");
    }

    @Test
    void reportsEveryInvalidTopicWithCounts() {
        List<String> topics = List.of("keto", "bogus", "also-bogus", "bogus", "third");

        assertThatThrownBy(() -> validator.validate(topics))
                .isInstanceOfSatisfying(InvalidTopicException.class, e -> {
                    assertThat(e.getInvalidTopics()).hasSize(3);
                    assertThat(e.getInvalidTopics()).containsEntry("bogus", 2)
                            .containsEntry("also-bogus", 1)
                            .containsEntry("third", 1);
                    assertThat(e.getTaxonomyVersion()).isEqualTo("test-1");
                });
    }

    @Test
    void stripKeepsOnlyKnownTopics() {
        assertThat(validator.strip(List.of("bogus", "longevity", "keto"))).containsExactly("longevity", "keto");
    }

    @Test
    void emptyListIsValid() {
        assertThat(validator.validate(List.of())).isEmpty();
        assertThat(validator.findInvalid(List.of())).isEmpty();
    }

    @Test
    void matchingIsExact() {
        assertThat(validator.isValid("Keto")).isFalse();
        assertThat(validator.isValid(null)).isFalse();
    }

    @Test
    void missingTopicListIsTreatedAsEmpty() {
        assertThat(validator.validate(null)).isEmpty();
        assertThat(validator.findInvalid(null)).isEmpty();
        assertThat(validator.strip(null)).isEmpty();
    }
}
