package com.jimin.digest.core.taxonomy;

import com.jimin.digest.exception.InvalidTopicException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * TaxonomyValidator - 토픽 태그가 현재 어휘에 속하는지 검사
 *
 * 순수 검사: 부수효과 없음. 거부할지 제거할지는 호출자가 결정한다.
 * 잘못된 토픽은 첫 번째에서 멈추지 않고 전부 모아서 보고한다.
 */
public class TaxonomyValidator {

    private final Taxonomy taxonomy;

    public TaxonomyValidator(Taxonomy taxonomy) {
        this.taxonomy = taxonomy;
    }

    /**
     * null 입력은 빈 목록으로 본다.
     *
     * @return 입력 순서를 유지한 검증 완료 토픽 (불변)
     * @throws InvalidTopicException 어휘에 없는 토픽이 하나라도 있으면 (전체 목록 포함)
     */
    public List<String> validate(List<String> topics) {
        if (topics == null) {
            return List.of();
        }
        Map<String, Integer> invalid = findInvalid(topics);
        if (!invalid.isEmpty()) {
            throw new InvalidTopicException(taxonomy.version(), invalid);
        }
        return List.copyOf(topics);
    }

    /**
     * 잘못된 토픽 → 등장 횟수. 모두 유효하면 빈 맵.
     */
    public Map<String, Integer> findInvalid(Collection<String> topics) {
        Map<String, Integer> invalid = new LinkedHashMap<>();
        if (topics == null) {
            return invalid;
        }
        for (String topic : topics) {
            if (!taxonomy.contains(topic)) {
                invalid.merge(String.valueOf(topic), 1, Integer::sum);
            }
        }
        return invalid;
    }

    /**
     * 유효한 토픽만 남긴다 (STRIP 정책용)
     */
    public List<String> strip(List<String> topics) {
        if (topics == null) {
            return List.of();
        }
        return topics.stream()
                .filter(taxonomy::contains)
                .toList();
    }

    public boolean isValid(String topic) {
        return taxonomy.contains(topic);
    }

    public Taxonomy getTaxonomy() {
        return taxonomy;
    }
}
