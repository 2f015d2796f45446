package com.jimin.digest.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * InvalidTopicException - 어휘(Taxonomy)에 없는 토픽이 포함되었을 때 발생
 *
 * 첫 번째 오류에서 멈추지 않고 모든 잘못된 토픽을 모아서 한 번에 보고한다.
 * invalidTopics: 잘못된 토픽 → 등장 횟수 (입력 순서 유지)
 *
 * 복구 가능한 예외: 호출자가 아이템을 거부할지, 토픽만 제거할지 결정한다.
 */
public class InvalidTopicException extends RuntimeException {

    private final String taxonomyVersion;
    private final Map<String, Integer> invalidTopics;

    public InvalidTopicException(String taxonomyVersion, Map<String, Integer> invalidTopics) {
        super("유효하지 않은 토픽 " + invalidTopics.size() + "개 (taxonomy " + taxonomyVersion + "): "
                + describe(invalidTopics));
        this.taxonomyVersion = taxonomyVersion;
        this.invalidTopics = Collections.unmodifiableMap(new LinkedHashMap<>(invalidTopics));
    }

    public String getTaxonomyVersion() {
        return taxonomyVersion;
    }

    public Map<String, Integer> getInvalidTopics() {
        return invalidTopics;
    }

    private static String describe(Map<String, Integer> invalidTopics) {
        return invalidTopics.entrySet().stream()
                .map(e -> "\"" + e.getKey() + "\" x" + e.getValue())
                .collect(Collectors.joining(", "));
    }
}
