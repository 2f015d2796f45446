package com.jimin.digest.core.taxonomy;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 버전이 있는 토픽 어휘 (불변)
 *
 * 프로세스 시작 시 한 번 로드되어 각 컴포넌트에 생성자로 주입된다.
 */
public record Taxonomy(String version, Set<String> topics) {

    public Taxonomy {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(topics, "topics");
        topics = Collections.unmodifiableSet(new LinkedHashSet<>(topics));
    }

    public boolean contains(String topic) {
        return topic != null && topics.contains(topic);
    }

    public int size() {
        return topics.size();
    }
}
