package com.jimin.digest.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 콘텐츠 출처 종류
 */
public enum SourceType {

    JOURNAL("journal"),
    REDDIT("reddit"),
    SUBSTACK("substack"),
    YOUTUBE("youtube"),
    PODCAST("podcast");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * 커뮤니티/영상 출처 여부 (방법론 분류 불가 출처)
     */
    public boolean isCommunityOrVideo() {
        return this == REDDIT || this == YOUTUBE;
    }

    @JsonCreator
    public static SourceType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 출처 종류: " + value));
    }
}
