package com.jimin.digest.core.ranking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 정렬 옵션 (API 값: quality-desc 등)
 */
public enum SortOption {

    QUALITY_DESC("quality-desc"),
    QUALITY_ASC("quality-asc"),
    RECENCY_DESC("recency-desc"),
    RECENCY_ASC("recency-asc"),
    ENGAGEMENT_DESC("engagement-desc"),
    TITLE_ASC("title-asc"),
    TITLE_DESC("title-desc");

    private final String value;

    SortOption(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static SortOption fromValue(String value) {
        return Arrays.stream(values())
                .filter(o -> o.value.equalsIgnoreCase(value) || o.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("지원하지 않는 정렬 옵션: " + value));
    }
}
