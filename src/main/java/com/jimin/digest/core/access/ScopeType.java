package com.jimin.digest.core.access;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 검색 스코프 종류 + 최소 요구 등급
 */
public enum ScopeType {

    CURRENT_DIGEST("current_digest", Tier.FREE),
    ALL_DIGESTS("all_digests", Tier.PREMIUM),
    SAVED_ITEMS("saved_items", Tier.PREMIUM),
    FOLDER("folder", Tier.PRO);

    private final String value;
    private final Tier requiredTier;

    ScopeType(String value, Tier requiredTier) {
        this.value = value;
        this.requiredTier = requiredTier;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public Tier requiredTier() {
        return requiredTier;
    }

    @JsonCreator
    public static ScopeType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 스코프: " + value));
    }
}
