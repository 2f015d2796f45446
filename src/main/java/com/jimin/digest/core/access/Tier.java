package com.jimin.digest.core.access;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 구독 등급 (free < premium < pro)
 *
 * rank: 기본 순서값. 실제 비교는 항상 TierGate를 통해서만 한다.
 */
public enum Tier {

    FREE("free", 1),
    PREMIUM("premium", 2),
    PRO("pro", 3);

    private final String value;
    private final int rank;

    Tier(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int rank() {
        return rank;
    }

    /**
     * "free" / "PREMIUM" 등 대소문자 무관 변환
     *
     * @throws IllegalArgumentException 알 수 없는 등급
     */
    @JsonCreator
    public static Tier fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 구독 등급: " + value));
    }
}
