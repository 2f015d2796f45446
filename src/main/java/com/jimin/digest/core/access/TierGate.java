package com.jimin.digest.core.access;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * TierGate - 등급 기반 기능 접근 판정 (단일 진입점)
 *
 * 규칙: rank(requiredTier) <= rank(userTier) 이면 사용 가능
 *
 * 스코프 해석, 폴더 접근, 기능 노출 여부는 모두 isAvailable()로만 판정한다.
 * 등급 비교를 다른 곳에서 직접 하지 않는다.
 *
 * 순서표는 생성 시 주입되고 이후 변경되지 않는다 (스레드 안전).
 */
public final class TierGate {

    private final Map<Tier, Integer> ranks;

    public TierGate(Map<Tier, Integer> ranks) {
        EnumMap<Tier, Integer> copy = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            Integer rank = ranks.get(tier);
            if (rank == null) {
                throw new IllegalArgumentException("등급 순서표에 " + tier.value() + " 가 없습니다");
            }
            copy.put(tier, rank);
        }
        this.ranks = Collections.unmodifiableMap(copy);
    }

    /**
     * 기본 순서표 (free=1, premium=2, pro=3)
     */
    public static TierGate standard() {
        EnumMap<Tier, Integer> ranks = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            ranks.put(tier, tier.rank());
        }
        return new TierGate(ranks);
    }

    public boolean isAvailable(Tier requiredTier, Tier userTier) {
        return rank(requiredTier) <= rank(userTier);
    }

    public int rank(Tier tier) {
        return ranks.get(tier);
    }
}
