package com.jimin.digest.exception;

import com.jimin.digest.core.access.Tier;

/**
 * 사용자 등급이 요구 등급보다 낮음 → 403 + 업그레이드 안내
 */
public class TierInsufficientException extends ScopeException {

    private final Tier requiredTier;
    private final Tier userTier;

    public TierInsufficientException(String feature, Tier requiredTier, Tier userTier) {
        super(feature + " 기능은 " + requiredTier.value() + " 등급 이상이 필요합니다 (현재: " + userTier.value() + ")");
        this.requiredTier = requiredTier;
        this.userTier = userTier;
    }

    public Tier getRequiredTier() {
        return requiredTier;
    }

    public Tier getUserTier() {
        return userTier;
    }
}
