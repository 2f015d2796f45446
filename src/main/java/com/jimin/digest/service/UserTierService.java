package com.jimin.digest.service;

import com.jimin.digest.core.access.ScopeType;
import com.jimin.digest.core.access.Tier;
import com.jimin.digest.core.access.TierGate;
import com.jimin.digest.dto.TierInfoResponse;
import com.jimin.digest.entity.UserSubscription;
import com.jimin.digest.exception.TierInsufficientException;
import com.jimin.digest.repository.UserSubscriptionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 사용자 등급 조회
 *
 * - 구독 레코드 없음 / 익명 → free
 * - 테스트 계정 → 등급과 관계없이 pro
 * 등급 비교는 항상 TierGate 한 곳에서 한다.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserTierService {

    private final UserSubscriptionRepository subscriptionRepository;
    private final TierGate tierGate;

    public Tier tierOf(String userId) {
        return subscription(userId)
                .map(sub -> sub.isTestAccount() ? Tier.PRO : sub.getTier())
                .orElse(Tier.FREE);
    }

    /**
     * @throws TierInsufficientException 사용자 등급이 required 미만
     */
    public Tier requireTier(String feature, Tier required, String userId) {
        Tier userTier = tierOf(userId);
        if (!tierGate.isAvailable(required, userTier)) {
            throw new TierInsufficientException(feature, required, userTier);
        }
        return userTier;
    }

    public TierInfoResponse describe(String userId) {
        Optional<UserSubscription> subscription = subscription(userId);
        Tier tier = tierOf(userId);

        Map<String, Boolean> scopes = new LinkedHashMap<>();
        for (ScopeType type : ScopeType.values()) {
            scopes.put(type.value(), tierGate.isAvailable(type.requiredTier(), tier));
        }
        return new TierInfoResponse(userId, tier.value(),
                subscription.map(UserSubscription::isTestAccount).orElse(false), scopes);
    }

    private Optional<UserSubscription> subscription(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        return subscriptionRepository.findById(userId);
    }
}
