package com.jimin.digest.dto;

import java.util.Map;

/**
 * 현재 사용자 등급 + 스코프별 사용 가능 여부
 *
 * 예: {"userId":"u1","tier":"premium","testAccount":false,
 *      "scopes":{"current_digest":true,"all_digests":true,"saved_items":true,"folder":false}}
 */
public record TierInfoResponse(
        String userId,
        String tier,
        boolean testAccount,
        Map<String, Boolean> scopes
) {
}
