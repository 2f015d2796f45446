package com.jimin.digest.dto;

import jakarta.validation.constraints.PositiveOrZero;

/**
 * 참여 카운터 증가 요청 (append-only, 음수 거부)
 */
public record EngagementDeltaRequest(

        @PositiveOrZero(message = "upvotes 증가량은 0 이상이어야 합니다")
        long upvotes,

        @PositiveOrZero(message = "views 증가량은 0 이상이어야 합니다")
        long views,

        @PositiveOrZero(message = "comments 증가량은 0 이상이어야 합니다")
        long comments
) {
}
