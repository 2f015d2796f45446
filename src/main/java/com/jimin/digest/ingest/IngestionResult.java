package com.jimin.digest.ingest;

import com.jimin.digest.dto.ItemResponse;

import java.util.Map;

/**
 * 수집 결과: ACCEPTED(저장된 아이템) 또는 REJECTED(사유)
 *
 * @param invalidTopics INVALID_TOPICS 거부 시 잘못된 토픽 → 횟수
 */
public record IngestionResult(Status status,
                              ItemResponse item,
                              RejectionReason reason,
                              String message,
                              Map<String, Integer> invalidTopics) {

    public enum Status { ACCEPTED, REJECTED }

    public enum RejectionReason { FEED_NOT_APPROVED, INVALID_ITEM, DUPLICATE, INVALID_TOPICS }

    public static IngestionResult accepted(ItemResponse item) {
        return new IngestionResult(Status.ACCEPTED, item, null, null, Map.of());
    }

    public static IngestionResult rejected(RejectionReason reason, String message) {
        return new IngestionResult(Status.REJECTED, null, reason, message, Map.of());
    }

    public static IngestionResult invalidTopics(String message, Map<String, Integer> invalidTopics) {
        return new IngestionResult(Status.REJECTED, null, RejectionReason.INVALID_TOPICS, message, Map.copyOf(invalidTopics));
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }
}
