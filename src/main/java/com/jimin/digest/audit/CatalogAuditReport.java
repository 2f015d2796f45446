package com.jimin.digest.audit;

import java.util.List;

/**
 * 카탈로그 토픽 감사 결과
 *
 * @param invalidTopics 잘못된 토픽별 사용 피드 목록 (피드 수 내림차순)
 */
public record CatalogAuditReport(
        String taxonomyVersion,
        int feedCount,
        int vocabularySize,
        int totalInvalidAssignments,
        List<InvalidTopicUsage> invalidTopics
) {

    public record InvalidTopicUsage(String topic, List<String> feedNames) {

        public int feedCount() {
            return feedNames.size();
        }
    }

    public CatalogAuditReport {
        invalidTopics = List.copyOf(invalidTopics);
    }

    public boolean isClean() {
        return invalidTopics.isEmpty();
    }

    public int uniqueInvalidTopics() {
        return invalidTopics.size();
    }
}
