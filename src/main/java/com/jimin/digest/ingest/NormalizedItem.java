package com.jimin.digest.ingest;

import com.jimin.digest.core.taxonomy.ClassificationSignals;
import com.jimin.digest.entity.Engagement;
import com.jimin.digest.entity.SourceType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 정규화된 아이템 (코어 로직의 입력 형태)
 *
 * @param declaredTopics 원본이 선언한 토픽 (아직 검증 전)
 */
public record NormalizedItem(SourceType sourceType,
                             String title,
                             String url,
                             String doi,
                             String journalName,
                             String authorOrChannel,
                             LocalDateTime publishedAt,
                             String excerpt,
                             List<String> declaredTopics,
                             List<String> publicationTypes,
                             boolean preprint,
                             Engagement engagement,
                             Map<String, Double> subscores) {

    public ClassificationSignals classificationSignals() {
        return new ClassificationSignals(sourceType, publicationTypes, preprint, excerpt);
    }

    /**
     * 토픽 자동 감지 대상 텍스트
     */
    public String taggingText() {
        return excerpt == null ? title : title + "\n" + excerpt;
    }
}
