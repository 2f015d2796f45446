package com.jimin.digest.audit;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * 카탈로그 JSON의 피드 한 건 (시드 파일과 감사 CLI 공용)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogEntry(
        String name,
        String url,
        String sourceType,
        String domain,
        String category,
        String description,
        List<String> topics
) {
    public CatalogEntry {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
