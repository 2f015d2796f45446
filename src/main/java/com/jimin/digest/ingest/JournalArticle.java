package com.jimin.digest.ingest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 학술지 논문 (CrossRef, PubMed, Semantic Scholar 등)
 *
 * @param publicationTypes 상류 선언 출판 유형 → 방법론 분류 1순위 신호
 * @param subscores        상류 분석기가 계산한 서브점수 (선택)
 */
public record JournalArticle(String title,
                             String url,
                             String doi,
                             String journalName,
                             List<String> authors,
                             LocalDateTime publishedAt,
                             String abstractText,
                             List<String> publicationTypes,
                             boolean preprint,
                             List<String> topics,
                             Map<String, Double> subscores) implements RawItem {
}
