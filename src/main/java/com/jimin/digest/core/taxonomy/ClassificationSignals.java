package com.jimin.digest.core.taxonomy;

import com.jimin.digest.entity.SourceType;

import java.util.List;

/**
 * 방법론 분류 입력 (정규화된 아이템 메타데이터)
 *
 * @param publicationTypes 상류에서 선언한 출판 유형 (예: PubMed "Randomized Controlled Trial")
 * @param excerpt          요약/본문 발췌 (키워드 폴백용)
 */
public record ClassificationSignals(SourceType sourceType,
                                    List<String> publicationTypes,
                                    boolean preprint,
                                    String excerpt) {

    public ClassificationSignals {
        publicationTypes = publicationTypes == null ? List.of() : List.copyOf(publicationTypes);
        excerpt = excerpt == null ? "" : excerpt;
    }
}
