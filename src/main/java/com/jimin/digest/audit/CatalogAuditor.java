package com.jimin.digest.audit;

import com.jimin.digest.core.taxonomy.TaxonomyValidator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 카탈로그 전체 토픽 일괄 검증
 *
 * 첫 오류에서 멈추지 않고 모든 피드의 모든 토픽을 검사한다.
 * 결과는 사용 피드 수 내림차순 (같으면 처음 발견된 순서)
 */
public class CatalogAuditor {

    private final TaxonomyValidator validator;

    public CatalogAuditor(TaxonomyValidator validator) {
        this.validator = validator;
    }

    public CatalogAuditReport audit(List<CatalogEntry> feeds) {
        Map<String, List<String>> usage = new LinkedHashMap<>();
        int totalInvalid = 0;

        for (CatalogEntry feed : feeds) {
            for (String topic : feed.topics()) {
                if (!validator.isValid(topic)) {
                    usage.computeIfAbsent(topic, t -> new ArrayList<>()).add(feed.name());
                    totalInvalid++;
                }
            }
        }

        List<CatalogAuditReport.InvalidTopicUsage> invalid = new ArrayList<>();
        usage.forEach((topic, names) -> invalid.add(new CatalogAuditReport.InvalidTopicUsage(topic, List.copyOf(names))));
        invalid.sort(Comparator.comparingInt(CatalogAuditReport.InvalidTopicUsage::feedCount).reversed());

        return new CatalogAuditReport(
                validator.getTaxonomy().version(),
                feeds.size(),
                validator.getTaxonomy().size(),
                totalInvalid,
                invalid);
    }
}
