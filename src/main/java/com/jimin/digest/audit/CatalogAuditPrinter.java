package com.jimin.digest.audit;

import java.io.PrintStream;
import java.util.List;

/**
 * 감사 결과를 사람이 읽는 텍스트로 출력
 *
 * 성공: out, 실패: err
 * 토픽별 피드 이름은 최대 3개, 나머지는 "... and N more"
 */
public class CatalogAuditPrinter {

    static final int MAX_EXAMPLES = 3;

    public void print(CatalogAuditReport report, PrintStream out, PrintStream err) {
        if (report.isClean()) {
            out.println("All topics are valid!");
            out.printf("   Validated %d feeds with no issues.%n", report.feedCount());
            out.printf("   Taxonomy %s defines %d valid topics.%n", report.taxonomyVersion(), report.vocabularySize());
            return;
        }

        err.println("VALIDATION FAILED: Found invalid topics");
        err.println();
        err.printf("   Total invalid topic assignments: %d%n", report.totalInvalidAssignments());
        err.printf("   Unique invalid topics: %d%n", report.uniqueInvalidTopics());
        err.println();

        for (CatalogAuditReport.InvalidTopicUsage usage : report.invalidTopics()) {
            int count = usage.feedCount();
            err.printf("   \"%s\" (used in %d feed%s)%n", usage.topic(), count, count > 1 ? "s" : "");
            List<String> names = usage.feedNames();
            names.stream().limit(MAX_EXAMPLES).forEach(name -> err.println("      - " + name));
            if (count > MAX_EXAMPLES) {
                err.printf("      ... and %d more%n", count - MAX_EXAMPLES);
            }
        }

        err.println();
        err.printf("   Valid topics (%d) are defined in taxonomy %s%n", report.vocabularySize(), report.taxonomyVersion());
    }
}
