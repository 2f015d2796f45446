package com.jimin.digest.core.taxonomy;

import com.jimin.digest.entity.Methodology;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * MethodologyClassifier - 아이템당 근거 유형 하나를 결정
 *
 * 전함수: 어떤 입력에도 예외 없이 값을 돌려준다 (판단 불가 → NA).
 * 수집 파이프라인이 애매한 입력 때문에 멈추지 않아야 한다.
 *
 * 우선순위:
 *  1. 선언된 출판 유형 (meta-analysis > RCT > cohort > case > review)
 *  2. preprint 플래그
 *  3. 커뮤니티/영상 출처 → NA
 *  4. 발췌 키워드
 */
public class MethodologyClassifier {

    private static final Pattern RCT = Pattern.compile("randomi[sz]ed|\\brct\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern COHORT = Pattern.compile("cohort", Pattern.CASE_INSENSITIVE);
    private static final Pattern META = Pattern.compile("meta-analys[ie]s|meta analys[ie]s", Pattern.CASE_INSENSITIVE);
    private static final Pattern CASE = Pattern.compile("case study|case report|case series", Pattern.CASE_INSENSITIVE);
    private static final Pattern REVIEW = Pattern.compile("review", Pattern.CASE_INSENSITIVE);

    public Methodology classify(ClassificationSignals signals) {
        if (signals == null) {
            return Methodology.NA;
        }

        Methodology declared = fromPublicationTypes(signals);
        if (declared != null) {
            return declared;
        }

        if (signals.preprint()) {
            return Methodology.PREPRINT;
        }
        if (signals.sourceType() == null || signals.sourceType().isCommunityOrVideo()) {
            return Methodology.NA;
        }

        String excerpt = signals.excerpt();
        if (RCT.matcher(excerpt).find()) return Methodology.RCT;
        if (COHORT.matcher(excerpt).find()) return Methodology.COHORT;
        if (META.matcher(excerpt).find()) return Methodology.META;
        if (CASE.matcher(excerpt).find()) return Methodology.CASE;
        if (REVIEW.matcher(excerpt).find()) return Methodology.REVIEW;

        return Methodology.NA;
    }

    private Methodology fromPublicationTypes(ClassificationSignals signals) {
        Methodology best = null;
        for (String raw : signals.publicationTypes()) {
            if (raw == null) {
                continue;
            }
            String type = raw.toLowerCase(Locale.ROOT);
            Methodology candidate;
            if (META.matcher(type).find() || type.contains("systematic review")) {
                candidate = Methodology.META;
            } else if (RCT.matcher(type).find() || type.contains("controlled trial")) {
                candidate = Methodology.RCT;
            } else if (COHORT.matcher(type).find() || type.contains("observational")) {
                candidate = Methodology.COHORT;
            } else if (CASE.matcher(type).find() || type.contains("case reports")) {
                candidate = Methodology.CASE;
            } else if (REVIEW.matcher(type).find()) {
                candidate = Methodology.REVIEW;
            } else if (type.contains("preprint")) {
                candidate = Methodology.PREPRINT;
            } else {
                continue;
            }
            if (best == null || priority(candidate) < priority(best)) {
                best = candidate;
            }
        }
        return best;
    }

    private int priority(Methodology methodology) {
        return switch (methodology) {
            case META -> 0;
            case RCT -> 1;
            case COHORT -> 2;
            case CASE -> 3;
            case REVIEW -> 4;
            case PREPRINT -> 5;
            case NA -> 6;
        };
    }
}
