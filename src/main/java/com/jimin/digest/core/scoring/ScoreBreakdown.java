package com.jimin.digest.core.scoring;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 서브점수 + 파생 totalScore
 *
 * totalScore는 항상 ScoreEngine이 subscores로부터 계산한 값이다 (직접 수정 금지).
 * subscores는 이름순 정렬 → 같은 입력이면 같은 출력.
 */
public record ScoreBreakdown(SortedMap<String, Double> subscores, double totalScore) {

    public ScoreBreakdown {
        subscores = Collections.unmodifiableSortedMap(new TreeMap<>(subscores));
    }

    public double subscore(String name) {
        return subscores.getOrDefault(name, 0.0);
    }
}
