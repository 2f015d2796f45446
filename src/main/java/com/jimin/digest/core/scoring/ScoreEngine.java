package com.jimin.digest.core.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * ScoreEngine - 가중 서브점수 합으로 품질 점수 계산
 *
 * totalScore = Σ weight(name) * subscore(name)
 *
 * 규칙:
 *  - 가중치는 배포 단위로 고정, 합계 1.0
 *  - 없는 서브점수는 0 (예외 없음)
 *  - 가중치에 없는 서브점수는 breakdown에는 남지만 합계에는 기여하지 않음
 *  - 같은 입력이면 항상 같은 출력 (이름순 합산 + 소수점 6자리 반올림)
 */
public class ScoreEngine {

    static final double WEIGHT_TOLERANCE = 1e-6;
    private static final int SCALE = 6;

    private final SortedMap<String, Double> weights;

    public ScoreEngine(Map<String, Double> weights) {
        if (weights == null || weights.isEmpty()) {
            throw new IllegalArgumentException("서브점수 가중치가 비어 있습니다");
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            Double w = entry.getValue();
            if (w == null || !Double.isFinite(w) || w < 0) {
                throw new IllegalArgumentException("잘못된 가중치: " + entry.getKey() + "=" + w);
            }
            sum += w;
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("서브점수 가중치 합계는 1.0 이어야 합니다 (현재: " + sum + ")");
        }
        this.weights = Collections.unmodifiableSortedMap(new TreeMap<>(weights));
    }

    public ScoreBreakdown computeScore(Map<String, Double> subscores) {
        SortedMap<String, Double> normalized = new TreeMap<>();
        if (subscores != null) {
            subscores.forEach((name, value) -> normalized.put(name, sanitize(value)));
        }
        for (String name : weights.keySet()) {
            normalized.putIfAbsent(name, 0.0);
        }

        double total = 0.0;
        for (Map.Entry<String, Double> weight : weights.entrySet()) {
            total += weight.getValue() * normalized.get(weight.getKey());
        }
        return new ScoreBreakdown(normalized, round(total));
    }

    public SortedMap<String, Double> getWeights() {
        return weights;
    }

    private double sanitize(Double value) {
        if (value == null || !Double.isFinite(value)) {
            return 0.0;
        }
        return value;
    }

    private double round(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
