package com.jimin.digest.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * 명시 서브점수 교체 요청 (0.0 ~ 1.0)
 */
public record SubscoreUpdateRequest(

        @NotNull(message = "subscores는 필수입니다")
        Map<String,
                @NotNull
                @DecimalMin(value = "0.0", message = "서브점수는 0 이상입니다")
                @DecimalMax(value = "1.0", message = "서브점수는 1 이하입니다")
                Double> subscores
) {
}
