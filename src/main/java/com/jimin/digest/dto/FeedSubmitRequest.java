package com.jimin.digest.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * 피드 제출 요청 DTO
 *
 * 제출된 피드는 승인 전까지 카탈로그에 노출되지 않는다.
 * topics는 저장 전에 Taxonomy 검증 (하나라도 틀리면 422)
 */
public record FeedSubmitRequest(

        @NotBlank(message = "피드 이름은 필수입니다")
        @Size(max = 200, message = "피드 이름은 최대 200자입니다")
        String name,

        @NotBlank(message = "피드 URL은 필수입니다")
        @Size(max = 500, message = "피드 URL은 최대 500자입니다")
        String url,

        @NotBlank(message = "sourceType은 필수입니다")
        String sourceType,

        @Size(max = 50)
        String domain,

        @NotBlank(message = "category는 필수입니다")
        @Size(max = 100)
        String category,

        String description,

        @NotNull(message = "topics는 필수입니다")
        List<String> topics
) {
}
