package com.jimin.digest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * ErrorResponse - 표준화된 에러 응답 DTO
 *
 * RFC 7807 (Problem Details for HTTP APIs) 스타일
 * code: 클라이언트 분기용 고정 문자열 (TIER_INSUFFICIENT, INVALID_TOPIC 등)
 * details: 예외별 부가 정보 (requiredTier, invalidTopics 등)
 *
 * 예시 응답:
 * {
 *   "timestamp": "2026-01-21T15:30:00",
 *   "status": 403,
 *   "error": "Forbidden",
 *   "code": "TIER_INSUFFICIENT",
 *   "message": "folder 스코프 기능은 pro 등급 이상이 필요합니다 (현재: premium)",
 *   "path": "/api/items",
 *   "details": { "requiredTier": "pro", "upgradeRequired": true }
 * }
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {

    /**
     * 에러 발생 시각 (ISO 8601)
     */
    private String timestamp;

    private int status;

    /**
     * HTTP 상태 이름 ("Not Found", "Forbidden" 등)
     */
    private String error;

    private String code;

    /**
     * 사용자에게 보여줄 에러 메시지
     */
    private String message;

    /**
     * 에러가 발생한 API 경로
     */
    private String path;

    private Map<String, Object> details;
}
