package com.jimin.digest.exception;

import com.jimin.digest.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * GlobalExceptionHandler - 전역 예외 처리
 *
 * 상태 코드:
 *  400 스코프 필드 누락, 입력 검증 실패
 *  403 등급 부족 (requiredTier + upgradeRequired), 폴더 소유자 아님
 *  404 폴더/다이제스트/아이템/피드 없음
 *  409 archived 아이템 수정
 *  422 어휘에 없는 토픽 (잘못된 토픽 전체 목록)
 *  500 그 외
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingScopeFieldException.class)
    public ResponseEntity<ErrorResponse> handleMissingScopeField(MissingScopeFieldException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex.getScopeType() != null) {
            details.put("scope", ex.getScopeType().value());
        }
        details.put("field", ex.getField());
        return build(HttpStatus.BAD_REQUEST, "MISSING_SCOPE_FIELD", ex.getMessage(), request, details);
    }

    /**
     * 등급 부족 → 업그레이드 안내에 필요한 요구 등급 포함
     */
    @ExceptionHandler(TierInsufficientException.class)
    public ResponseEntity<ErrorResponse> handleTierInsufficient(TierInsufficientException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requiredTier", ex.getRequiredTier().value());
        details.put("currentTier", ex.getUserTier().value());
        details.put("upgradeRequired", true);
        return build(HttpStatus.FORBIDDEN, "TIER_INSUFFICIENT", ex.getMessage(), request, details);
    }

    @ExceptionHandler(FolderNotOwnedException.class)
    public ResponseEntity<ErrorResponse> handleFolderNotOwned(FolderNotOwnedException ex, HttpServletRequest request) {
        return build(HttpStatus.FORBIDDEN, "FOLDER_NOT_OWNED", ex.getMessage(), request,
                Map.of("folderId", ex.getFolderId()));
    }

    @ExceptionHandler({FolderNotFoundException.class, DigestNotFoundException.class,
            ItemNotFoundException.class, FeedNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex, HttpServletRequest request) {
        String code;
        if (ex instanceof FolderNotFoundException) {
            code = "FOLDER_NOT_FOUND";
        } else if (ex instanceof DigestNotFoundException) {
            code = "DIGEST_NOT_FOUND";
        } else if (ex instanceof ItemNotFoundException) {
            code = "ITEM_NOT_FOUND";
        } else {
            code = "FEED_NOT_FOUND";
        }
        return build(HttpStatus.NOT_FOUND, code, ex.getMessage(), request, null);
    }

    /**
     * 잘못된 토픽 전체 목록 + 각 횟수 (첫 번째에서 멈추지 않음)
     */
    @ExceptionHandler(InvalidTopicException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTopic(InvalidTopicException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("taxonomyVersion", ex.getTaxonomyVersion());
        details.put("invalidTopics", ex.getInvalidTopics());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_TOPIC", ex.getMessage(), request, details);
    }

    @ExceptionHandler(ArchivedItemException.class)
    public ResponseEntity<ErrorResponse> handleArchived(ArchivedItemException ex, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, "ITEM_ARCHIVED", ex.getMessage(), request, null);
    }

    /**
     * Validation 에러 처리
     * @Valid 검증 실패 시 (예: @NotBlank, @Size)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationError(MethodArgumentNotValidException ex, HttpServletRequest request) {
        // 모든 필드 에러를 하나의 메시지로 합침
        String validationErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "입력값 검증 실패: " + validationErrors, request, null);
    }

    @ExceptionHandler({InvalidEngagementException.class, IllegalArgumentException.class,
            ConstraintViolationException.class, MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), request, null);
    }

    /**
     * 그 외 모든 예외 처리 (Fallback)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralError(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error: {} {}", request.getMethod(), request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "서버 내부 오류가 발생했습니다: " + ex.getMessage(), request, null);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
                                                HttpServletRequest request, Map<String, Object> details) {
        ErrorResponse error = new ErrorResponse(
                LocalDateTime.now().toString(),
                status.value(),
                status.getReasonPhrase(),
                code,
                message,
                request.getRequestURI(),
                details
        );
        return ResponseEntity.status(status).body(error);
    }
}
