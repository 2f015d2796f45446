package com.jimin.digest.exception;

import com.jimin.digest.core.access.ScopeType;

/**
 * 스코프 형태 오류 - 해당 스코프 종류에 필요한 필드가 없음
 * 예: current_digest 인데 digestId 없음 → 400
 */
public class MissingScopeFieldException extends ScopeException {

    private final ScopeType scopeType;
    private final String field;

    public MissingScopeFieldException(ScopeType scopeType, String field) {
        super(scopeType == null
                ? "스코프 종류(type)는 필수입니다"
                : scopeType.value() + " 스코프에는 " + field + " 가 필요합니다");
        this.scopeType = scopeType;
        this.field = field;
    }

    public ScopeType getScopeType() {
        return scopeType;
    }

    public String getField() {
        return field;
    }
}
