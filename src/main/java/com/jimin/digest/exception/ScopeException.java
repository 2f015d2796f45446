package com.jimin.digest.exception;

/**
 * 스코프 해석 실패 공통 상위 타입
 * ScopeResolver는 QuerySpec을 돌려주거나 이 계열 예외만 던진다.
 */
public abstract class ScopeException extends RuntimeException {

    protected ScopeException(String message) {
        super(message);
    }
}
