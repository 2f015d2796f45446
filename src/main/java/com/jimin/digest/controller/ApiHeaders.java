package com.jimin.digest.controller;

/**
 * 인증은 앞단(게이트웨이)에서 끝나고, 사용자 ID만 헤더로 전달된다.
 */
public final class ApiHeaders {

    public static final String USER_ID = "X-User-Id";

    private ApiHeaders() {
    }
}
