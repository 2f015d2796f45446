package com.jimin.digest.exception;

public class DigestNotFoundException extends ScopeException {

    public DigestNotFoundException(String reference) {
        super("다이제스트를 찾을 수 없습니다: " + reference);
    }
}
