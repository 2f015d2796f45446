package com.jimin.digest.exception;

public class FeedNotFoundException extends RuntimeException {

    public FeedNotFoundException(Long feedId) {
        super("카탈로그 피드를 찾을 수 없습니다. ID: " + feedId);
    }
}
