package com.jimin.digest.exception;

/**
 * 참여 카운터는 증가만 가능 (음수 증분, long 범위 초과 거부)
 */
public class InvalidEngagementException extends RuntimeException {

    public InvalidEngagementException(String message) {
        super(message);
    }
}
