package com.jimin.digest.exception;

/**
 * 보관(archived) 아이템 수정 시도
 * 보관 아이템은 참여 카운터 외에는 변경 불가 → 409
 */
public class ArchivedItemException extends RuntimeException {

    public ArchivedItemException(String itemId) {
        super("보관된 아이템은 수정할 수 없습니다. ID: " + itemId);
    }
}
