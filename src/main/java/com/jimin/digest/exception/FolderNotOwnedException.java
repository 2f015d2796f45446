package com.jimin.digest.exception;

/**
 * 폴더는 존재하지만 요청 사용자의 소유가 아님
 */
public class FolderNotOwnedException extends ScopeException {

    private final Long folderId;

    public FolderNotOwnedException(Long folderId) {
        super("접근할 수 없는 폴더입니다. ID: " + folderId);
        this.folderId = folderId;
    }

    public Long getFolderId() {
        return folderId;
    }
}
