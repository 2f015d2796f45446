package com.jimin.digest.exception;

public class FolderNotFoundException extends ScopeException {

    private final Long folderId;

    public FolderNotFoundException(Long folderId) {
        super("폴더를 찾을 수 없습니다. ID: " + folderId);
        this.folderId = folderId;
    }

    public Long getFolderId() {
        return folderId;
    }
}
