package com.jimin.digest.core.access;

/**
 * 조회 시점 스코프 값 객체
 *
 * digestId: type == CURRENT_DIGEST 일 때 필수
 * folderId: type == FOLDER 일 때 필수
 * 형태 검증은 ScopeResolver가 담당 (여기서는 값만 보관)
 */
public record SearchScope(ScopeType type, Long digestId, Long folderId) {

    public static SearchScope currentDigest(Long digestId) {
        return new SearchScope(ScopeType.CURRENT_DIGEST, digestId, null);
    }

    public static SearchScope allDigests() {
        return new SearchScope(ScopeType.ALL_DIGESTS, null, null);
    }

    public static SearchScope savedItems() {
        return new SearchScope(ScopeType.SAVED_ITEMS, null, null);
    }

    public static SearchScope folder(Long folderId) {
        return new SearchScope(ScopeType.FOLDER, null, folderId);
    }
}
