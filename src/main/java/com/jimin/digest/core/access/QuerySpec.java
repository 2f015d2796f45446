package com.jimin.digest.core.access;

/**
 * 권한 검증이 끝난 조회 대상
 *
 * ScopeResolver만 생성한다. 존재하면 이미 완전히 인가된 스코프라는 뜻.
 *
 * @param type     해석된 스코프 종류
 * @param userId   요청 사용자 (saved_items 필터 기준)
 * @param digestId current_digest 대상 다이제스트
 * @param folderId folder 대상 폴더 (userId 소유 확인 완료)
 */
public record QuerySpec(ScopeType type, String userId, Long digestId, Long folderId) {
}
