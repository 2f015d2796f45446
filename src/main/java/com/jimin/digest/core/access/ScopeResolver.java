package com.jimin.digest.core.access;

import com.jimin.digest.entity.Folder;
import com.jimin.digest.exception.DigestNotFoundException;
import com.jimin.digest.exception.FolderNotFoundException;
import com.jimin.digest.exception.FolderNotOwnedException;
import com.jimin.digest.exception.MissingScopeFieldException;
import com.jimin.digest.exception.TierInsufficientException;
import com.jimin.digest.repository.DigestRepository;
import com.jimin.digest.repository.FolderRepository;

/**
 * ScopeResolver - 요청 스코프 + 사용자 등급 → 인가된 QuerySpec
 *
 * 순서:
 *  1. 형태 검증 (MissingScopeFieldException)
 *  2. 등급 검증 - TierGate 단일 호출 (TierInsufficientException)
 *  3. 대상 확인 - 다이제스트 존재, 폴더 존재/소유 (DigestNotFound / FolderNotFound / FolderNotOwned)
 *
 * 부분 성공 없음: QuerySpec을 돌려주거나 예외를 던진다.
 * 권한 없는 스코프를 더 좁은 스코프로 몰래 바꾸지 않는다.
 */
public class ScopeResolver {

    private final TierGate tierGate;
    private final FolderRepository folderRepository;
    private final DigestRepository digestRepository;

    public ScopeResolver(TierGate tierGate, FolderRepository folderRepository, DigestRepository digestRepository) {
        this.tierGate = tierGate;
        this.folderRepository = folderRepository;
        this.digestRepository = digestRepository;
    }

    public QuerySpec resolve(SearchScope scope, Tier userTier, String userId) {
        if (scope == null || scope.type() == null) {
            throw new MissingScopeFieldException(null, "type");
        }
        ScopeType type = scope.type();

        if (type == ScopeType.CURRENT_DIGEST && scope.digestId() == null) {
            throw new MissingScopeFieldException(type, "digestId");
        }
        if (type == ScopeType.FOLDER && scope.folderId() == null) {
            throw new MissingScopeFieldException(type, "folderId");
        }

        if (!tierGate.isAvailable(type.requiredTier(), userTier)) {
            throw new TierInsufficientException(type.value() + " 스코프", type.requiredTier(), userTier);
        }

        return switch (type) {
            case CURRENT_DIGEST -> {
                if (!digestRepository.existsById(scope.digestId())) {
                    throw new DigestNotFoundException("id=" + scope.digestId());
                }
                yield new QuerySpec(type, userId, scope.digestId(), null);
            }
            case ALL_DIGESTS, SAVED_ITEMS -> new QuerySpec(type, userId, null, null);
            case FOLDER -> {
                Folder folder = folderRepository.findById(scope.folderId())
                        .orElseThrow(() -> new FolderNotFoundException(scope.folderId()));
                if (!folder.isOwnedBy(userId)) {
                    throw new FolderNotOwnedException(folder.getId());
                }
                yield new QuerySpec(type, userId, null, folder.getId());
            }
        };
    }
}
