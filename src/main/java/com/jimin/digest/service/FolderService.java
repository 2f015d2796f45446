package com.jimin.digest.service;

import com.jimin.digest.core.access.SearchScope;
import com.jimin.digest.core.access.Tier;
import com.jimin.digest.core.ranking.SortOption;
import com.jimin.digest.dto.FolderRequest;
import com.jimin.digest.dto.FolderResponse;
import com.jimin.digest.dto.ItemResponse;
import com.jimin.digest.entity.Folder;
import com.jimin.digest.exception.FolderNotFoundException;
import com.jimin.digest.exception.FolderNotOwnedException;
import com.jimin.digest.repository.FolderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 폴더 CRUD Service
 *
 * - 생성: pro 전용
 * - 수정/삭제: 소유자만 (삭제는 등급 무관, 멤버십까지 제거)
 * - 폴더 아이템 조회: folder 스코프와 같은 검증 (pro + 소유)
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class FolderService {

    private final FolderRepository folderRepository;
    private final FolderMembershipService membershipService;
    private final UserTierService userTierService;
    private final ItemQueryService itemQueryService;

    public List<FolderResponse> listFolders(String userId) {
        return folderRepository.findByUserIdOrderByCreatedAtAsc(userId).stream()
                .map(FolderResponse::from)
                .toList();
    }

    @Transactional
    public FolderResponse createFolder(String userId, FolderRequest request) {
        userTierService.requireTier("폴더", Tier.PRO, userId);
        if (request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("폴더 이름은 필수입니다");
        }

        Folder folder = new Folder();
        folder.setUserId(userId);
        folder.setName(request.name().trim());
        folder.setDescription(request.description());
        if (request.color() != null) {
            folder.setColor(request.color());
        }

        Folder saved = folderRepository.save(folder);
        log.info("폴더 생성: user={}, folder={}", userId, saved.getId());
        return FolderResponse.from(saved);
    }

    /**
     * null 필드는 기존 값 유지
     */
    @Transactional
    public FolderResponse updateFolder(String userId, Long folderId, FolderRequest request) {
        Folder folder = ownedFolder(userId, folderId);

        if (request.name() != null) {
            if (request.name().isBlank()) {
                throw new IllegalArgumentException("폴더 이름은 비워둘 수 없습니다");
            }
            folder.setName(request.name().trim());
        }
        if (request.description() != null) {
            folder.setDescription(request.description());
        }
        if (request.color() != null) {
            folder.setColor(request.color());
        }
        return FolderResponse.from(folderRepository.saveAndFlush(folder));
    }

    @Transactional
    public void deleteFolder(String userId, Long folderId) {
        Folder folder = ownedFolder(userId, folderId);
        membershipService.removeAllFor(folder.getId());
        folderRepository.delete(folder);
        log.info("폴더 삭제: user={}, folder={}", userId, folderId);
    }

    public List<ItemResponse> folderItems(String userId, Long folderId, SortOption sort) {
        return itemQueryService.search(SearchScope.folder(folderId), sort, userId);
    }

    private Folder ownedFolder(String userId, Long folderId) {
        Folder folder = folderRepository.findById(folderId)
                .orElseThrow(() -> new FolderNotFoundException(folderId));
        if (!folder.isOwnedBy(userId)) {
            throw new FolderNotOwnedException(folderId);
        }
        return folder;
    }
}
