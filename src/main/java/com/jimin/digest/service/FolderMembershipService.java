package com.jimin.digest.service;

import com.jimin.digest.config.CacheConfig;
import com.jimin.digest.core.access.Tier;
import com.jimin.digest.dto.FolderResponse;
import com.jimin.digest.entity.Folder;
import com.jimin.digest.entity.FolderItemMembership;
import com.jimin.digest.exception.FolderNotFoundException;
import com.jimin.digest.exception.FolderNotOwnedException;
import com.jimin.digest.exception.ItemNotFoundException;
import com.jimin.digest.repository.FolderItemMembershipRepository;
import com.jimin.digest.repository.FolderRepository;
import com.jimin.digest.repository.ItemRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * 아이템 ↔ 폴더 멤버십 Service
 *
 * - add: 멱등. (folder_id, item_id) 유니크 제약이 최종 판정
 *        → 동시 추가가 겹쳐도 행은 하나만 남는다.
 * - remove: 단일 DELETE 문. 없던 멤버십 삭제도 성공.
 * - list: 아이템 기준 조회 (Caffeine 캐시, 커밋 후 무효화)
 *
 * add / remove / list 모두 pro 등급 필요. 다운그레이드 후에는 폴더 삭제(FolderService)만 가능
 */
@Service
@Slf4j
public class FolderMembershipService {

    private final FolderItemMembershipRepository membershipRepository;
    private final FolderRepository folderRepository;
    private final ItemRepository itemRepository;
    private final UserTierService userTierService;
    private final Cache itemFoldersCache;

    public FolderMembershipService(FolderItemMembershipRepository membershipRepository,
                                   FolderRepository folderRepository,
                                   ItemRepository itemRepository,
                                   UserTierService userTierService,
                                   CacheManager cacheManager) {
        this.membershipRepository = membershipRepository;
        this.folderRepository = folderRepository;
        this.itemRepository = itemRepository;
        this.userTierService = userTierService;
        this.itemFoldersCache = cacheManager.getCache(CacheConfig.ITEM_FOLDERS);
    }

    /**
     * @return 새로 추가되었으면 true, 이미 있었으면 false
     */
    public boolean add(String userId, Long folderId, String itemId) {
        userTierService.requireTier("폴더 정리", Tier.PRO, userId);
        ownedFolder(userId, folderId);
        if (!itemRepository.existsById(itemId)) {
            throw new ItemNotFoundException(itemId);
        }

        if (membershipRepository.existsByFolderIdAndItemId(folderId, itemId)) {
            log.debug("이미 폴더에 있음: folder={}, item={}", folderId, itemId);
            return false;
        }
        try {
            membershipRepository.saveAndFlush(new FolderItemMembership(folderId, itemId));
        } catch (DataIntegrityViolationException e) {
            // 동시 요청이 먼저 추가함
            log.debug("동시 추가 감지: folder={}, item={}", folderId, itemId);
            return false;
        }

        evict(List.of(itemId));
        return true;
    }

    /**
     * @return 삭제되었으면 true, 원래 없었으면 false
     */
    @Transactional
    public boolean remove(String userId, Long folderId, String itemId) {
        userTierService.requireTier("폴더 정리", Tier.PRO, userId);
        ownedFolder(userId, folderId);

        int deleted = membershipRepository.deleteMembership(folderId, itemId);
        if (deleted == 0) {
            log.debug("삭제할 멤버십 없음: folder={}, item={}", folderId, itemId);
            return false;
        }
        evictAfterCommit(List.of(itemId));
        return true;
    }

    /**
     * 아이템이 들어 있는 호출자 소유 폴더 목록 (폴더당 한 번)
     */
    @Transactional(readOnly = true)
    public List<FolderResponse> foldersOf(String userId, String itemId) {
        userTierService.requireTier("폴더 정리", Tier.PRO, userId);
        if (!itemRepository.existsById(itemId)) {
            throw new ItemNotFoundException(itemId);
        }
        return allFoldersOf(itemId).stream()
                .filter(folder -> folder.userId().equals(userId))
                .toList();
    }

    /**
     * 폴더 삭제 시 멤버십 일괄 제거 (호출자 트랜잭션 안에서)
     */
    @Transactional
    public void removeAllFor(Long folderId) {
        List<String> itemIds = membershipRepository.findByFolderId(folderId).stream()
                .map(FolderItemMembership::getItemId)
                .toList();
        int deleted = membershipRepository.deleteByFolder(folderId);
        log.debug("폴더 {} 멤버십 {} 건 제거", folderId, deleted);
        evictAfterCommit(itemIds);
    }

    private List<FolderResponse> allFoldersOf(String itemId) {
        List<FolderResponse> cached = itemFoldersCache.get(itemId, () -> loadFolders(itemId));
        return cached == null ? List.of() : cached;
    }

    private List<FolderResponse> loadFolders(String itemId) {
        List<Long> folderIds = membershipRepository.findByItemId(itemId).stream()
                .map(FolderItemMembership::getFolderId)
                .distinct()
                .toList();
        if (folderIds.isEmpty()) {
            return List.of();
        }
        return folderRepository.findByIdIn(folderIds).stream()
                .sorted(Comparator.comparing(Folder::getId))
                .map(FolderResponse::from)
                .toList();
    }

    private Folder ownedFolder(String userId, Long folderId) {
        Folder folder = folderRepository.findById(folderId)
                .orElseThrow(() -> new FolderNotFoundException(folderId));
        if (!folder.isOwnedBy(userId)) {
            throw new FolderNotOwnedException(folderId);
        }
        return folder;
    }

    private void evictAfterCommit(Collection<String> itemIds) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            evict(itemIds);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                evict(itemIds);
            }
        });
    }

    private void evict(Collection<String> itemIds) {
        itemIds.forEach(itemFoldersCache::evict);
    }
}
