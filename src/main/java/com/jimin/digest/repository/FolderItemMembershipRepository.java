package com.jimin.digest.repository;

import com.jimin.digest.entity.FolderItemMembership;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * 멤버십 조회는 "아이템 기준"과 "폴더 기준" 두 방향 모두 인덱스를 탄다
 */
public interface FolderItemMembershipRepository extends JpaRepository<FolderItemMembership, Long> {

    boolean existsByFolderIdAndItemId(Long folderId, String itemId);

    List<FolderItemMembership> findByItemId(String itemId);

    List<FolderItemMembership> findByFolderId(Long folderId);

    long countByFolderIdAndItemId(Long folderId, String itemId);

    /**
     * 단일 DELETE 문 (조회 후 삭제로 나누지 않음)
     *
     * @return 삭제된 행 수 (없던 멤버십이면 0)
     */
    @Modifying
    @Query("DELETE FROM FolderItemMembership m WHERE m.folderId = :folderId AND m.itemId = :itemId")
    int deleteMembership(@Param("folderId") Long folderId, @Param("itemId") String itemId);

    @Modifying
    @Query("DELETE FROM FolderItemMembership m WHERE m.folderId = :folderId")
    int deleteByFolder(@Param("folderId") Long folderId);
}
