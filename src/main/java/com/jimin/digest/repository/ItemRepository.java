package com.jimin.digest.repository;

import com.jimin.digest.entity.Item;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ItemRepository extends JpaRepository<Item, String> {

    // Why: URL/DOI+제목 해시로 교차 출처 중복 체크
    boolean existsByHashDedupe(String hashDedupe);

    /**
     * 점수 재계산용 행 잠금 조회
     * 잠금은 DB가 보유 (트랜잭션 종료 시 해제)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Item i WHERE i.id = :id")
    Optional<Item> findForUpdate(@Param("id") String id);

    List<Item> findByIdIn(Collection<String> ids);

    // Why: 다이제스트 구성 (기간 내 발행 아이템)
    List<Item> findByPublishedAtBetween(LocalDateTime start, LocalDateTime end);

    @Query("SELECT i FROM Digest d JOIN d.items i WHERE d.id = :digestId")
    List<Item> findByDigestId(@Param("digestId") Long digestId);

    @Query("SELECT i FROM Item i WHERE i.id IN (SELECT di.id FROM Digest d JOIN d.items di)")
    List<Item> findAllInDigests();

    List<Item> findByArchivedFalse();

    @Query("SELECT i FROM Item i WHERE i.id IN (SELECT s.itemId FROM SavedItem s WHERE s.userId = :userId)")
    List<Item> findSavedByUser(@Param("userId") String userId);

    @Query("SELECT i FROM Item i WHERE i.id IN (SELECT m.itemId FROM FolderItemMembership m WHERE m.folderId = :folderId)")
    List<Item> findByFolderId(@Param("folderId") Long folderId);
}
