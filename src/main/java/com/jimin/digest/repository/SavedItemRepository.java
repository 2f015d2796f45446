package com.jimin.digest.repository;

import com.jimin.digest.entity.SavedItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SavedItemRepository extends JpaRepository<SavedItem, Long> {

    boolean existsByUserIdAndItemId(String userId, String itemId);

    List<SavedItem> findByUserIdOrderBySavedAtDesc(String userId);

    @Modifying
    @Query("DELETE FROM SavedItem s WHERE s.userId = :userId AND s.itemId = :itemId")
    int deleteSaved(@Param("userId") String userId, @Param("itemId") String itemId);
}
