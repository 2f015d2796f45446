package com.jimin.digest.repository;

import com.jimin.digest.entity.Folder;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface FolderRepository extends JpaRepository<Folder, Long> {

    List<Folder> findByUserIdOrderByCreatedAtAsc(String userId);

    List<Folder> findByIdIn(Collection<Long> ids);
}
