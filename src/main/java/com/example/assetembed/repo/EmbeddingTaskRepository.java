package com.example.assetembed.repo;

import com.example.assetembed.model.EmbeddingTaskEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface EmbeddingTaskRepository extends JpaRepository<EmbeddingTaskEntity, Long> {
    EmbeddingTaskEntity findByTaskUuid(String taskUuid);

    List<EmbeddingTaskEntity> findAllByOrderByIdDesc();
}
