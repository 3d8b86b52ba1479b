package com.chicu.aimodelops.lifecycle.history;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface RetrainHistoryRepository extends JpaRepository<RetrainHistoryEntity, Long> {

    Optional<RetrainHistoryEntity> findByAttemptId(String attemptId);

    List<RetrainHistoryEntity> findAllByOrderByStartedAtDesc(Pageable pageable);

    boolean existsByAttemptId(String attemptId);
}
