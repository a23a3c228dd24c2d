package com.workflowtrader.repository.jpa;

import com.workflowtrader.entity.ReviewResultEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for review_result. Rows are insert-only. */
@Repository
public interface ReviewResultJpaRepository extends JpaRepository<ReviewResultEntity, Long> {

    List<ReviewResultEntity> findByWorkflowIdOrderByCreatedAtDesc(Long workflowId, Pageable pageable);

    Optional<ReviewResultEntity> findByIdAndWorkflowId(Long id, Long workflowId);
}
