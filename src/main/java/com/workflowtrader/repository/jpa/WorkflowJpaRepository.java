package com.workflowtrader.repository.jpa;

import com.workflowtrader.domain.enums.ReviewInterval;
import com.workflowtrader.domain.enums.WorkflowStatus;
import com.workflowtrader.entity.WorkflowEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface WorkflowJpaRepository extends JpaRepository<WorkflowEntity, Long> {

    List<WorkflowEntity> findByStatusAndReviewInterval(WorkflowStatus status, ReviewInterval reviewInterval);

    List<WorkflowEntity> findByUserIdAndStatus(String userId, WorkflowStatus status);

    /** Update only the status column. */
    @Modifying
    @Transactional
    @Query("UPDATE WorkflowEntity w SET w.status = :status, w.updatedAt = :updatedAt WHERE w.id = :id")
    void updateStatus(
            @Param("id") Long id, @Param("status") WorkflowStatus status, @Param("updatedAt") LocalDateTime updatedAt);
}
