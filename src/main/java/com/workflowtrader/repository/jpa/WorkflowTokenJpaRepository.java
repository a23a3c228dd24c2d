package com.workflowtrader.repository.jpa;

import com.workflowtrader.entity.WorkflowTokenEntity;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WorkflowTokenJpaRepository extends JpaRepository<WorkflowTokenEntity, Long> {

    List<WorkflowTokenEntity> findByWorkflowId(Long workflowId);

    /** Batch load tokens for a set of workflows (scheduler ticks). */
    List<WorkflowTokenEntity> findByWorkflowIdIn(Collection<Long> workflowIds);
}
