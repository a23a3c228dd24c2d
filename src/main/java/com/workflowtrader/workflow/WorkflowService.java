package com.workflowtrader.workflow;

import com.workflowtrader.domain.enums.ReviewInterval;
import com.workflowtrader.domain.enums.WorkflowStatus;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.domain.model.WorkflowToken;
import com.workflowtrader.entity.WorkflowTokenEntity;
import com.workflowtrader.exception.ResourceNotFoundException;
import com.workflowtrader.mapper.WorkflowMapper;
import com.workflowtrader.repository.jpa.WorkflowJpaRepository;
import com.workflowtrader.repository.jpa.WorkflowTokenJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Loads workflows with their token lists and changes their status. */
@Service
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    private final WorkflowJpaRepository workflowJpaRepository;
    private final WorkflowTokenJpaRepository workflowTokenJpaRepository;
    private final WorkflowMapper workflowMapper;

    public WorkflowService(
            WorkflowJpaRepository workflowJpaRepository,
            WorkflowTokenJpaRepository workflowTokenJpaRepository,
            WorkflowMapper workflowMapper) {
        this.workflowJpaRepository = workflowJpaRepository;
        this.workflowTokenJpaRepository = workflowTokenJpaRepository;
        this.workflowMapper = workflowMapper;
    }

    /**
     * @throws ResourceNotFoundException if no workflow has this id
     */
    public Workflow getWorkflow(Long workflowId) {
        Workflow workflow = workflowJpaRepository
                .findById(workflowId)
                .map(workflowMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Workflow", workflowId));
        workflow.setTokens(workflowMapper.toTokenList(workflowTokenJpaRepository.findByWorkflowId(workflowId)));
        return workflow;
    }

    /** Active workflows reviewed on the given interval, tokens attached in one batch query. */
    public List<Workflow> findActiveByInterval(ReviewInterval interval) {
        return withTokens(workflowMapper.toDomainList(
                workflowJpaRepository.findByStatusAndReviewInterval(WorkflowStatus.ACTIVE, interval)));
    }

    public List<Workflow> findActiveByUser(String userId) {
        return withTokens(workflowMapper.toDomainList(
                workflowJpaRepository.findByUserIdAndStatus(userId, WorkflowStatus.ACTIVE)));
    }

    public void updateStatus(Long workflowId, WorkflowStatus status) {
        workflowJpaRepository.updateStatus(workflowId, status, LocalDateTime.now());
        log.info("Workflow status updated: workflowId={}, status={}", workflowId, status);
    }

    private List<Workflow> withTokens(List<Workflow> workflows) {
        if (workflows.isEmpty()) {
            return workflows;
        }
        List<Long> ids = workflows.stream().map(Workflow::getId).toList();
        Map<Long, List<WorkflowTokenEntity>> tokensByWorkflow = workflowTokenJpaRepository
                .findByWorkflowIdIn(ids)
                .stream()
                .collect(Collectors.groupingBy(WorkflowTokenEntity::getWorkflowId));
        for (Workflow workflow : workflows) {
            List<WorkflowToken> tokens =
                    workflowMapper.toTokenList(tokensByWorkflow.getOrDefault(workflow.getId(), List.of()));
            workflow.setTokens(tokens);
        }
        return workflows;
    }
}
