package com.workflowtrader.workflow;

import com.workflowtrader.domain.enums.WorkflowStatus;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.oms.CancelReasons;
import com.workflowtrader.oms.OpenOrderCleaner;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Takes workflows out of rotation.
 *
 * <p>Open orders are canceled first, then the status is set to INACTIVE so no scheduler tick
 * picks the workflow up again. A run already in flight is not interrupted; orders it places
 * afterwards are canceled by the reconciler because their workflow is no longer active.
 */
@Service
public class WorkflowDisableService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDisableService.class);

    private final WorkflowService workflowService;
    private final OpenOrderCleaner openOrderCleaner;

    public WorkflowDisableService(WorkflowService workflowService, OpenOrderCleaner openOrderCleaner) {
        this.workflowService = workflowService;
        this.openOrderCleaner = openOrderCleaner;
    }

    /**
     * Disables every active workflow of a user after one of their API keys was removed. When
     * {@code aiApiKeyId} is given only workflows using that AI key are disabled.
     *
     * @return ids of the workflows that were disabled
     */
    public List<Long> disableUserWorkflows(String userId, Long aiApiKeyId) {
        List<Workflow> relevant = workflowService.findActiveByUser(userId).stream()
                .filter(wf -> aiApiKeyId == null || aiApiKeyId.equals(wf.getAiApiKeyId()))
                .toList();
        if (relevant.isEmpty()) {
            return List.of();
        }

        List<Long> disabled = new ArrayList<>();
        for (Workflow workflow : relevant) {
            cancelOrders(workflow.getId(), CancelReasons.API_KEY_REMOVED);
            workflowService.updateStatus(workflow.getId(), WorkflowStatus.INACTIVE);
            disabled.add(workflow.getId());
        }
        log.info("User workflows disabled: userId={}, workflowIds={}", userId, disabled);
        return disabled;
    }

    /** User-initiated stop of a single workflow. */
    public void stopWorkflow(Long workflowId) {
        Workflow workflow = workflowService.getWorkflow(workflowId);
        cancelOrders(workflowId, CancelReasons.WORKFLOW_STOPPED);
        if (workflow.getStatus() == WorkflowStatus.ACTIVE) {
            workflowService.updateStatus(workflowId, WorkflowStatus.INACTIVE);
        }
        log.info("Workflow stopped: workflowId={}, previousStatus={}", workflowId, workflow.getStatus());
    }

    private void cancelOrders(Long workflowId, String reason) {
        try {
            openOrderCleaner.cancelOpenOrders(workflowId, reason);
        } catch (RuntimeException e) {
            log.error("Failed to cancel orders: workflowId={}, reason={}", workflowId, reason, e);
        }
    }
}
