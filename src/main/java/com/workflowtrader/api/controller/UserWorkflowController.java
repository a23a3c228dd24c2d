package com.workflowtrader.api.controller;

import com.workflowtrader.workflow.WorkflowDisableService;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Hook called by the key management flow when a user's exchange or AI key is removed.
 * {@code POST /api/users/{userId}/workflows/disable[?aiApiKeyId=]}.
 */
@RestController
@RequestMapping("/api/users/{userId}/workflows")
public class UserWorkflowController {

    private final WorkflowDisableService workflowDisableService;

    public UserWorkflowController(WorkflowDisableService workflowDisableService) {
        this.workflowDisableService = workflowDisableService;
    }

    @PostMapping("/disable")
    public Map<String, List<Long>> disableWorkflows(
            @PathVariable String userId, @RequestParam(required = false) Long aiApiKeyId) {
        return Map.of("disabledWorkflowIds", workflowDisableService.disableUserWorkflows(userId, aiApiKeyId));
    }
}
