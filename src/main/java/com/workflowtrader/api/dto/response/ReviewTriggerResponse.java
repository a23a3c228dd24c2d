package com.workflowtrader.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ReviewTriggerResponse {

    private final Long workflowId;
    private final String status;
    private final String message;

    public static ReviewTriggerResponse accepted(Long workflowId) {
        return new ReviewTriggerResponse(workflowId, "ACCEPTED", "Review started");
    }
}
