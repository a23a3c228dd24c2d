package com.workflowtrader.domain.model;

import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.domain.enums.WorkflowStatus;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Read projection of an OPEN limit order together with its owning workflow's status.
 * Built directly by a JPQL constructor expression.
 */
@Data
@AllArgsConstructor
public class OpenLimitOrder {

    private Long id;
    private String userId;
    private Long workflowId;
    private SupportedExchange exchange;
    private String symbol;
    private String orderId;
    private WorkflowStatus workflowStatus;
}
