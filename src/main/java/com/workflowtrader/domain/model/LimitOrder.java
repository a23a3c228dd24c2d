package com.workflowtrader.domain.model;

import com.workflowtrader.domain.enums.LimitOrderStatus;
import com.workflowtrader.domain.enums.SupportedExchange;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * One spot limit order attempt produced by a rebalance.
 *
 * <p>Created OPEN when the exchange accepted it, or directly CANCELED when it was rejected
 * before or by the exchange. After creation only the reconciler or an explicit cancel path
 * moves it, and only from OPEN; the single exception is a fill observed while canceling,
 * which may move CANCELED to FILLED.
 */
@Data
@Builder
public class LimitOrder {

    private Long id;
    private String userId;
    private Long workflowId;
    private Long reviewResultId;
    private SupportedExchange exchange;
    private String symbol;
    private String orderId;
    private LimitOrderIntent planned;
    private LimitOrderStatus status;
    private String cancellationReason;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
