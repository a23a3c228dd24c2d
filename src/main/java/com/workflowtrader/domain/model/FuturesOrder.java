package com.workflowtrader.domain.model;

import com.workflowtrader.domain.enums.FuturesOrderStatus;
import com.workflowtrader.domain.enums.SupportedExchange;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** One futures action attempt. Terminal at creation. */
@Data
@Builder
public class FuturesOrder {

    private Long id;
    private String userId;
    private Long reviewResultId;
    private SupportedExchange exchange;
    private String symbol;
    private String orderId;
    private FuturesOrderIntent planned;
    private FuturesOrderStatus status;
    private String failureReason;
    private LocalDateTime createdAt;
}
