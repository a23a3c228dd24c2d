package com.workflowtrader.api.dto.request;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Executes one order of a stored spot decision. Every field is optional; an empty body places
 * the first stored order unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualOrderRequest {

    /** Position in the stored decision's order list, 0 when absent. */
    private Integer orderIndex;

    /** Replaces both the limit price and the divergence base price. */
    private BigDecimal price;

    private BigDecimal quantity;
}
