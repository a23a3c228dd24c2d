package com.workflowtrader.exchange.model;

import com.workflowtrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** A GTC limit order, already truncated to the symbol's precision. */
@Data
@Builder
public class SpotOrderRequest {

    private String symbol;
    private OrderSide side;
    private BigDecimal quantity;
    private BigDecimal price;
}
