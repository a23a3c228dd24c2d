package com.workflowtrader.exchange.model;

import com.workflowtrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SpotOpenOrder {

    private String orderId;
    private String symbol;
    private OrderSide side;
    private BigDecimal price;
    private BigDecimal quantity;
}
