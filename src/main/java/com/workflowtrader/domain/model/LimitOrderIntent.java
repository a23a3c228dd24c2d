package com.workflowtrader.domain.model;

import com.workflowtrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Planned parameters of a spot limit order, stored as versioned JSON on the order row.
 *
 * <p>{@code requestedQuantity} and {@code requestedLimitPrice} are what the decision asked for;
 * {@code quantity} and {@code price} are the exchange-ready values after spread, conversion and
 * truncation. The latter are null when the order was rejected before they could be computed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LimitOrderIntent {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    private int version = CURRENT_VERSION;

    private String symbol;
    private String pair;
    private String token;
    private OrderSide side;
    private BigDecimal requestedQuantity;
    private BigDecimal requestedLimitPrice;
    private BigDecimal basePrice;
    private BigDecimal maxPriceDivergence;
    private BigDecimal marketPrice;
    private BigDecimal quantity;
    private BigDecimal price;
}
