package com.workflowtrader.exchange.model;

import com.workflowtrader.domain.enums.FuturesOrderType;
import com.workflowtrader.domain.enums.MarginMode;
import com.workflowtrader.domain.enums.PositionSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Open, scale or close a futures position. With {@code reduceOnly} the order side is the
 * closing side of {@code positionSide}. {@code marginMode} lets the adapter choose its own
 * position-index or hedge-mode encoding.
 */
@Data
@Builder
public class FuturesPositionRequest {

    private String symbol;
    private PositionSide positionSide;
    private BigDecimal quantity;
    private FuturesOrderType type;
    private BigDecimal price;
    private boolean reduceOnly;
    private MarginMode marginMode;
}
