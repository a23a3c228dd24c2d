package com.workflowtrader.exchange.model;

import com.workflowtrader.domain.enums.MarginMode;
import com.workflowtrader.domain.enums.PositionSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/** Stop-loss or take-profit trigger that closes the whole position. */
@Data
@Builder
public class FuturesStopRequest {

    private String symbol;
    private PositionSide positionSide;
    private BigDecimal stopPrice;
    private MarginMode marginMode;
}
