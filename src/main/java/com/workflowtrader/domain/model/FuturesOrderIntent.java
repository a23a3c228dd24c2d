package com.workflowtrader.domain.model;

import com.workflowtrader.domain.enums.FuturesActionType;
import com.workflowtrader.domain.enums.FuturesOrderType;
import com.workflowtrader.domain.enums.MarginMode;
import com.workflowtrader.domain.enums.PositionSide;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Planned parameters of one futures action, stored as versioned JSON on the order row. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FuturesOrderIntent {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    private int version = CURRENT_VERSION;

    private String symbol;
    private PositionSide positionSide;
    private FuturesActionType action;
    private FuturesOrderType type;
    private BigDecimal quantity;
    private BigDecimal price;
    private Boolean reduceOnly;

    /** Resolved leverage after defaulting and clamping; null when left unchanged. */
    private Integer leverage;

    private BigDecimal stopLoss;
    private BigDecimal takeProfit;
    private MarginMode marginMode;
    private String notes;
}
