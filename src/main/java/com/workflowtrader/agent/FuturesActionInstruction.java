package com.workflowtrader.agent;

import com.workflowtrader.domain.enums.FuturesActionType;
import com.workflowtrader.domain.enums.FuturesOrderType;
import com.workflowtrader.domain.enums.PositionSide;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One futures action requested by the decision model. Optional fields may be null. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FuturesActionInstruction {

    private String symbol;

    @NotNull
    private PositionSide positionSide;

    @NotNull
    private FuturesActionType action;

    private FuturesOrderType type;

    @NotNull
    private BigDecimal quantity;

    private BigDecimal price;
    private Boolean reduceOnly;
    private BigDecimal leverage;
    private BigDecimal stopLoss;
    private BigDecimal takeProfit;
    private String notes;
}
