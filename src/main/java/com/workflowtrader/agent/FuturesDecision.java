package com.workflowtrader.agent;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FuturesDecision implements TradingDecision {

    @NotNull
    @Valid
    @Builder.Default
    private List<FuturesActionInstruction> actions = new ArrayList<>();

    @NotNull
    private String shortReport;

    private String strategyName;

    /** HOLD-only batches count as instructions; their actions are recorded as skipped. */
    @Override
    public boolean hasInstructions() {
        return actions != null && !actions.isEmpty();
    }
}
