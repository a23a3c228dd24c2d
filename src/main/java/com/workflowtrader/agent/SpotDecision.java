package com.workflowtrader.agent;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Decision returned for a spot workflow: the orders to place and a short report. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpotDecision implements TradingDecision {

    @NotNull
    @Valid
    @Builder.Default
    private List<SpotOrderInstruction> orders = new ArrayList<>();

    @NotNull
    private String shortReport;

    @Override
    public boolean hasInstructions() {
        return orders != null && !orders.isEmpty();
    }
}
