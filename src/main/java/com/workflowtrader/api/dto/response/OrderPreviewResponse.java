package com.workflowtrader.api.dto.response;

import com.workflowtrader.agent.SpotOrderInstruction;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/** A stored decision order as it would be submitted by a manual rebalance. */
@Getter
@Builder
public class OrderPreviewResponse {

    private final String pair;
    private final String token;
    private final String side;
    private final BigDecimal quantity;
    private final BigDecimal price;

    public static OrderPreviewResponse from(SpotOrderInstruction instruction) {
        return OrderPreviewResponse.builder()
                .pair(instruction.getPair())
                .token(instruction.getToken())
                .side(instruction.getSide() != null ? instruction.getSide().name() : null)
                .quantity(instruction.getQuantity())
                .price(instruction.getLimitPrice())
                .build();
    }
}
