package com.workflowtrader.agent;

import com.workflowtrader.domain.enums.OrderSide;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One spot order requested by the decision model.
 *
 * <p>{@code quantity} is denominated in {@code token}, which must be either the base or the
 * quote asset of {@code pair}. {@code maxPriceDivergencePct} is a ratio (0.01 = 1%) allowed
 * between {@code basePrice} and the live market price.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpotOrderInstruction {

    @NotBlank
    private String pair;

    @NotBlank
    private String token;

    @NotNull
    private OrderSide side;

    @NotNull
    private BigDecimal quantity;

    private BigDecimal limitPrice;
    private BigDecimal basePrice;
    private BigDecimal maxPriceDivergencePct;
}
