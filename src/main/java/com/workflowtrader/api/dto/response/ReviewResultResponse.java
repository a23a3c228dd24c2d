package com.workflowtrader.api.dto.response;

import com.workflowtrader.domain.model.FuturesOrder;
import com.workflowtrader.domain.model.LimitOrder;
import com.workflowtrader.domain.model.ReviewResult;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** A stored review result with the orders it produced. */
@Getter
@Builder
public class ReviewResultResponse {

    private final Long id;
    private final LocalDateTime createdAt;
    private final boolean rebalance;
    private final String shortReport;
    private final String error;
    private final List<OrderLine> orders;

    @Getter
    @Builder
    public static class OrderLine {
        private final String kind;
        private final String symbol;
        private final String orderId;
        private final String side;
        private final BigDecimal quantity;
        private final BigDecimal price;
        private final String status;
        private final String reason;

        public static OrderLine spot(LimitOrder order) {
            return OrderLine.builder()
                    .kind("SPOT")
                    .symbol(order.getSymbol())
                    .orderId(order.getOrderId())
                    .side(order.getPlanned() != null && order.getPlanned().getSide() != null
                            ? order.getPlanned().getSide().name()
                            : null)
                    .quantity(order.getPlanned() != null ? order.getPlanned().getQuantity() : null)
                    .price(order.getPlanned() != null ? order.getPlanned().getPrice() : null)
                    .status(order.getStatus().name())
                    .reason(order.getCancellationReason())
                    .build();
        }
    }

    public static ReviewResultResponse from(
            ReviewResult result, List<LimitOrder> limitOrders, List<FuturesOrder> futuresOrders) {
        List<OrderLine> lines = new ArrayList<>();
        for (LimitOrder order : limitOrders) {
            lines.add(OrderLine.spot(order));
        }
        for (FuturesOrder order : futuresOrders) {
            lines.add(OrderLine.builder()
                    .kind("FUTURES")
                    .symbol(order.getSymbol())
                    .orderId(order.getOrderId())
                    .side(order.getPlanned() != null && order.getPlanned().getAction() != null
                            ? order.getPlanned().getAction().name() + " " + order.getPlanned().getPositionSide()
                            : null)
                    .quantity(order.getPlanned() != null ? order.getPlanned().getQuantity() : null)
                    .price(order.getPlanned() != null ? order.getPlanned().getPrice() : null)
                    .status(order.getStatus().name())
                    .reason(order.getFailureReason())
                    .build());
        }
        return ReviewResultResponse.builder()
                .id(result.getId())
                .createdAt(result.getCreatedAt())
                .rebalance(result.isRebalance())
                .shortReport(result.getShortReport())
                .error(result.getError())
                .orders(lines)
                .build();
    }
}
