package com.workflowtrader.snapshot;

import com.workflowtrader.analysis.AnalystReport;
import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.domain.enums.TradeMode;
import com.workflowtrader.exchange.model.FuturesWallet;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time view of a workflow's account and market, serialized as the decision agent's
 * input payload and stored verbatim as the run's prompt.
 */
@Data
@Builder
public class PortfolioSnapshot {

    private Long workflowId;
    private TradeMode mode;
    private SupportedExchange exchange;
    private String cashToken;
    private LocalDateTime takenAt;

    /** Spot only: one entry per configured token plus the cash token. */
    @Builder.Default
    private List<Position> positions = new ArrayList<>();

    /** Spot only: tradable pair symbols between configured tokens and the cash token. */
    @Builder.Default
    private List<String> routes = new ArrayList<>();

    private BigDecimal totalValue;

    /** Futures only. */
    private FuturesWallet futuresWallet;

    /** Futures only: last price per perpetual symbol. */
    @Builder.Default
    private Map<String, BigDecimal> markPrices = new LinkedHashMap<>();

    @Builder.Default
    private List<HistoryEntry> history = new ArrayList<>();

    /** Analyst output per token, filled after collection. */
    @Builder.Default
    private Map<String, List<AnalystReport>> reports = new LinkedHashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Position {
        private String token;
        private BigDecimal quantity;
        private BigDecimal free;
        private BigDecimal price;
        private BigDecimal value;
        private BigDecimal minAllocation;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HistoryEntry {
        private LocalDateTime createdAt;
        private boolean rebalance;
        private String shortReport;
        private String error;

        @Builder.Default
        private List<HistoryOrder> orders = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HistoryOrder {
        private String symbol;
        private String side;
        private BigDecimal quantity;
        private BigDecimal price;
        private String status;
        private String reason;
    }
}
