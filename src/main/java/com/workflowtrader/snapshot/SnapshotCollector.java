package com.workflowtrader.snapshot;

import com.workflowtrader.config.PipelineConfig;
import com.workflowtrader.domain.enums.TradeMode;
import com.workflowtrader.domain.model.FuturesOrder;
import com.workflowtrader.domain.model.FuturesOrderIntent;
import com.workflowtrader.domain.model.LimitOrder;
import com.workflowtrader.domain.model.LimitOrderIntent;
import com.workflowtrader.domain.model.ReviewResult;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.domain.model.WorkflowToken;
import com.workflowtrader.exception.ValidationException;
import com.workflowtrader.exchange.ExchangeGateway;
import com.workflowtrader.exchange.ExchangeGatewayRegistry;
import com.workflowtrader.exchange.FuturesTradingModule;
import com.workflowtrader.exchange.MarketMetadataModule;
import com.workflowtrader.exchange.SpotTradingModule;
import com.workflowtrader.exchange.model.SpotBalance;
import com.workflowtrader.oms.OrderLedgerService;
import com.workflowtrader.workflow.ReviewResultService;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the {@link PortfolioSnapshot} for one run.
 *
 * <p>Spot workflows get balances and cash-denominated values for every configured token and
 * the cash token. Futures workflows get the wallet and a last price per perpetual. Both get
 * the most recent review results together with the orders each one produced.
 *
 * <p>Exchange failures propagate; a run without a snapshot cannot decide anything.
 */
@Service
public class SnapshotCollector {

    private static final Logger log = LoggerFactory.getLogger(SnapshotCollector.class);

    private final ExchangeGatewayRegistry gatewayRegistry;
    private final ReviewResultService reviewResultService;
    private final OrderLedgerService orderLedgerService;
    private final PipelineConfig pipelineConfig;

    public SnapshotCollector(
            ExchangeGatewayRegistry gatewayRegistry,
            ReviewResultService reviewResultService,
            OrderLedgerService orderLedgerService,
            PipelineConfig pipelineConfig) {
        this.gatewayRegistry = gatewayRegistry;
        this.reviewResultService = reviewResultService;
        this.orderLedgerService = orderLedgerService;
        this.pipelineConfig = pipelineConfig;
    }

    public PortfolioSnapshot collect(Workflow workflow) {
        ExchangeGateway gateway = gatewayRegistry.forExchange(workflow.getExchange());
        PortfolioSnapshot snapshot = PortfolioSnapshot.builder()
                .workflowId(workflow.getId())
                .mode(workflow.getMode())
                .exchange(workflow.getExchange())
                .cashToken(upper(workflow.getCashToken()))
                .takenAt(LocalDateTime.now())
                .build();

        if (workflow.getMode() == TradeMode.FUTURES) {
            collectFutures(workflow, gateway, snapshot);
        } else {
            collectSpot(workflow, gateway, snapshot);
        }
        snapshot.setHistory(collectHistory(workflow));

        log.info(
                "Snapshot collected: workflowId={}, mode={}, positions={}, history={}",
                workflow.getId(),
                workflow.getMode(),
                snapshot.getPositions().size(),
                snapshot.getHistory().size());
        return snapshot;
    }

    // ---- Spot ----

    private void collectSpot(Workflow workflow, ExchangeGateway gateway, PortfolioSnapshot snapshot) {
        SpotTradingModule spot = gateway.spot()
                .orElseThrow(() -> new ValidationException(
                        "spot trading not supported for exchange " + workflow.getExchange()));
        MarketMetadataModule metadata = gateway.metadata();
        String cash = snapshot.getCashToken();

        Map<String, SpotBalance> balances = spot.fetchBalances(workflow.getUserId()).stream()
                .collect(Collectors.toMap(
                        b -> upper(b.getAsset()), Function.identity(), (a, b) -> a, LinkedHashMap::new));

        Map<String, BigDecimal> minAllocations = new LinkedHashMap<>();
        for (WorkflowToken token : workflow.getTokens()) {
            minAllocations.put(upper(token.getToken()), token.getMinAllocation());
        }

        BigDecimal total = BigDecimal.ZERO;
        for (String token : workflow.allowedTokens()) {
            SpotBalance balance = balances.get(token);
            BigDecimal quantity = balance != null ? balance.total() : BigDecimal.ZERO;
            BigDecimal price = token.equals(cash) ? BigDecimal.ONE : metadata.fetchTicker(token + cash);
            BigDecimal value = quantity.multiply(price);
            total = total.add(value);

            snapshot.getPositions().add(PortfolioSnapshot.Position.builder()
                    .token(token)
                    .quantity(quantity)
                    .free(balance != null ? balance.getFree() : BigDecimal.ZERO)
                    .price(price)
                    .value(value)
                    .minAllocation(minAllocations.get(token))
                    .build());
            if (!token.equals(cash)) {
                snapshot.getRoutes().add(token + cash);
            }
        }
        snapshot.setTotalValue(total);
    }

    // ---- Futures ----

    private void collectFutures(Workflow workflow, ExchangeGateway gateway, PortfolioSnapshot snapshot) {
        FuturesTradingModule futures = gateway.futures()
                .orElseThrow(() -> new ValidationException(
                        "futures trading not supported for exchange " + workflow.getExchange()));
        snapshot.setFuturesWallet(futures.fetchWallet(workflow.getUserId()));
        snapshot.setTotalValue(snapshot.getFuturesWallet().getTotalWalletBalance());

        String cash = snapshot.getCashToken();
        for (WorkflowToken token : workflow.getTokens()) {
            String base = upper(token.getToken());
            if (base.equals(cash)) {
                continue;
            }
            String symbol = base + cash;
            snapshot.getMarkPrices().put(symbol, gateway.metadata().fetchTicker(symbol));
        }
    }

    // ---- History ----

    private List<PortfolioSnapshot.HistoryEntry> collectHistory(Workflow workflow) {
        List<ReviewResult> recent = reviewResultService.findRecent(workflow.getId(), pipelineConfig.getHistorySize());
        if (recent.isEmpty()) {
            return new ArrayList<>();
        }
        List<Long> resultIds = recent.stream().map(ReviewResult::getId).toList();
        Map<Long, List<PortfolioSnapshot.HistoryOrder>> ordersByResult = workflow.getMode() == TradeMode.FUTURES
                ? futuresHistory(orderLedgerService.findFuturesOrdersForResults(resultIds))
                : spotHistory(orderLedgerService.findLimitOrdersForResults(resultIds));

        List<PortfolioSnapshot.HistoryEntry> history = new ArrayList<>();
        for (ReviewResult result : recent) {
            history.add(PortfolioSnapshot.HistoryEntry.builder()
                    .createdAt(result.getCreatedAt())
                    .rebalance(result.isRebalance())
                    .shortReport(result.getShortReport())
                    .error(result.getError())
                    .orders(ordersByResult.getOrDefault(result.getId(), new ArrayList<>()))
                    .build());
        }
        return history;
    }

    private static Map<Long, List<PortfolioSnapshot.HistoryOrder>> spotHistory(List<LimitOrder> orders) {
        Map<Long, List<PortfolioSnapshot.HistoryOrder>> byResult = new LinkedHashMap<>();
        for (LimitOrder order : orders) {
            LimitOrderIntent planned = order.getPlanned();
            byResult.computeIfAbsent(order.getReviewResultId(), id -> new ArrayList<>())
                    .add(PortfolioSnapshot.HistoryOrder.builder()
                            .symbol(order.getSymbol())
                            .side(planned != null && planned.getSide() != null ? planned.getSide().name() : null)
                            .quantity(planned != null ? planned.getQuantity() : null)
                            .price(planned != null ? planned.getPrice() : null)
                            .status(order.getStatus().name())
                            .reason(order.getCancellationReason())
                            .build());
        }
        return byResult;
    }

    private static Map<Long, List<PortfolioSnapshot.HistoryOrder>> futuresHistory(List<FuturesOrder> orders) {
        Map<Long, List<PortfolioSnapshot.HistoryOrder>> byResult = new LinkedHashMap<>();
        for (FuturesOrder order : orders) {
            FuturesOrderIntent planned = order.getPlanned();
            String side = null;
            if (planned != null && planned.getAction() != null) {
                side = planned.getAction().name()
                        + (planned.getPositionSide() != null ? " " + planned.getPositionSide().name() : "");
            }
            byResult.computeIfAbsent(order.getReviewResultId(), id -> new ArrayList<>())
                    .add(PortfolioSnapshot.HistoryOrder.builder()
                            .symbol(order.getSymbol())
                            .side(side)
                            .quantity(planned != null ? planned.getQuantity() : null)
                            .price(planned != null ? planned.getPrice() : null)
                            .status(order.getStatus().name())
                            .reason(order.getFailureReason())
                            .build());
        }
        return byResult;
    }

    private static String upper(String value) {
        return value != null ? value.toUpperCase(Locale.ROOT) : null;
    }
}
