package com.workflowtrader.oms;

import com.workflowtrader.agent.FuturesActionInstruction;
import com.workflowtrader.domain.enums.FuturesActionType;
import com.workflowtrader.domain.enums.FuturesOrderStatus;
import com.workflowtrader.domain.enums.FuturesOrderType;
import com.workflowtrader.domain.model.FuturesOrder;
import com.workflowtrader.domain.model.FuturesOrderIntent;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.exchange.ExchangeGatewayRegistry;
import com.workflowtrader.exchange.FuturesTradingModule;
import com.workflowtrader.exchange.model.FuturesPositionRequest;
import com.workflowtrader.exchange.model.FuturesStopRequest;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes a futures decision action by action.
 *
 * <p>Each action is validated completely before any exchange call. A valid action is sent as
 * up to four sequential calls:
 * <ol>
 *   <li>set leverage (when the action or the workflow specifies one)</li>
 *   <li>open, scale or close the position</li>
 *   <li>set stop-loss (when given)</li>
 *   <li>set take-profit (when given)</li>
 * </ol>
 * The first call that throws ends the action as FAILED with the exchange message.
 *
 * <p>Calls that already succeeded are not undone: a leverage change survives a failed order,
 * and a position survives a failed stop-loss. The stored failure reason is the only record of
 * such partial state.
 *
 * <p>Each action produces exactly one futures_order row (EXECUTED, FAILED or SKIPPED).
 */
@Service
public class FuturesExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(FuturesExecutionEngine.class);

    static final int MIN_LEVERAGE = 1;
    static final int MAX_LEVERAGE = 125;
    static final String REASON_UNSUPPORTED = "futures trading not supported for exchange";

    private final ExchangeGatewayRegistry gatewayRegistry;
    private final OrderLedgerService orderLedgerService;

    public FuturesExecutionEngine(ExchangeGatewayRegistry gatewayRegistry, OrderLedgerService orderLedgerService) {
        this.gatewayRegistry = gatewayRegistry;
        this.orderLedgerService = orderLedgerService;
    }

    public FuturesExecutionResult execute(
            Workflow workflow, Long reviewResultId, List<FuturesActionInstruction> actions) {
        FuturesExecutionResult result = new FuturesExecutionResult();
        Optional<FuturesTradingModule> futures =
                gatewayRegistry.forExchange(workflow.getExchange()).futures();

        if (futures.isEmpty()) {
            log.warn(
                    "Futures not supported, failing batch: workflowId={}, exchange={}, actions={}",
                    workflow.getId(),
                    workflow.getExchange(),
                    actions.size());
            for (FuturesActionInstruction action : actions) {
                record(workflow, reviewResultId, plan(action, workflow, null), FuturesOrderStatus.FAILED, REASON_UNSUPPORTED);
                result.recordFailed();
            }
            return result;
        }

        for (FuturesActionInstruction action : actions) {
            executeOne(workflow, reviewResultId, futures.get(), action, result);
        }

        log.info(
                "Futures batch finished: workflowId={}, reviewResultId={}, executed={}, failed={}, skipped={}",
                workflow.getId(),
                reviewResultId,
                result.getExecuted(),
                result.getFailed(),
                result.getSkipped());
        return result;
    }

    private void executeOne(
            Workflow workflow,
            Long reviewResultId,
            FuturesTradingModule futures,
            FuturesActionInstruction action,
            FuturesExecutionResult result) {
        String symbol = normalizeSymbol(action.getSymbol());
        FuturesOrderIntent planned = plan(action, workflow, symbol);

        String invalid = validate(action, symbol);
        if (invalid != null) {
            record(workflow, reviewResultId, planned, FuturesOrderStatus.FAILED, invalid);
            result.recordFailed();
            return;
        }
        if (action.getAction() == FuturesActionType.HOLD) {
            record(workflow, reviewResultId, planned, FuturesOrderStatus.SKIPPED, null);
            result.recordSkipped();
            return;
        }

        Integer leverage = resolveLeverage(action.getLeverage(), workflow.getFuturesDefaultLeverage());
        planned.setLeverage(leverage);
        String userId = workflow.getUserId();

        try {
            if (leverage != null) {
                futures.setLeverage(userId, symbol, leverage);
            }

            futures.openPosition(
                    userId,
                    FuturesPositionRequest.builder()
                            .symbol(symbol)
                            .positionSide(action.getPositionSide())
                            .quantity(action.getQuantity())
                            .type(planned.getType())
                            .price(action.getPrice())
                            .reduceOnly(Boolean.TRUE.equals(planned.getReduceOnly()))
                            .marginMode(workflow.getFuturesMarginMode())
                            .build());

            if (action.getStopLoss() != null) {
                futures.setStopLoss(userId, stop(workflow, action, symbol, action.getStopLoss()));
            }
            if (action.getTakeProfit() != null) {
                futures.setTakeProfit(userId, stop(workflow, action, symbol, action.getTakeProfit()));
            }
        } catch (RuntimeException e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn(
                    "Futures action failed: workflowId={}, symbol={}, action={}, reason={}",
                    workflow.getId(),
                    symbol,
                    action.getAction(),
                    reason);
            record(workflow, reviewResultId, planned, FuturesOrderStatus.FAILED, reason);
            result.recordFailed();
            return;
        }

        record(workflow, reviewResultId, planned, FuturesOrderStatus.EXECUTED, null);
        result.recordExecuted();
        log.info(
                "Futures action executed: workflowId={}, symbol={}, action={}, positionSide={}, qty={}",
                workflow.getId(),
                symbol,
                action.getAction(),
                action.getPositionSide(),
                action.getQuantity());
    }

    /** Returns the failure reason, or null when the action may be dispatched. */
    static String validate(FuturesActionInstruction action, String symbol) {
        if (symbol == null) {
            return "missing symbol";
        }
        if (action.getAction() == null) {
            return "missing action";
        }
        if (action.getAction() == FuturesActionType.HOLD) {
            return null;
        }
        if (action.getPositionSide() == null) {
            return "missing positionSide";
        }
        if (action.getQuantity() == null || action.getQuantity().signum() <= 0) {
            return "invalid quantity: " + plain(action.getQuantity());
        }
        if (action.getType() == FuturesOrderType.LIMIT && action.getPrice() == null) {
            return "price is required for LIMIT orders";
        }
        if (action.getPrice() != null && action.getPrice().signum() <= 0) {
            return "invalid price: " + plain(action.getPrice());
        }
        if (action.getLeverage() != null && action.getLeverage().signum() <= 0) {
            return "invalid leverage: " + plain(action.getLeverage());
        }
        if (action.getStopLoss() != null && action.getStopLoss().signum() <= 0) {
            return "invalid stopLoss: " + plain(action.getStopLoss());
        }
        if (action.getTakeProfit() != null && action.getTakeProfit().signum() <= 0) {
            return "invalid takeProfit: " + plain(action.getTakeProfit());
        }
        return null;
    }

    /** Action leverage, else the workflow default, rounded half-up and clamped to 1..125. */
    static Integer resolveLeverage(BigDecimal actionLeverage, Integer defaultLeverage) {
        int raw;
        if (actionLeverage != null) {
            raw = actionLeverage.setScale(0, RoundingMode.HALF_UP).intValue();
        } else if (defaultLeverage != null) {
            raw = defaultLeverage;
        } else {
            return null;
        }
        return Math.max(MIN_LEVERAGE, Math.min(MAX_LEVERAGE, raw));
    }

    private static FuturesOrderIntent plan(FuturesActionInstruction action, Workflow workflow, String symbol) {
        FuturesOrderType type = action.getType() != null ? action.getType() : FuturesOrderType.MARKET;
        boolean reduceOnly = action.getReduceOnly() != null
                ? action.getReduceOnly()
                : action.getAction() == FuturesActionType.CLOSE;
        return FuturesOrderIntent.builder()
                .symbol(symbol != null ? symbol : action.getSymbol())
                .positionSide(action.getPositionSide())
                .action(action.getAction())
                .type(type)
                .quantity(action.getQuantity())
                .price(action.getPrice())
                .reduceOnly(reduceOnly)
                .stopLoss(action.getStopLoss())
                .takeProfit(action.getTakeProfit())
                .marginMode(workflow.getFuturesMarginMode())
                .notes(action.getNotes())
                .build();
    }

    private static FuturesStopRequest stop(
            Workflow workflow, FuturesActionInstruction action, String symbol, BigDecimal stopPrice) {
        return FuturesStopRequest.builder()
                .symbol(symbol)
                .positionSide(action.getPositionSide())
                .stopPrice(stopPrice)
                .marginMode(workflow.getFuturesMarginMode())
                .build();
    }

    private void record(
            Workflow workflow,
            Long reviewResultId,
            FuturesOrderIntent planned,
            FuturesOrderStatus status,
            String failureReason) {
        orderLedgerService.recordFuturesOrder(FuturesOrder.builder()
                .userId(workflow.getUserId())
                .reviewResultId(reviewResultId)
                .exchange(workflow.getExchange())
                .symbol(planned.getSymbol())
                .orderId(UUID.randomUUID().toString())
                .planned(planned)
                .status(status)
                .failureReason(failureReason)
                .build());
    }

    private static String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return null;
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : "null";
    }
}
