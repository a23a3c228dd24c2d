package com.workflowtrader.oms;

import com.workflowtrader.agent.SpotOrderInstruction;
import com.workflowtrader.domain.enums.LimitOrderStatus;
import com.workflowtrader.domain.enums.OrderSide;
import com.workflowtrader.domain.model.LimitOrder;
import com.workflowtrader.domain.model.LimitOrderIntent;
import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.exchange.ExchangeGateway;
import com.workflowtrader.exchange.ExchangeGatewayRegistry;
import com.workflowtrader.exchange.MarketMetadataModule;
import com.workflowtrader.exchange.SpotTradingModule;
import com.workflowtrader.exchange.model.ExchangeOrderState;
import com.workflowtrader.exchange.model.SpotMarket;
import com.workflowtrader.exchange.model.SpotOrderRequest;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a spot decision into exchange limit orders, one independent attempt per instruction.
 *
 * <p>For each instruction, in order:
 * <ol>
 *   <li>Resolve the pair against the known tokens; the token must be its base or quote.</li>
 *   <li>Fetch symbol rules and the last price.</li>
 *   <li>Divergence guard against {@code basePrice} (or {@code limitPrice} when no base price
 *       was given).</li>
 *   <li>Price: the market price moved 0.1% in the maker's favour; a requested limit is only
 *       kept when it is at least that favourable.</li>
 *   <li>Quantity: base-denominated amounts are used as-is, quote-denominated amounts are
 *       divided by the price.</li>
 *   <li>Truncate price and quantity to the symbol precision, then apply the minimum notional.</li>
 *   <li>Place a GTC limit order.</li>
 * </ol>
 *
 * <p>Every instruction produces exactly one limit_order row: OPEN with the exchange order id,
 * or CANCELED with a synthetic id and the rejection reason. A failure on one instruction never
 * stops the others.
 */
@Service
public class RebalanceOrderBuilder {

    private static final Logger log = LoggerFactory.getLogger(RebalanceOrderBuilder.class);

    /** Execution spread applied to the market price in the maker's favour. */
    static final BigDecimal EXECUTION_SPREAD = new BigDecimal("0.001");

    static final String REASON_INVALID_PAIR = "invalid pair/token";
    static final String REASON_INVALID_SIDE = "invalid order side";
    static final String REASON_INVALID_QUANTITY = "invalid quantity";
    static final String REASON_PRICE_DIVERGENCE = "price divergence too high";
    static final String REASON_QUANTITY_TOO_SMALL = "order quantity too small";
    static final String REASON_MIN_NOTIONAL = "order below min notional";
    static final String REASON_ORDER_ID_MISSING = "order id missing";
    static final String REASON_SPOT_UNSUPPORTED = "spot trading not supported for exchange";

    private final ExchangeGatewayRegistry gatewayRegistry;
    private final OrderLedgerService orderLedgerService;

    public RebalanceOrderBuilder(ExchangeGatewayRegistry gatewayRegistry, OrderLedgerService orderLedgerService) {
        this.gatewayRegistry = gatewayRegistry;
        this.orderLedgerService = orderLedgerService;
    }

    public RebalanceResult execute(Workflow workflow, Long reviewResultId, List<SpotOrderInstruction> instructions) {
        RebalanceResult result = new RebalanceResult();
        ExchangeGateway gateway = gatewayRegistry.forExchange(workflow.getExchange());
        Optional<SpotTradingModule> spot = gateway.spot();

        for (SpotOrderInstruction instruction : instructions) {
            LimitOrderIntent intent = baseIntent(instruction);
            if (spot.isEmpty()) {
                reject(workflow, reviewResultId, intent, REASON_SPOT_UNSUPPORTED, result, false);
                continue;
            }
            try {
                placeOne(workflow, reviewResultId, gateway.metadata(), spot.get(), instruction, intent, result);
            } catch (RuntimeException e) {
                log.warn(
                        "Limit order rejected: workflowId={}, pair={}, side={}, reason={}",
                        workflow.getId(),
                        instruction.getPair(),
                        instruction.getSide(),
                        e.getMessage());
                reject(workflow, reviewResultId, intent, reasonOf(e), result, false);
            }
        }

        if (result.needsPriceDivergenceRetry()) {
            log.warn(
                    "No order placed, divergence guard stopped {} order(s): workflowId={}",
                    result.getPriceDivergenceCancellations(),
                    workflow.getId());
        }
        log.info(
                "Rebalance finished: workflowId={}, reviewResultId={}, placed={}, canceled={}",
                workflow.getId(),
                reviewResultId,
                result.getPlaced(),
                result.getCanceled());
        return result;
    }

    private void placeOne(
            Workflow workflow,
            Long reviewResultId,
            MarketMetadataModule metadata,
            SpotTradingModule spot,
            SpotOrderInstruction instruction,
            LimitOrderIntent intent,
            RebalanceResult result) {
        Optional<TradingPair> pair = TradingPair.parse(instruction.getPair());
        if (pair.isEmpty() || instruction.getToken() == null || !pair.get().contains(instruction.getToken())) {
            reject(workflow, reviewResultId, intent, REASON_INVALID_PAIR, result, false);
            return;
        }
        intent.setSymbol(pair.get().symbol());

        if (instruction.getSide() == null) {
            reject(workflow, reviewResultId, intent, REASON_INVALID_SIDE, result, false);
            return;
        }
        if (instruction.getQuantity() == null || instruction.getQuantity().signum() <= 0) {
            reject(workflow, reviewResultId, intent, REASON_INVALID_QUANTITY, result, false);
            return;
        }

        SpotMarket market = metadata.fetchMarket(pair.get().base(), pair.get().quote());
        intent.setSymbol(market.getSymbol());
        BigDecimal marketPrice = metadata.fetchTicker(market.getSymbol());
        intent.setMarketPrice(marketPrice);

        BigDecimal reference = instruction.getBasePrice() != null ? instruction.getBasePrice() : instruction.getLimitPrice();
        if (exceedsDivergence(marketPrice, reference, instruction.getMaxPriceDivergencePct())) {
            log.info(
                    "Price divergence guard: workflowId={}, symbol={}, market={}, reference={}, max={}",
                    workflow.getId(),
                    market.getSymbol(),
                    marketPrice,
                    reference,
                    instruction.getMaxPriceDivergencePct());
            reject(workflow, reviewResultId, intent, REASON_PRICE_DIVERGENCE, result, true);
            return;
        }

        BigDecimal price = truncate(
                resolvePrice(instruction.getSide(), marketPrice, instruction.getLimitPrice()),
                market.getPricePrecision());
        if (price.signum() <= 0) {
            reject(workflow, reviewResultId, intent, "invalid price", result, false);
            return;
        }
        intent.setPrice(price);

        BigDecimal quantity = truncate(
                toBaseQuantity(pair.get(), instruction.getToken(), instruction.getQuantity(), price),
                market.getQuantityPrecision());
        intent.setQuantity(quantity);
        if (quantity.signum() <= 0) {
            reject(workflow, reviewResultId, intent, REASON_QUANTITY_TOO_SMALL, result, false);
            return;
        }

        BigDecimal minNotional = market.getMinNotional() != null ? market.getMinNotional() : BigDecimal.ZERO;
        if (quantity.multiply(price).compareTo(minNotional) < 0) {
            reject(workflow, reviewResultId, intent, REASON_MIN_NOTIONAL, result, false);
            return;
        }

        ExchangeOrderState placed = spot.placeLimitOrder(
                workflow.getUserId(),
                SpotOrderRequest.builder()
                        .symbol(market.getSymbol())
                        .side(instruction.getSide())
                        .quantity(quantity)
                        .price(price)
                        .build());
        if (placed == null || placed.getOrderId() == null || placed.getOrderId().isBlank()) {
            reject(workflow, reviewResultId, intent, REASON_ORDER_ID_MISSING, result, false);
            return;
        }

        orderLedgerService.recordLimitOrder(LimitOrder.builder()
                .userId(workflow.getUserId())
                .workflowId(workflow.getId())
                .reviewResultId(reviewResultId)
                .exchange(workflow.getExchange())
                .symbol(market.getSymbol())
                .orderId(placed.getOrderId())
                .planned(intent)
                .status(LimitOrderStatus.OPEN)
                .build());
        result.recordPlaced();
    }

    // ---- Pricing ----

    /**
     * BUY: min(limit, market x 0.999). SELL: max(limit, market x 1.001). Without a limit the
     * spread-adjusted market price is used.
     */
    static BigDecimal resolvePrice(OrderSide side, BigDecimal marketPrice, BigDecimal limitPrice) {
        BigDecimal anchor = side == OrderSide.BUY
                ? marketPrice.multiply(BigDecimal.ONE.subtract(EXECUTION_SPREAD))
                : marketPrice.multiply(BigDecimal.ONE.add(EXECUTION_SPREAD));
        if (limitPrice == null || limitPrice.signum() <= 0) {
            return anchor;
        }
        return side == OrderSide.BUY ? limitPrice.min(anchor) : limitPrice.max(anchor);
    }

    /** |market - reference| / reference above the allowed ratio. No limit or no reference means no guard. */
    static boolean exceedsDivergence(BigDecimal marketPrice, BigDecimal reference, BigDecimal maxDivergence) {
        if (maxDivergence == null || reference == null || reference.signum() <= 0) {
            return false;
        }
        BigDecimal divergence = marketPrice.subtract(reference).abs().divide(reference, MathContext.DECIMAL64);
        return divergence.compareTo(maxDivergence) > 0;
    }

    static BigDecimal toBaseQuantity(TradingPair pair, String token, BigDecimal quantity, BigDecimal price) {
        String normalized = token.toUpperCase(Locale.ROOT);
        if (normalized.equals(pair.base())) {
            return quantity;
        }
        if (normalized.equals(pair.quote())) {
            return quantity.divide(price, MathContext.DECIMAL64);
        }
        throw new IllegalArgumentException(REASON_INVALID_PAIR);
    }

    /** Drops digits beyond {@code precision} decimals. Never rounds up. */
    static BigDecimal truncate(BigDecimal value, int precision) {
        return value.setScale(Math.max(precision, 0), RoundingMode.DOWN);
    }

    // ---- Rejections ----

    private void reject(
            Workflow workflow,
            Long reviewResultId,
            LimitOrderIntent intent,
            String reason,
            RebalanceResult result,
            boolean priceDivergence) {
        orderLedgerService.recordLimitOrder(LimitOrder.builder()
                .userId(workflow.getUserId())
                .workflowId(workflow.getId())
                .reviewResultId(reviewResultId)
                .exchange(workflow.getExchange())
                .symbol(intent.getSymbol())
                .orderId("rejected-" + UUID.randomUUID())
                .planned(intent)
                .status(LimitOrderStatus.CANCELED)
                .cancellationReason(reason)
                .build());
        result.recordCanceled(priceDivergence);
    }

    private static LimitOrderIntent baseIntent(SpotOrderInstruction instruction) {
        return LimitOrderIntent.builder()
                .pair(instruction.getPair())
                .token(instruction.getToken())
                .side(instruction.getSide())
                .requestedQuantity(instruction.getQuantity())
                .requestedLimitPrice(instruction.getLimitPrice())
                .basePrice(instruction.getBasePrice())
                .maxPriceDivergence(instruction.getMaxPriceDivergencePct())
                .build();
    }

    private static String reasonOf(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
