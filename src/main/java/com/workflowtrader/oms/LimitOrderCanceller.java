package com.workflowtrader.oms;

import com.workflowtrader.domain.enums.LimitOrderStatus;
import com.workflowtrader.domain.model.OpenLimitOrder;
import com.workflowtrader.exception.ExchangeException;
import com.workflowtrader.exchange.ExchangeGatewayRegistry;
import com.workflowtrader.exchange.SpotTradingModule;
import com.workflowtrader.exchange.model.ExchangeOrderState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cancels one open limit order on its exchange and records the outcome in the ledger.
 *
 * <p>An order can fill between the moment it was read as OPEN and the moment the cancel
 * arrives. The exchange is therefore asked for the order's final state after every cancel:
 * <ul>
 *   <li>cancel response FILLED: the order is recorded FILLED</li>
 *   <li>otherwise the order is fetched; FILLED wins, anything else is recorded CANCELED</li>
 *   <li>cancel rejected as "order not found": fetched once more, FILLED wins, otherwise
 *       (including a failed fetch) CANCELED</li>
 * </ul>
 * Any other exchange failure propagates and leaves the row OPEN for the reconciler.
 */
@Service
public class LimitOrderCanceller {

    private static final Logger log = LoggerFactory.getLogger(LimitOrderCanceller.class);

    private final ExchangeGatewayRegistry gatewayRegistry;
    private final OrderLedgerService orderLedgerService;

    public LimitOrderCanceller(ExchangeGatewayRegistry gatewayRegistry, OrderLedgerService orderLedgerService) {
        this.gatewayRegistry = gatewayRegistry;
        this.orderLedgerService = orderLedgerService;
    }

    /**
     * @return FILLED when the order turned out to be filled, CANCELED otherwise
     * @throws ExchangeException when the exchange rejects the cancel for any reason other than
     *     an unknown order
     * @throws IllegalStateException when the order's exchange has no spot capability
     */
    public LimitOrderStatus cancel(OpenLimitOrder order, String reason) {
        SpotTradingModule spot = gatewayRegistry
                .forExchange(order.getExchange())
                .spot()
                .orElseThrow(() -> new IllegalStateException(
                        "spot trading not supported for exchange " + order.getExchange()));

        ExchangeOrderState cancelState;
        try {
            cancelState = spot.cancelOrder(order.getUserId(), order.getSymbol(), order.getOrderId());
        } catch (ExchangeException e) {
            if (!e.isOrderNotFound()) {
                throw e;
            }
            log.info(
                    "Cancel target not found on exchange, resolving final state: id={}, orderId={}",
                    order.getId(),
                    order.getOrderId());
            return resolveAfterNotFound(spot, order, reason);
        }

        if (cancelState != null && cancelState.isFilled()) {
            return filled(order);
        }

        try {
            ExchangeOrderState finalState = spot.fetchOrder(order.getUserId(), order.getSymbol(), order.getOrderId());
            if (finalState != null && finalState.isFilled()) {
                return filled(order);
            }
        } catch (ExchangeException e) {
            if (!e.isOrderNotFound()) {
                throw e;
            }
        }
        return canceled(order, reason);
    }

    private LimitOrderStatus resolveAfterNotFound(SpotTradingModule spot, OpenLimitOrder order, String reason) {
        try {
            ExchangeOrderState state = spot.fetchOrder(order.getUserId(), order.getSymbol(), order.getOrderId());
            if (state != null && state.isFilled()) {
                return filled(order);
            }
        } catch (ExchangeException e) {
            log.debug("Order lookup after not-found cancel failed: orderId={}, error={}", order.getOrderId(), e.getMessage());
        }
        return canceled(order, reason);
    }

    private LimitOrderStatus filled(OpenLimitOrder order) {
        orderLedgerService.markFilled(order);
        return LimitOrderStatus.FILLED;
    }

    private LimitOrderStatus canceled(OpenLimitOrder order, String reason) {
        orderLedgerService.markCanceledIfOpen(order, reason);
        return LimitOrderStatus.CANCELED;
    }
}
