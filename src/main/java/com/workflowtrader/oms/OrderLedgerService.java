package com.workflowtrader.oms;

import com.workflowtrader.domain.enums.LimitOrderStatus;
import com.workflowtrader.domain.model.FuturesOrder;
import com.workflowtrader.domain.model.LimitOrder;
import com.workflowtrader.domain.model.OpenLimitOrder;
import com.workflowtrader.entity.FuturesOrderEntity;
import com.workflowtrader.entity.LimitOrderEntity;
import com.workflowtrader.event.FuturesOrderEvent;
import com.workflowtrader.event.LimitOrderEvent;
import com.workflowtrader.mapper.FuturesOrderMapper;
import com.workflowtrader.mapper.LimitOrderMapper;
import com.workflowtrader.repository.jpa.FuturesOrderJpaRepository;
import com.workflowtrader.repository.jpa.LimitOrderJpaRepository;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * The local order ledger: the single source of truth for spot and futures order state.
 *
 * <p>Rows are inserted once. Limit order status changes only go through
 * {@link #markCanceledIfOpen} and {@link #markFilled}, both conditional updates, so terminal
 * states are never reverted except for a fill that races a cancellation.
 */
@Service
public class OrderLedgerService {

    private static final Logger log = LoggerFactory.getLogger(OrderLedgerService.class);

    private final LimitOrderJpaRepository limitOrderJpaRepository;
    private final FuturesOrderJpaRepository futuresOrderJpaRepository;
    private final LimitOrderMapper limitOrderMapper;
    private final FuturesOrderMapper futuresOrderMapper;
    private final ApplicationEventPublisher eventPublisher;

    public OrderLedgerService(
            LimitOrderJpaRepository limitOrderJpaRepository,
            FuturesOrderJpaRepository futuresOrderJpaRepository,
            LimitOrderMapper limitOrderMapper,
            FuturesOrderMapper futuresOrderMapper,
            ApplicationEventPublisher eventPublisher) {
        this.limitOrderJpaRepository = limitOrderJpaRepository;
        this.futuresOrderJpaRepository = futuresOrderJpaRepository;
        this.limitOrderMapper = limitOrderMapper;
        this.futuresOrderMapper = futuresOrderMapper;
        this.eventPublisher = eventPublisher;
    }

    // ---- Limit orders ----

    public LimitOrder recordLimitOrder(LimitOrder order) {
        LocalDateTime now = LocalDateTime.now();
        order.setCreatedAt(now);
        order.setUpdatedAt(now);
        LimitOrderEntity saved = limitOrderJpaRepository.save(limitOrderMapper.toEntity(order));
        order.setId(saved.getId());
        eventPublisher.publishEvent(new LimitOrderEvent(
                this, saved.getId(), order.getWorkflowId(), order.getStatus(), null, order.getCancellationReason()));
        return order;
    }

    public List<OpenLimitOrder> findAllOpen() {
        return limitOrderJpaRepository.findAllOpen();
    }

    public List<OpenLimitOrder> findOpenForWorkflow(Long workflowId) {
        return limitOrderJpaRepository.findOpenByWorkflowId(workflowId);
    }

    public List<LimitOrder> findLimitOrdersForResults(Collection<Long> reviewResultIds) {
        if (reviewResultIds.isEmpty()) {
            return List.of();
        }
        return limitOrderMapper.toDomainList(limitOrderJpaRepository.findByReviewResultIdIn(reviewResultIds));
    }

    /**
     * Moves an OPEN order to CANCELED.
     *
     * @return true if this call changed the row, false if it was no longer OPEN
     */
    public boolean markCanceledIfOpen(OpenLimitOrder order, String reason) {
        int updated = limitOrderJpaRepository.updateStatusIfCurrent(
                order.getId(), LimitOrderStatus.OPEN, LimitOrderStatus.CANCELED, reason, LocalDateTime.now());
        if (updated == 0) {
            log.debug("Limit order already resolved, cancel skipped: id={}, orderId={}", order.getId(), order.getOrderId());
            return false;
        }
        log.info("Limit order canceled: id={}, orderId={}, reason={}", order.getId(), order.getOrderId(), reason);
        eventPublisher.publishEvent(new LimitOrderEvent(
                this, order.getId(), order.getWorkflowId(), LimitOrderStatus.CANCELED, LimitOrderStatus.OPEN, reason));
        return true;
    }

    /**
     * Marks an order FILLED from OPEN or CANCELED.
     *
     * @return true if this call changed the row
     */
    public boolean markFilled(OpenLimitOrder order) {
        int updated = limitOrderJpaRepository.markFilled(order.getId(), LocalDateTime.now());
        if (updated == 0) {
            return false;
        }
        log.info("Limit order filled: id={}, orderId={}, symbol={}", order.getId(), order.getOrderId(), order.getSymbol());
        eventPublisher.publishEvent(new LimitOrderEvent(
                this, order.getId(), order.getWorkflowId(), LimitOrderStatus.FILLED, null, null));
        return true;
    }

    // ---- Futures orders ----

    public FuturesOrder recordFuturesOrder(FuturesOrder order) {
        order.setCreatedAt(LocalDateTime.now());
        FuturesOrderEntity saved = futuresOrderJpaRepository.save(futuresOrderMapper.toEntity(order));
        order.setId(saved.getId());
        eventPublisher.publishEvent(new FuturesOrderEvent(this, saved.getId(), order.getSymbol(), order.getStatus()));
        return order;
    }

    public List<FuturesOrder> findFuturesOrdersForResults(Collection<Long> reviewResultIds) {
        if (reviewResultIds.isEmpty()) {
            return List.of();
        }
        return futuresOrderMapper.toDomainList(futuresOrderJpaRepository.findByReviewResultIdIn(reviewResultIds));
    }
}
