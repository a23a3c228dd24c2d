package com.workflowtrader.repository.jpa;

import com.workflowtrader.domain.enums.LimitOrderStatus;
import com.workflowtrader.domain.model.OpenLimitOrder;
import com.workflowtrader.entity.LimitOrderEntity;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the limit_order table.
 *
 * <p>Status changes go through the conditional updates below rather than entity saves, so a
 * terminal row is never moved back by a concurrent writer. Each returns the number of rows
 * changed; 0 means another path already resolved the order.
 */
@Repository
public interface LimitOrderJpaRepository extends JpaRepository<LimitOrderEntity, Long> {

    /** All OPEN orders joined with the status of their owning workflow. */
    @Query("SELECT new com.workflowtrader.domain.model.OpenLimitOrder("
            + "o.id, o.userId, o.workflowId, o.exchange, o.symbol, o.orderId, w.status) "
            + "FROM LimitOrderEntity o, WorkflowEntity w "
            + "WHERE o.workflowId = w.id AND o.status = com.workflowtrader.domain.enums.LimitOrderStatus.OPEN "
            + "ORDER BY o.id")
    List<OpenLimitOrder> findAllOpen();

    @Query("SELECT new com.workflowtrader.domain.model.OpenLimitOrder("
            + "o.id, o.userId, o.workflowId, o.exchange, o.symbol, o.orderId, w.status) "
            + "FROM LimitOrderEntity o, WorkflowEntity w "
            + "WHERE o.workflowId = w.id AND o.workflowId = :workflowId "
            + "AND o.status = com.workflowtrader.domain.enums.LimitOrderStatus.OPEN "
            + "ORDER BY o.id")
    List<OpenLimitOrder> findOpenByWorkflowId(@Param("workflowId") Long workflowId);

    List<LimitOrderEntity> findByReviewResultIdIn(Collection<Long> reviewResultIds);

    /** Moves an order to {@code status} only if it is still {@code expected}. */
    @Modifying
    @Transactional
    @Query("UPDATE LimitOrderEntity o SET o.status = :status, o.cancellationReason = :reason, "
            + "o.updatedAt = :updatedAt WHERE o.id = :id AND o.status = :expected")
    int updateStatusIfCurrent(
            @Param("id") Long id,
            @Param("expected") LimitOrderStatus expected,
            @Param("status") LimitOrderStatus status,
            @Param("reason") String reason,
            @Param("updatedAt") LocalDateTime updatedAt);

    /** Marks an order FILLED unless it already is. A fill observed during cancellation wins over CANCELED. */
    @Modifying
    @Transactional
    @Query("UPDATE LimitOrderEntity o SET o.status = com.workflowtrader.domain.enums.LimitOrderStatus.FILLED, "
            + "o.cancellationReason = NULL, o.updatedAt = :updatedAt "
            + "WHERE o.id = :id AND o.status <> com.workflowtrader.domain.enums.LimitOrderStatus.FILLED")
    int markFilled(@Param("id") Long id, @Param("updatedAt") LocalDateTime updatedAt);
}
