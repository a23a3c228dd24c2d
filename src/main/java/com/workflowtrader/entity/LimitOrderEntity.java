package com.workflowtrader.entity;

import com.workflowtrader.domain.enums.LimitOrderStatus;
import com.workflowtrader.domain.enums.SupportedExchange;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the limit_order table.
 *
 * <p>{@code orderId} is the exchange-assigned id for placed orders, or a synthetic
 * {@code rejected-<uuid>} for orders rejected before reaching the exchange.
 * {@code plannedJson} is a versioned {@code LimitOrderIntent} document.
 */
@Entity
@Table(name = "limit_order")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LimitOrderEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Column(name = "workflow_id", nullable = false)
    private Long workflowId;

    @Column(name = "review_result_id", nullable = false)
    private Long reviewResultId;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private SupportedExchange exchange;

    @Column(length = 30)
    private String symbol;

    @Column(name = "order_id", length = 100, nullable = false)
    private String orderId;

    @Column(name = "planned_json", columnDefinition = "TEXT")
    private String plannedJson;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private LimitOrderStatus status;

    @Column(name = "cancellation_reason", columnDefinition = "TEXT")
    private String cancellationReason;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
