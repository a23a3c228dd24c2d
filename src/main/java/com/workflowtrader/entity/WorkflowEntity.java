package com.workflowtrader.entity;

import com.workflowtrader.domain.enums.MarginMode;
import com.workflowtrader.domain.enums.ReviewInterval;
import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.domain.enums.TradeMode;
import com.workflowtrader.domain.enums.WorkflowStatus;
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
 * JPA entity for the workflow table. Configured tokens live in workflow_token.
 * Rows are never hard-deleted while review results reference them; retirement is a status.
 */
@Entity
@Table(name = "workflow")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkflowEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Column(length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradeMode mode;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private SupportedExchange exchange;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private WorkflowStatus status;

    @Column(name = "cash_token", length = 20)
    private String cashToken;

    @Enumerated(EnumType.STRING)
    @Column(name = "review_interval", columnDefinition = "varchar(10)")
    private ReviewInterval reviewInterval;

    @Column(length = 100)
    private String model;

    @Column(name = "ai_api_key_id")
    private Long aiApiKeyId;

    @Column(name = "exchange_api_key_id")
    private Long exchangeApiKeyId;

    @Column(name = "agent_instructions", columnDefinition = "TEXT")
    private String agentInstructions;

    @Column(name = "manual_rebalance")
    private boolean manualRebalance;

    @Column(name = "futures_default_leverage")
    private Integer futuresDefaultLeverage;

    @Enumerated(EnumType.STRING)
    @Column(name = "futures_margin_mode", columnDefinition = "varchar(10)")
    private MarginMode futuresMarginMode;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
