package com.workflowtrader.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
 * JPA entity for the review_result table. One row per review run, written once and never
 * updated. {@code log} holds the validated decision as JSON when there was one.
 */
@Entity
@Table(name = "review_result")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReviewResultEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "workflow_id", nullable = false)
    private Long workflowId;

    private boolean rebalance;

    @Column(name = "short_report", columnDefinition = "TEXT")
    private String shortReport;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(columnDefinition = "TEXT")
    private String log;

    @Column(name = "raw_log_id")
    private Long rawLogId;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
