package com.workflowtrader.entity;

import com.workflowtrader.domain.enums.SupportedExchange;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(
        name = "exchange_api_key",
        uniqueConstraints = @UniqueConstraint(name = "uk_exchange_api_key_user_exchange", columnNames = {"user_id", "exchange"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExchangeApiKeyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "exchange", columnDefinition = "varchar(20)", nullable = false)
    private SupportedExchange exchange;

    @Column(name = "api_key", columnDefinition = "TEXT")
    private String apiKey;

    @Column(name = "api_secret", columnDefinition = "TEXT")
    private String apiSecret;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
