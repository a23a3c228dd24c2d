package com.workflowtrader.repository.jpa;

import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.entity.ExchangeApiKeyEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ExchangeApiKeyJpaRepository extends JpaRepository<ExchangeApiKeyEntity, Long> {

    Optional<ExchangeApiKeyEntity> findByUserIdAndExchange(String userId, SupportedExchange exchange);
}
