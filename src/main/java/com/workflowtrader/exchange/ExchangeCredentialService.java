package com.workflowtrader.exchange;

import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.entity.ExchangeApiKeyEntity;
import com.workflowtrader.exception.CredentialException;
import com.workflowtrader.repository.jpa.ExchangeApiKeyJpaRepository;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Resolves the stored exchange API key pair used to sign a user's requests.
 *
 * <p>A user holds at most one key per exchange ({@code exchange_api_key} is unique on
 * user and exchange), so the key checked before a run is the key every request of that run
 * is signed with.
 */
@Service
public class ExchangeCredentialService {

    private final ExchangeApiKeyJpaRepository exchangeApiKeyJpaRepository;

    public ExchangeCredentialService(ExchangeApiKeyJpaRepository exchangeApiKeyJpaRepository) {
        this.exchangeApiKeyJpaRepository = exchangeApiKeyJpaRepository;
    }

    /**
     * @throws CredentialException if the user has no usable key for the exchange
     */
    public ExchangeCredentials resolve(String userId, SupportedExchange exchange) {
        ExchangeApiKeyEntity key = requireKey(userId, exchange);
        return new ExchangeCredentials(key.getApiKey(), key.getApiSecret());
    }

    /**
     * The user's key row for an exchange, with both halves present.
     *
     * @throws CredentialException if the user has no usable key for the exchange
     */
    public ExchangeApiKeyEntity requireKey(String userId, SupportedExchange exchange) {
        ExchangeApiKeyEntity key = exchangeApiKeyJpaRepository
                .findByUserIdAndExchange(userId, exchange)
                .orElseThrow(() -> notConfigured(userId, exchange));
        if (isBlank(key.getApiKey()) || isBlank(key.getApiSecret())) {
            throw new CredentialException(
                    exchange.getDisplayName() + " API key is incomplete",
                    Map.of("userId", String.valueOf(userId), "exchange", exchange.name()));
        }
        return key;
    }

    public static CredentialException notConfigured(String userId, SupportedExchange exchange) {
        return new CredentialException(
                exchange.getDisplayName() + " API key not configured",
                Map.of("userId", String.valueOf(userId), "exchange", exchange.name()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
