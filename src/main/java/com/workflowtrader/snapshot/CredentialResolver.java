package com.workflowtrader.snapshot;

import com.workflowtrader.domain.model.Workflow;
import com.workflowtrader.entity.AiApiKeyEntity;
import com.workflowtrader.entity.ExchangeApiKeyEntity;
import com.workflowtrader.exception.CredentialException;
import com.workflowtrader.exchange.ExchangeCredentialService;
import com.workflowtrader.repository.jpa.AiApiKeyJpaRepository;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Checks that a workflow has everything a run needs before any exchange call: a model, an AI
 * key owned by the workflow's user, and an exchange key owned by the same user.
 *
 * <p>The exchange key is looked up the same way request signing looks it up, and the
 * workflow's {@code exchangeApiKeyId} must point at that key. A workflow still referencing a
 * replaced key fails here instead of trading with a key the user did not pick for it.
 */
@Service
public class CredentialResolver {

    private final AiApiKeyJpaRepository aiApiKeyJpaRepository;
    private final ExchangeCredentialService exchangeCredentialService;

    public CredentialResolver(
            AiApiKeyJpaRepository aiApiKeyJpaRepository, ExchangeCredentialService exchangeCredentialService) {
        this.aiApiKeyJpaRepository = aiApiKeyJpaRepository;
        this.exchangeCredentialService = exchangeCredentialService;
    }

    /**
     * @throws CredentialException naming the first missing piece
     */
    public AgentCredentials resolve(Workflow workflow) {
        if (workflow.getModel() == null || workflow.getModel().isBlank()) {
            throw missing("Model not configured", workflow);
        }
        if (workflow.getAiApiKeyId() == null) {
            throw missing("AI API key not configured", workflow);
        }
        AiApiKeyEntity aiKey = aiApiKeyJpaRepository
                .findByIdAndUserId(workflow.getAiApiKeyId(), workflow.getUserId())
                .filter(k -> k.getApiKey() != null && !k.getApiKey().isBlank())
                .orElseThrow(() -> missing("AI API key not found", workflow));

        String exchangeKeyMissing = workflow.getExchange().getDisplayName() + " API key not configured";
        if (workflow.getExchangeApiKeyId() == null) {
            throw missing(exchangeKeyMissing, workflow);
        }
        ExchangeApiKeyEntity exchangeKey =
                exchangeCredentialService.requireKey(workflow.getUserId(), workflow.getExchange());
        if (!workflow.getExchangeApiKeyId().equals(exchangeKey.getId())) {
            throw missing(exchangeKeyMissing, workflow);
        }
        return new AgentCredentials(workflow.getModel(), aiKey.getProvider(), aiKey.getApiKey());
    }

    private static CredentialException missing(String message, Workflow workflow) {
        return new CredentialException(
                message, Map.of("workflowId", workflow.getId(), "userId", String.valueOf(workflow.getUserId())));
    }
}
