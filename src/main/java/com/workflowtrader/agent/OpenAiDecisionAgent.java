package com.workflowtrader.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflowtrader.config.AgentConfig;
import com.workflowtrader.exception.DecisionAgentException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * {@link DecisionAgent} backed by the OpenAI Responses API with a strict {@code json_schema}
 * output format.
 *
 * <p>The assistant message text is parsed as JSON, the {@code result} node is bound to the
 * requested decision type and bean-validated. Anything that does not survive those steps is
 * "no decision"; the text is never interpreted heuristically.
 */
@Component
public class OpenAiDecisionAgent implements DecisionAgent {

    private static final Logger log = LoggerFactory.getLogger(OpenAiDecisionAgent.class);

    private static final String RESPONSES_PATH = "/v1/responses";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final AgentConfig agentConfig;

    public OpenAiDecisionAgent(
            @Qualifier("openAiRestClient") RestClient restClient,
            ObjectMapper objectMapper,
            Validator validator,
            AgentConfig agentConfig) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.agentConfig = agentConfig;
    }

    @Override
    public <T extends TradingDecision> AgentResponse<T> decide(AgentRequest<T> request) {
        String body = requestBody(request);
        String raw;
        try {
            raw = restClient
                    .post()
                    .uri(RESPONSES_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("Authorization", "Bearer " + request.getApiKey())
                    .body(body)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            log.warn("Decision model rejected request: model={}, status={}", request.getModel(), e.getStatusCode().value());
            throw new DecisionAgentException(
                    "AI request failed: " + e.getStatusCode().value() + " " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new DecisionAgentException("AI request failed: " + e.getMessage(), e);
        }
        if (raw == null || raw.isBlank()) {
            throw new DecisionAgentException("AI request failed: empty response");
        }
        return interpret(request, body, raw);
    }

    <T extends TradingDecision> AgentResponse<T> interpret(AgentRequest<T> request, String prompt, String raw) {
        JsonNode result;
        try {
            String text = assistantText(objectMapper.readTree(raw));
            if (text == null) {
                return rejected(prompt, raw, "response has no assistant text");
            }
            result = objectMapper.readTree(text).path("result");
        } catch (JsonProcessingException e) {
            return rejected(prompt, raw, "response is not valid JSON");
        }

        if (result.isMissingNode() || !result.isObject()) {
            return rejected(prompt, raw, "response has no result");
        }
        if (result.has("error")) {
            return rejected(prompt, raw, "model returned error: " + result.path("error").asText());
        }

        T decision;
        try {
            decision = objectMapper.treeToValue(result, request.getDecisionType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return rejected(prompt, raw, "result does not match decision shape: " + e.getMessage());
        }

        Set<ConstraintViolation<T>> violations = validator.validate(decision);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            return rejected(prompt, raw, "decision failed validation: " + message);
        }
        return new AgentResponse<>(prompt, raw, decision, null);
    }

    private String requestBody(AgentRequest<?> request) {
        Map<String, Object> format = new LinkedHashMap<>();
        format.put("type", "json_schema");
        format.put("name", agentConfig.getSchemaName());
        format.put("strict", true);
        format.put("schema", request.getSchema());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.getModel());
        body.put("instructions", request.getInstructions());
        try {
            body.put("input", objectMapper.writeValueAsString(request.getPayload()));
            body.put("text", Map.of("format", format));
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Decision request serialization failed", e);
        }
    }

    /** Text of the first assistant message in a Responses API body. */
    private static String assistantText(JsonNode response) {
        for (JsonNode item : response.path("output")) {
            boolean message = "message".equals(item.path("type").asText())
                    || item.path("id").asText("").startsWith("msg_");
            if (!message) {
                continue;
            }
            for (JsonNode content : item.path("content")) {
                if (content.path("text").isTextual()) {
                    return content.path("text").asText();
                }
            }
        }
        return null;
    }

    private static <T extends TradingDecision> AgentResponse<T> rejected(String prompt, String raw, String reason) {
        log.warn("Decision model returned no usable decision: {}", reason);
        return new AgentResponse<>(prompt, raw, null, reason);
    }
}
