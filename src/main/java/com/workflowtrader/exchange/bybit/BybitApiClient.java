package com.workflowtrader.exchange.bybit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflowtrader.config.ExchangeConfig;
import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.exception.ExchangeException;
import com.workflowtrader.exchange.ExchangeCredentialService;
import com.workflowtrader.exchange.ExchangeCredentials;
import com.workflowtrader.exchange.HmacSigner;
import java.util.Map;
import java.util.function.Supplier;
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
 * Low-level Bybit v5 transport.
 *
 * <p>Signed requests carry {@code X-BAPI-API-KEY}, {@code X-BAPI-TIMESTAMP},
 * {@code X-BAPI-RECV-WINDOW} and {@code X-BAPI-SIGN}, where the signature is HMAC-SHA256 over
 * {@code timestamp + apiKey + recvWindow + (queryString | jsonBody)}.
 *
 * <p>Bybit answers most rejections with HTTP 200 and a non-zero {@code retCode}; both that
 * and non-2xx responses become {@link ExchangeException}. The {@code result} node is returned.
 */
@Component
public class BybitApiClient {

    private static final Logger log = LoggerFactory.getLogger(BybitApiClient.class);

    private final RestClient restClient;
    private final ExchangeCredentialService credentialService;
    private final ExchangeConfig exchangeConfig;
    private final ObjectMapper objectMapper;

    public BybitApiClient(
            @Qualifier("bybitRestClient") RestClient restClient,
            ExchangeCredentialService credentialService,
            ExchangeConfig exchangeConfig,
            ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.credentialService = credentialService;
        this.exchangeConfig = exchangeConfig;
        this.objectMapper = objectMapper;
    }

    public JsonNode publicGet(String path, Map<String, String> params) {
        String query = toQuery(params);
        return call(path, () -> restClient.get().uri(path + "?" + query).retrieve().body(JsonNode.class));
    }

    public JsonNode signedGet(String path, String userId, Map<String, String> params) {
        ExchangeCredentials credentials = credentialService.resolve(userId, SupportedExchange.BYBIT);
        String query = toQuery(params);
        String timestamp = String.valueOf(System.currentTimeMillis());
        String recvWindow = String.valueOf(exchangeConfig.getBybit().getRecvWindow());
        String signature = HmacSigner.sign(
                timestamp + credentials.getApiKey() + recvWindow + query, credentials.getApiSecret());
        return call(path, () -> restClient
                .get()
                .uri(path + "?" + query)
                .header("X-BAPI-API-KEY", credentials.getApiKey())
                .header("X-BAPI-TIMESTAMP", timestamp)
                .header("X-BAPI-RECV-WINDOW", recvWindow)
                .header("X-BAPI-SIGN", signature)
                .retrieve()
                .body(JsonNode.class));
    }

    public JsonNode signedPost(String path, String userId, Map<String, Object> body) {
        ExchangeCredentials credentials = credentialService.resolve(userId, SupportedExchange.BYBIT);
        String json = writeBody(body);
        String timestamp = String.valueOf(System.currentTimeMillis());
        String recvWindow = String.valueOf(exchangeConfig.getBybit().getRecvWindow());
        String signature = HmacSigner.sign(
                timestamp + credentials.getApiKey() + recvWindow + json, credentials.getApiSecret());
        return call(path, () -> restClient
                .post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-BAPI-API-KEY", credentials.getApiKey())
                .header("X-BAPI-TIMESTAMP", timestamp)
                .header("X-BAPI-RECV-WINDOW", recvWindow)
                .header("X-BAPI-SIGN", signature)
                .body(json)
                .retrieve()
                .body(JsonNode.class));
    }

    private JsonNode call(String path, Supplier<JsonNode> request) {
        JsonNode response;
        try {
            response = request.get();
        } catch (RestClientResponseException e) {
            log.warn("Bybit request rejected: path={}, status={}", path, e.getStatusCode().value());
            throw new ExchangeException(
                    SupportedExchange.BYBIT, null, "Bybit request failed with HTTP " + e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            log.error("Bybit request failed: path={}: {}", path, e.getMessage());
            throw ExchangeException.unavailable(SupportedExchange.BYBIT, "Bybit unreachable: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ExchangeException(SupportedExchange.BYBIT, null, "Empty response from Bybit");
        }
        int retCode = response.path("retCode").asInt(0);
        if (retCode != 0) {
            String retMsg = response.path("retMsg").asText("Bybit request failed");
            log.warn("Bybit request rejected: path={}, retCode={}, retMsg={}", path, retCode, retMsg);
            throw new ExchangeException(SupportedExchange.BYBIT, retCode, retMsg);
        }
        return response.path("result");
    }

    private String writeBody(Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Bybit request body serialization failed", e);
        }
    }

    private static String toQuery(Map<String, String> params) {
        return params.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("&"));
    }
}
