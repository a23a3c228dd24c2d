package com.workflowtrader.exchange.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.workflowtrader.config.ExchangeConfig;
import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.exception.ExchangeException;
import com.workflowtrader.exchange.ExchangeCredentialService;
import com.workflowtrader.exchange.ExchangeCredentials;
import com.workflowtrader.exchange.HmacSigner;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Low-level Binance REST transport shared by the Binance modules.
 *
 * <p>Signed requests carry {@code recvWindow}, {@code timestamp} and an HMAC-SHA256
 * {@code signature} over the query string, with the API key in the {@code X-MBX-APIKEY}
 * header. Non-2xx responses are parsed into {@link ExchangeException}; I/O failures become
 * transient {@link ExchangeException}s.
 */
@Component
public class BinanceApiClient {

    private static final Logger log = LoggerFactory.getLogger(BinanceApiClient.class);

    private final RestClient spotRestClient;
    private final RestClient futuresRestClient;
    private final ExchangeCredentialService credentialService;
    private final ExchangeConfig exchangeConfig;

    public BinanceApiClient(
            @Qualifier("binanceSpotRestClient") RestClient spotRestClient,
            @Qualifier("binanceFuturesRestClient") RestClient futuresRestClient,
            ExchangeCredentialService credentialService,
            ExchangeConfig exchangeConfig) {
        this.spotRestClient = spotRestClient;
        this.futuresRestClient = futuresRestClient;
        this.credentialService = credentialService;
        this.exchangeConfig = exchangeConfig;
    }

    public JsonNode publicGet(BinanceApi api, String path, Map<String, String> params) {
        String query = toQuery(params);
        String uri = query.isEmpty() ? path : path + "?" + query;
        return execute(api, HttpMethod.GET, uri, null, path);
    }

    public JsonNode signed(BinanceApi api, HttpMethod method, String path, String userId, Map<String, String> params) {
        ExchangeCredentials credentials = credentialService.resolve(userId, SupportedExchange.BINANCE);

        Map<String, String> signedParams = new LinkedHashMap<>(params);
        signedParams.put("recvWindow", String.valueOf(exchangeConfig.getBinance().getRecvWindow()));
        signedParams.put("timestamp", String.valueOf(System.currentTimeMillis()));
        String query = toQuery(signedParams);
        String signature = HmacSigner.sign(query, credentials.getApiSecret());

        return execute(api, method, path + "?" + query + "&signature=" + signature, credentials.getApiKey(), path);
    }

    private JsonNode execute(BinanceApi api, HttpMethod method, String uri, String apiKey, String path) {
        RestClient client = api == BinanceApi.FUTURES ? futuresRestClient : spotRestClient;
        try {
            RestClient.RequestBodySpec request = client.method(method).uri(uri);
            if (apiKey != null) {
                request.header("X-MBX-APIKEY", apiKey);
            }
            return request.retrieve().body(JsonNode.class);
        } catch (RestClientResponseException e) {
            ExchangeException exchangeException =
                    BinanceErrorParser.parse(e.getStatusCode().value(), e.getResponseBodyAsString());
            log.warn(
                    "Binance request rejected: method={}, path={}, code={}, msg={}",
                    method,
                    path,
                    exchangeException.getExchangeCode(),
                    exchangeException.getMessage());
            throw exchangeException;
        } catch (ResourceAccessException e) {
            log.error("Binance request failed: method={}, path={}: {}", method, path, e.getMessage());
            throw ExchangeException.unavailable(SupportedExchange.BINANCE, "Binance unreachable: " + e.getMessage(), e);
        }
    }

    private static String toQuery(Map<String, String> params) {
        return params.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining("&"));
    }
}
