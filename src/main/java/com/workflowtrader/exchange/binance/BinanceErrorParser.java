package com.workflowtrader.exchange.binance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workflowtrader.domain.enums.SupportedExchange;
import com.workflowtrader.exception.ExchangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a Binance error response body ({@code {"code":-2010,"msg":"..."}}) into an
 * {@link ExchangeException} whose message is Binance's {@code msg}.
 */
public final class BinanceErrorParser {

    private static final Logger log = LoggerFactory.getLogger(BinanceErrorParser.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private BinanceErrorParser() {}

    public static ExchangeException parse(int httpStatus, String body) {
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = OBJECT_MAPPER.readTree(body);
                if (node.hasNonNull("msg")) {
                    Integer code = node.hasNonNull("code") ? node.get("code").asInt() : null;
                    return new ExchangeException(SupportedExchange.BINANCE, code, node.get("msg").asText());
                }
            } catch (JsonProcessingException e) {
                log.debug("Binance error body is not JSON: {}", body);
            }
        }
        return new ExchangeException(SupportedExchange.BINANCE, null, "Binance request failed with HTTP " + httpStatus);
    }
}
