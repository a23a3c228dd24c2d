package com.workflowtrader.exception;

import com.workflowtrader.domain.enums.SupportedExchange;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Wraps an exchange rejection or an exchange transport failure.
 *
 * <p>Rejections carry the exchange's numeric error code and its message, parsed from the
 * response body. The message of this exception is the exchange message alone, so that it
 * can be stored verbatim as an order's cancellation or failure reason.
 *
 * <p>Transport failures (connect/read timeouts, 5xx without a body) use
 * {@link ErrorCode#EXCHANGE_UNAVAILABLE} and have no exchange code.
 */
@Getter
public class ExchangeException extends BaseException {

    private final SupportedExchange exchange;
    private final Integer exchangeCode;

    public ExchangeException(SupportedExchange exchange, Integer exchangeCode, String message) {
        super(ErrorCode.EXCHANGE_ERROR, message, details(exchange, exchangeCode));
        this.exchange = exchange;
        this.exchangeCode = exchangeCode;
    }

    private ExchangeException(SupportedExchange exchange, String message, Throwable cause) {
        super(ErrorCode.EXCHANGE_UNAVAILABLE, message, cause);
        this.exchange = exchange;
        this.exchangeCode = null;
    }

    public static ExchangeException unavailable(SupportedExchange exchange, String message, Throwable cause) {
        return new ExchangeException(exchange, message, cause);
    }

    /** True when the exchange reported that the referenced order does not exist. */
    public boolean isOrderNotFound() {
        return exchange != null && exchangeCode != null && exchangeCode == exchange.getOrderNotFoundCode();
    }

    public boolean isTransient() {
        return getErrorCode() == ErrorCode.EXCHANGE_UNAVAILABLE;
    }

    private static Map<String, Object> details(SupportedExchange exchange, Integer exchangeCode) {
        Map<String, Object> details = new HashMap<>();
        details.put("exchange", exchange != null ? exchange.name() : null);
        details.put("exchangeCode", exchangeCode);
        return details;
    }
}
