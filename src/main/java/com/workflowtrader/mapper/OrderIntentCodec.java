package com.workflowtrader.mapper;

import com.workflowtrader.domain.model.FuturesOrderIntent;
import com.workflowtrader.domain.model.LimitOrderIntent;
import com.workflowtrader.exception.ValidationException;

/**
 * Encodes and decodes the planned-order documents stored on limit_order and futures_order rows.
 *
 * <p>Decoding is strict: the stored version must match the current one and the fields every
 * reader depends on must be present. A row that fails decoding raises
 * {@link ValidationException} instead of yielding a half-populated intent.
 */
public final class OrderIntentCodec {

    private OrderIntentCodec() {}

    public static String encodeLimit(LimitOrderIntent intent) {
        return JsonHelper.toJson(intent);
    }

    public static String encodeFutures(FuturesOrderIntent intent) {
        return JsonHelper.toJson(intent);
    }

    public static LimitOrderIntent decodeLimit(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        LimitOrderIntent intent = JsonHelper.fromJson(json, LimitOrderIntent.class);
        if (intent.getVersion() != LimitOrderIntent.CURRENT_VERSION) {
            throw new ValidationException("Unsupported limit order intent version: " + intent.getVersion());
        }
        if (intent.getPair() == null || intent.getPair().isBlank()) {
            throw new ValidationException("Limit order intent is missing pair");
        }
        return intent;
    }

    public static FuturesOrderIntent decodeFutures(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        FuturesOrderIntent intent = JsonHelper.fromJson(json, FuturesOrderIntent.class);
        if (intent.getVersion() != FuturesOrderIntent.CURRENT_VERSION) {
            throw new ValidationException("Unsupported futures order intent version: " + intent.getVersion());
        }
        if (intent.getAction() == null) {
            throw new ValidationException("Futures order intent is missing action");
        }
        return intent;
    }
}
