package com.workflowtrader.agent;

import java.util.List;
import java.util.Map;

/**
 * Strict JSON schemas of the two decision shapes. The answer is wrapped in {@code result},
 * which is either the decision or {@code {"error": "..."}}.
 */
public final class DecisionSchemas {

    public static final String SPOT_INSTRUCTIONS = String.join(
            "\n",
            "Primary Goal: Grow total portfolio value in the cash token by rebalancing between the configured tokens.",
            "- Respect each token's minimum allocation.",
            "- Only trade the listed routes; quantity is denominated in the order's token.",
            "- Set maxPriceDivergencePct (a ratio, 0.01 = 1%) with basePrice when the price you reason about matters.",
            "- Return a short report (at most 255 chars) and an orders array, empty when no trade is needed.",
            "- On irrecoverable error, return an error message instead.");

    public static final String FUTURES_INSTRUCTIONS = String.join(
            "\n",
            "Primary Goal: Grow total account value by managing perpetual futures exposure while protecting margin.",
            "- Evaluate wallet balance and existing exposure before proposing trades.",
            "- Specify stop loss and take profit for new or scaled positions when conditions permit.",
            "- Use reduce-only CLOSE actions when trimming exposure.",
            "- Return a short report (at most 255 chars), a strategy name and an actions array, empty when no trade.",
            "- On irrecoverable error, return an error message instead.");

    private DecisionSchemas() {}

    public static Map<String, Object> spot() {
        Map<String, Object> order = object(
                Map.of(
                        "pair", type("string"),
                        "token", type("string"),
                        "side", Map.of("type", "string", "enum", List.of("BUY", "SELL")),
                        "quantity", type("number"),
                        "limitPrice", nullable("number"),
                        "basePrice", nullable("number"),
                        "maxPriceDivergencePct", nullable("number")),
                List.of("pair", "token", "side", "quantity", "limitPrice", "basePrice", "maxPriceDivergencePct"));
        Map<String, Object> decision = object(
                Map.of(
                        "orders", Map.of("type", "array", "items", order),
                        "shortReport", type("string")),
                List.of("orders", "shortReport"));
        return wrap(decision);
    }

    public static Map<String, Object> futures() {
        Map<String, Object> action = object(
                Map.of(
                        "symbol", type("string"),
                        "positionSide", Map.of("type", "string", "enum", List.of("LONG", "SHORT")),
                        "action", Map.of("type", "string", "enum", List.of("OPEN", "CLOSE", "SCALE", "HOLD")),
                        "type", Map.of("type", "string", "enum", List.of("MARKET", "LIMIT")),
                        "quantity", type("number"),
                        "price", nullable("number"),
                        "reduceOnly", nullable("boolean"),
                        "leverage", nullable("number"),
                        "stopLoss", nullable("number"),
                        "takeProfit", nullable("number")),
                List.of(
                        "symbol", "positionSide", "action", "type", "quantity", "price", "reduceOnly", "leverage",
                        "stopLoss", "takeProfit"));
        Map<String, Object> decision = object(
                Map.of(
                        "actions", Map.of("type", "array", "items", action),
                        "shortReport", type("string"),
                        "strategyName", type("string")),
                List.of("actions", "shortReport", "strategyName"));
        return wrap(decision);
    }

    private static Map<String, Object> wrap(Map<String, Object> decision) {
        Map<String, Object> error = object(Map.of("error", type("string")), List.of("error"));
        return object(Map.of("result", Map.of("anyOf", List.of(decision, error))), List.of("result"));
    }

    private static Map<String, Object> object(Map<String, Object> properties, List<String> required) {
        return Map.of(
                "type", "object",
                "properties", properties,
                "required", required,
                "additionalProperties", false);
    }

    private static Map<String, Object> type(String type) {
        return Map.of("type", type);
    }

    private static Map<String, Object> nullable(String type) {
        return Map.of("type", List.of(type, "null"));
    }
}
