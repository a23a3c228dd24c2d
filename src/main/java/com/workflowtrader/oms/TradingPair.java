package com.workflowtrader.oms;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A base/quote pair resolved from a free-form pair string such as "BTCUSDT", "BTC/USDT"
 * or "btc-usdt".
 *
 * <p>Splitting matches against the known token list, longest symbol first, so that
 * "PEPEUSDT" never resolves through a shorter prefix.
 */
public record TradingPair(String base, String quote) {

    public static final List<String> KNOWN_TOKENS = List.of(
            "BTC", "BNB", "DOGE", "ETH", "HBAR", "PEPE", "SHIB", "SOL", "TON", "TRX", "XRP", "USDT", "USDC");

    private static final List<String> BY_LENGTH = KNOWN_TOKENS.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();

    public static Optional<TradingPair> parse(String pair) {
        if (pair == null) {
            return Optional.empty();
        }
        String normalized = pair.replaceAll("[^A-Za-z0-9]", "").toUpperCase(Locale.ROOT);
        for (String base : BY_LENGTH) {
            if (normalized.startsWith(base)) {
                String quote = normalized.substring(base.length());
                if (!quote.equals(base) && KNOWN_TOKENS.contains(quote)) {
                    return Optional.of(new TradingPair(base, quote));
                }
            }
        }
        return Optional.empty();
    }

    public String symbol() {
        return base + quote;
    }

    public boolean contains(String token) {
        return base.equalsIgnoreCase(token) || quote.equalsIgnoreCase(token);
    }
}
