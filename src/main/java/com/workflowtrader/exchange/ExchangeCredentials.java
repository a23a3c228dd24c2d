package com.workflowtrader.exchange;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public class ExchangeCredentials {

    private final String apiKey;
    private final String apiSecret;

    @Override
    public String toString() {
        return "ExchangeCredentials[apiKey=" + mask(apiKey) + "]";
    }

    private static String mask(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }
}
