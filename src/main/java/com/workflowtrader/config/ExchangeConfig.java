package com.workflowtrader.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configuration properties and REST clients for the exchange adapters.
 *
 * <p>Binds to the {@code workflowtrader.exchange.*} prefix. Provides one {@link RestClient} per
 * exchange API host:
 * <ul>
 *   <li>{@code binanceSpotRestClient}: Binance spot REST (api.binance.com)</li>
 *   <li>{@code binanceFuturesRestClient}: Binance USD-M futures REST (fapi.binance.com)</li>
 *   <li>{@code bybitRestClient}: Bybit v5 unified REST (api.bybit.com)</li>
 * </ul>
 *
 * <p>Rate limiting and circuit breaking are applied on the adapter methods via Resilience4j
 * annotations; see application.yml for the instance settings.
 */
@Configuration
@ConfigurationProperties(prefix = "workflowtrader.exchange")
@Getter
@Setter
public class ExchangeConfig {

    /** HTTP connect timeout in milliseconds for all exchange calls. */
    private int connectTimeout = 5000;

    /** HTTP read timeout in milliseconds for all exchange calls. */
    private int readTimeout = 15000;

    private Binance binance = new Binance();

    private Bybit bybit = new Bybit();

    @Bean
    public RestClient binanceSpotRestClient() {
        return buildClient(binance.getSpotUrl());
    }

    @Bean
    public RestClient binanceFuturesRestClient() {
        return buildClient(binance.getFuturesUrl());
    }

    @Bean
    public RestClient bybitRestClient() {
        return buildClient(bybit.getUrl());
    }

    private RestClient buildClient(String baseUrl) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
    }

    @Getter
    @Setter
    public static class Binance {

        private String spotUrl = "https://api.binance.com";

        private String futuresUrl = "https://fapi.binance.com";

        /** recvWindow sent with signed requests, in milliseconds. */
        private long recvWindow = 5000;
    }

    @Getter
    @Setter
    public static class Bybit {

        private String url = "https://api.bybit.com";

        private long recvWindow = 5000;
    }
}
