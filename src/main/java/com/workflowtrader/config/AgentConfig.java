package com.workflowtrader.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Decision model client settings. Binds to {@code workflowtrader.agent.*}.
 *
 * <p>Model calls are long-running compared to exchange calls, hence the separate, larger
 * read timeout.
 */
@Configuration
@ConfigurationProperties(prefix = "workflowtrader.agent")
@Getter
@Setter
public class AgentConfig {

    private String openAiUrl = "https://api.openai.com";

    private int connectTimeout = 10000;

    private int readTimeout = 180000;

    /** Name given to the structured output format. */
    private String schemaName = "rebalance_response";

    @Bean
    public RestClient openAiRestClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return RestClient.builder()
                .baseUrl(openAiUrl)
                .requestFactory(requestFactory)
                .build();
    }
}
