package com.sitecheck.core.config;

import com.sitecheck.core.pipeline.PipelineProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient shared by the page fetcher and the email API client.
 *
 * Key configurations:
 * - Buffer large enough for heavy landing pages
 * - Connect/response timeouts so a dead site fails fast instead of eating the tick
 */
@Configuration
public class WebClientConfig {

    // 8MB buffer - some marketing pages inline megabytes of scripts
    private static final int MAX_IN_MEMORY_SIZE = 8 * 1024 * 1024;

    @Bean
    public WebClient.Builder webClientBuilder(PipelineProperties pipelineProperties) {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();

        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .responseTimeout(pipelineProperties.getResponseTimeout())
                .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) pipelineProperties.getConnectTimeout().toMillis());

        return WebClient.builder()
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
