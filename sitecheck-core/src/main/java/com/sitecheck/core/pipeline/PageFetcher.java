package com.sitecheck.core.pipeline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Downloads the page being audited. HTTP error statuses surface as
 * {@link org.springframework.web.reactive.function.client.WebClientResponseException},
 * DNS and connection failures as
 * {@link org.springframework.web.reactive.function.client.WebClientRequestException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PageFetcher {

    private final WebClient.Builder webClientBuilder;
    private final PipelineProperties properties;

    public FetchedPage fetch(String url) {
        long startTime = System.currentTimeMillis();
        log.debug("Fetching page {}", url);

        ResponseEntity<String> response = webClientBuilder.build()
            .get()
            .uri(url)
            .header(HttpHeaders.USER_AGENT, properties.getUserAgent())
            .accept(MediaType.TEXT_HTML, MediaType.ALL)
            .retrieve()
            .toEntity(String.class)
            .block(properties.getResponseTimeout().plus(properties.getConnectTimeout()));

        if (response == null) {
            throw new AuditPipelineException("Empty response fetching " + url);
        }

        MediaType contentType = response.getHeaders().getContentType();
        long duration = System.currentTimeMillis() - startTime;
        log.info("Fetched {} - status {} in {}ms", url, response.getStatusCode().value(), duration);

        return FetchedPage.builder()
            .url(url)
            .httpStatus(response.getStatusCode().value())
            .contentType(contentType != null ? contentType.toString() : "unknown")
            .body(response.getBody() != null ? response.getBody() : "")
            .fetchMillis(duration)
            .build();
    }
}
