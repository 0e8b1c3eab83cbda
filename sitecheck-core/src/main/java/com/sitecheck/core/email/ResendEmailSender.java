package com.sitecheck.core.email;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Sends report emails through the Resend HTTP API.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResendEmailSender implements EmailSender {

    private final EmailProperties properties;
    private final ReportEmailComposer composer;
    private final WebClient.Builder webClientBuilder;

    @Override
    public void sendReportEmail(String toAddress, String targetUrl, UUID auditId, String reportHtml) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            throw new EmailDeliveryException(
                "Email API key is not set. Please set RESEND_API_KEY or sitecheck.email.api-key");
        }
        if (toAddress == null || toAddress.isBlank()) {
            throw new EmailDeliveryException("Customer email is required to send report " + auditId);
        }

        Map<String, Object> request = new HashMap<>();
        request.put("from", composer.from());
        request.put("to", List.of(toAddress));
        request.put("subject", composer.subject(targetUrl));
        request.put("html", composer.body(targetUrl, auditId, reportHtml));
        if (properties.getReplyTo() != null && !properties.getReplyTo().isBlank()) {
            request.put("reply_to", properties.getReplyTo());
        }

        log.info("Sending report email for audit {} to {}", auditId, maskAddress(toAddress));

        try {
            JsonNode response = webClientBuilder.build()
                .post()
                .uri(properties.getBaseUrl() + "/emails")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .bodyValue(request)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(properties.getTimeout());

            String messageId = response != null && response.hasNonNull("id") ? response.get("id").asText() : null;
            if (messageId == null) {
                throw new EmailDeliveryException("Email provider accepted the request without a message id");
            }
            log.info("Report email for audit {} accepted by provider (id: {})", auditId, messageId);
        } catch (WebClientResponseException e) {
            log.error("Email API error for audit {}: Status={}, Response={}",
                auditId, e.getStatusCode(), e.getResponseBodyAsString());
            throw new EmailDeliveryException(
                "Email provider rejected report " + auditId + " with status " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            throw new EmailDeliveryException("Could not reach email provider: " + e.getMessage(), e);
        }
    }

    private String maskAddress(String address) {
        int at = address.indexOf('@');
        return at > 1 ? address.charAt(0) + "***" + address.substring(at) : "***";
    }
}
