package com.sitecheck.core.email;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResendEmailSenderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private EmailProperties properties;

    @BeforeEach
    void setUp() {
        properties = new EmailProperties();
        properties.setApiKey("re_test");
        properties.setBaseUrl("https://email.test");
        properties.setSiteUrl("https://app.test");
    }

    @Test
    void postsReportToProviderWithBearerKey() throws Exception {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        UUID auditId = UUID.randomUUID();

        sender(request -> {
            captured.set(request);
            return Mono.just(json(HttpStatus.OK, "{\"id\":\"msg_123\"}"));
        }).sendReportEmail("owner@example.com", "https://www.shop.example/", auditId, "<p>report</p>");

        ClientRequest request = captured.get();
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url()).isEqualTo(URI.create("https://email.test/emails"));
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer re_test");

        JsonNode body = objectMapper.readTree(bodyOf(request));
        assertThat(body.get("to").get(0).asText()).isEqualTo("owner@example.com");
        assertThat(body.get("from").asText()).isEqualTo("SEO CheckSite <contact@seochecksite.net>");
        assertThat(body.get("subject").asText()).isEqualTo("Your SEO CheckSite Report for www.shop.example is Ready!");
        assertThat(body.get("html").asText())
            .contains("<p>report</p>")
            .contains("https://app.test/report/" + auditId);
    }

    @Test
    void providerRejectionBecomesDeliveryException() {
        EmailSender sender = sender(request -> Mono.just(json(HttpStatus.UNPROCESSABLE_ENTITY, "{\"message\":\"bad from\"}")));

        assertThatThrownBy(() -> sender.sendReportEmail("owner@example.com", "https://x.example", UUID.randomUUID(), "<p/>"))
            .isInstanceOf(EmailDeliveryException.class)
            .hasMessageContaining("422");
    }

    @Test
    void missingApiKeyFailsBeforeCallingProvider() {
        properties.setApiKey("");
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        EmailSender sender = sender(request -> {
            captured.set(request);
            return Mono.just(json(HttpStatus.OK, "{\"id\":\"x\"}"));
        });

        assertThatThrownBy(() -> sender.sendReportEmail("owner@example.com", "https://x.example", UUID.randomUUID(), "<p/>"))
            .isInstanceOf(EmailDeliveryException.class)
            .hasMessageContaining("RESEND_API_KEY");
        assertThat(captured.get()).isNull();
    }

    @Test
    void responseWithoutIdIsTreatedAsFailure() {
        EmailSender sender = sender(request -> Mono.just(json(HttpStatus.OK, "{}")));

        assertThatThrownBy(() -> sender.sendReportEmail("owner@example.com", "https://x.example", UUID.randomUUID(), "<p/>"))
            .isInstanceOf(EmailDeliveryException.class);
    }

    private EmailSender sender(ExchangeFunction exchange) {
        return new ResendEmailSender(properties, new ReportEmailComposer(properties),
            WebClient.builder().exchangeFunction(exchange));
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }

    private static String bodyOf(ClientRequest request) {
        MockClientHttpRequest target = new MockClientHttpRequest(request.method(), request.url());
        request.body().insert(target, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return target.getBodyAsString().block();
    }
}
