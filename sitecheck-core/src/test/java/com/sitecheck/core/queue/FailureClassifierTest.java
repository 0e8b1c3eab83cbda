package com.sitecheck.core.queue;

import com.sitecheck.core.email.EmailDeliveryException;
import com.sitecheck.core.pipeline.AuditPipelineException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class FailureClassifierTest {

    private final FailureClassifier classifier = new FailureClassifier();

    @Test
    void clientErrorsFromTheSiteArePermanent() {
        assertThat(classifier.classify(status(401))).isEqualTo(FailureClassifier.Kind.PERMANENT);
        assertThat(classifier.classify(status(403))).isEqualTo(FailureClassifier.Kind.PERMANENT);
        assertThat(classifier.classify(status(404))).isEqualTo(FailureClassifier.Kind.PERMANENT);
    }

    @Test
    void otherStatusesAreTransient() {
        assertThat(classifier.classify(status(500))).isEqualTo(FailureClassifier.Kind.TRANSIENT);
        assertThat(classifier.classify(status(429))).isEqualTo(FailureClassifier.Kind.TRANSIENT);
    }

    @Test
    void dnsAndRefusedConnectionsArePermanentEvenWhenWrapped() {
        WebClientRequestException dns = new WebClientRequestException(
            new UnknownHostException("shop.invalid"), HttpMethod.GET, URI.create("https://shop.invalid"), HttpHeaders.EMPTY);
        AuditPipelineException refused = new AuditPipelineException("fetch failed",
            new RuntimeException(new ConnectException("Connection refused")));

        assertThat(classifier.isPermanent(dns)).isTrue();
        assertThat(classifier.isPermanent(refused)).isTrue();
    }

    @Test
    void timeoutsAreTransient() {
        assertThat(classifier.isPermanent(new AuditPipelineException("slow", new TimeoutException()))).isFalse();
    }

    @Test
    void emailProviderErrorsAreNeverPermanent() {
        EmailDeliveryException rejected = new EmailDeliveryException("Email provider rejected report", status(401));

        assertThat(classifier.isPermanent(rejected)).isFalse();
    }

    private static WebClientResponseException status(int code) {
        return WebClientResponseException.create(code, "status " + code, HttpHeaders.EMPTY, new byte[0], null);
    }
}
