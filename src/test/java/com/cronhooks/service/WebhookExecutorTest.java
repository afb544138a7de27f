package com.cronhooks.service;

import com.cronhooks.model.WebhookConfig;
import com.cronhooks.support.MockWebhookServer;
import com.cronhooks.support.MockWebhookServer.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookExecutorTest {

    private MockWebhookServer server;
    private WebhookExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebhookServer();
        executor = new WebhookExecutor(Duration.ofSeconds(5), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void returnsResponseBodyOnSuccess() throws Exception {
        server.respond("/ok", 200, "{\"status\":\"ok\"}");

        String body = executor.execute(new WebhookConfig(server.url("/ok"), "get"));

        assertThat(body).isEqualTo("{\"status\":\"ok\"}");
        RecordedRequest request = server.requests("/ok").get(0);
        assertThat(request.method).isEqualTo("GET");
        assertThat(request.body).isEmpty();
    }

    @Test
    void missingMethodDefaultsToGet() throws Exception {
        server.respond("/default", 200, "x");

        executor.execute(new WebhookConfig(server.url("/default"), null));

        assertThat(server.requests("/default").get(0).method).isEqualTo("GET");
    }

    @Test
    void sendsBodyWithDefaultJsonContentType() throws Exception {
        WebhookConfig config = new WebhookConfig(server.url("/post"), "POST");
        config.setBody("{\"a\":1}");
        config.getHeaders().put("Authorization", "Bearer secret");

        executor.execute(config);

        RecordedRequest request = server.requests("/post").get(0);
        assertThat(request.body).isEqualTo("{\"a\":1}");
        assertThat(request.header("Content-Type")).isEqualTo("application/json");
        assertThat(request.header("Authorization")).isEqualTo("Bearer secret");
    }

    @Test
    void explicitContentTypeWins() throws Exception {
        WebhookConfig config = new WebhookConfig(server.url("/text"), "PUT");
        config.setBody("plain words");
        config.getHeaders().put("Content-Type", "text/plain");

        executor.execute(config);

        RecordedRequest request = server.requests("/text").get(0);
        assertThat(request.header("Content-Type")).isEqualTo("text/plain");
        assertThat(request.body).isEqualTo("plain words");
    }

    @Test
    void postWithoutBodySendsEmptyEntity() throws Exception {
        executor.execute(new WebhookConfig(server.url("/empty"), "POST"));

        RecordedRequest request = server.requests("/empty").get(0);
        assertThat(request.method).isEqualTo("POST");
        assertThat(request.body).isEmpty();
    }

    @Test
    void getIgnoresConfiguredBody() throws Exception {
        WebhookConfig config = new WebhookConfig(server.url("/get"), "GET");
        config.setBody("{\"ignored\":true}");

        executor.execute(config);

        assertThat(server.requests("/get").get(0).body).isEmpty();
    }

    @Test
    void errorStatusCarriesCodeAndBody() {
        server.respond("/fail", 500, "boom");

        assertThatThrownBy(() -> executor.execute(new WebhookConfig(server.url("/fail"), "GET")))
                .isInstanceOf(WebhookStatusException.class)
                .hasMessage("webhook returned error status 500: boom")
                .satisfies(e -> assertThat(((WebhookStatusException) e).getStatusCode()).isEqualTo(500));
    }

    @Test
    void clientErrorsAlsoFail() {
        server.respond("/missing", 404, "");

        assertThatThrownBy(() -> executor.execute(new WebhookConfig(server.url("/missing"), "GET")))
                .isInstanceOf(WebhookStatusException.class);
    }

    @Test
    void timeoutIsTransportError() {
        server.respondSlowly("/slow", 200, "late", 2000);
        WebhookExecutor impatient = new WebhookExecutor(Duration.ofMillis(300), Duration.ofSeconds(2));

        assertThatThrownBy(() -> impatient.execute(new WebhookConfig(server.url("/slow"), "GET")))
                .isInstanceOf(WebhookTransportException.class)
                .hasMessageStartingWith("failed to execute webhook");
    }

    @Test
    void parentDeadlineShortensTimeout() {
        server.respondSlowly("/slow", 200, "late", 2000);

        assertThatThrownBy(() -> executor.execute(new WebhookConfig(server.url("/slow"), "GET"),
                Instant.now().plusMillis(300)))
                .isInstanceOf(WebhookTransportException.class);
    }

    @Test
    void invalidUrlIsTransportError() {
        assertThatThrownBy(() -> executor.execute(new WebhookConfig("not a url", "GET")))
                .isInstanceOf(WebhookTransportException.class)
                .hasMessageStartingWith("failed to create request");
        assertThatThrownBy(() -> executor.execute(new WebhookConfig(null, "GET")))
                .isInstanceOf(WebhookTransportException.class);
    }

    @Test
    void refusedConnectionIsTransportError() throws Exception {
        String url = server.url("/gone");
        server.close();

        assertThatThrownBy(() -> executor.execute(new WebhookConfig(url, "GET")))
                .isInstanceOf(WebhookTransportException.class);
    }
}
