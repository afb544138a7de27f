package com.cronhooks.service;

import com.cronhooks.model.WebhookConfig;
import okhttp3.Call;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Sends one HTTP request per webhook definition and returns the full response body.
 */
public class WebhookExecutor {
    private static final Logger logger = LoggerFactory.getLogger(WebhookExecutor.class);
    private static final MediaType JSON = MediaType.get("application/json");
    private static final String CONTENT_TYPE = "Content-Type";

    private final OkHttpClient httpClient;
    private final Duration defaultTimeout;

    public WebhookExecutor(Duration defaultTimeout, Duration connectTimeout) {
        this(new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                // The per-call timeout below bounds the whole exchange
                .readTimeout(Duration.ZERO)
                .writeTimeout(Duration.ZERO)
                .retryOnConnectionFailure(false)
                .build(), defaultTimeout);
    }

    public WebhookExecutor(OkHttpClient httpClient, Duration defaultTimeout) {
        this.httpClient = httpClient;
        this.defaultTimeout = defaultTimeout;
    }

    public String execute(WebhookConfig webhook) throws WebhookException {
        return execute(webhook, null);
    }

    /**
     * @param parentDeadline optional instant the call must finish by; shortens the timeout when nearer
     * @throws WebhookStatusException    for any status of 400 or above
     * @throws WebhookTransportException when the request could not be completed
     */
    public String execute(WebhookConfig webhook, Instant parentDeadline) throws WebhookException {
        String method = webhook.getMethod() == null || webhook.getMethod().isEmpty()
                ? "GET" : webhook.getMethod().toUpperCase(Locale.ROOT);
        Duration timeout = effectiveTimeout(webhook, parentDeadline);

        Request request = buildRequest(webhook, method);
        logger.info("Executing webhook {} {} (timeout {}s)", method, webhook.getUrl(), timeout.toSeconds());

        Call call = httpClient.newCall(request);
        call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);

        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            String responseText = body != null ? body.string() : "";
            logger.debug("Webhook {} {} answered {} ({} chars)", method, webhook.getUrl(), response.code(), responseText.length());

            if (response.code() >= 400) {
                logger.error("❌ Webhook {} {} returned error status {}: {}", method, webhook.getUrl(), response.code(), responseText);
                throw new WebhookStatusException(response.code(), responseText);
            }

            logger.debug("Response body: {}", responseText);
            return responseText;
        } catch (WebhookStatusException e) {
            throw e;
        } catch (IOException e) {
            logger.error("❌ Failed to execute webhook {} {}: {}", method, webhook.getUrl(), e.getMessage());
            throw new WebhookTransportException("failed to execute webhook: " + e.getMessage(), e);
        }
    }

    private Request buildRequest(WebhookConfig webhook, String method) throws WebhookException {
        Headers.Builder headers = new Headers.Builder();
        if (webhook.getHeaders() != null) {
            for (Map.Entry<String, String> header : webhook.getHeaders().entrySet()) {
                try {
                    headers.set(header.getKey(), header.getValue());
                } catch (IllegalArgumentException e) {
                    throw new WebhookTransportException("invalid header '" + header.getKey() + "': " + e.getMessage(), e);
                }
                logger.debug("Header {}: {}", header.getKey(),
                        "Authorization".equalsIgnoreCase(header.getKey()) ? "***" : header.getValue());
            }
        }

        RequestBody requestBody = null;
        if (webhook.hasBody() && permitsRequestBody(method)) {
            if (headers.get(CONTENT_TYPE) == null) {
                headers.set(CONTENT_TYPE, JSON.toString());
            }
            // The bytes are sent as is; Content-Type comes from the headers only
            requestBody = RequestBody.create(webhook.getBody().getBytes(StandardCharsets.UTF_8), null);
            logger.debug("Request body: {}", webhook.getBody());
        } else if (webhook.hasBody()) {
            logger.warn("Ignoring body for {} request to {}", method, webhook.getUrl());
        } else if (requiresRequestBody(method)) {
            requestBody = RequestBody.create(new byte[0], null);
        }

        if (webhook.getUrl() == null || webhook.getUrl().isEmpty()) {
            throw new WebhookTransportException("failed to create request: no url configured", null);
        }
        try {
            return new Request.Builder()
                    .url(webhook.getUrl())
                    .headers(headers.build())
                    .method(method, requestBody)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new WebhookTransportException("failed to create request: " + e.getMessage(), e);
        }
    }

    private static boolean permitsRequestBody(String method) {
        return !("GET".equals(method) || "HEAD".equals(method));
    }

    private static boolean requiresRequestBody(String method) {
        return "POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method);
    }

    private Duration effectiveTimeout(WebhookConfig webhook, Instant parentDeadline) {
        Duration timeout = webhook.getTimeoutSeconds() > 0
                ? Duration.ofSeconds(webhook.getTimeoutSeconds())
                : defaultTimeout;
        if (parentDeadline != null) {
            Duration remaining = Duration.between(Instant.now(), parentDeadline);
            if (remaining.compareTo(timeout) < 0) {
                timeout = remaining.isNegative() || remaining.isZero() ? Duration.ofMillis(1) : remaining;
            }
        }
        return timeout;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }
}
