package com.cronhooks.service;

/**
 * The endpoint answered with a status of 400 or above.
 */
public class WebhookStatusException extends WebhookException {
    private final int statusCode;
    private final String responseBody;

    public WebhookStatusException(int statusCode, String responseBody) {
        super("webhook returned error status " + statusCode + ": " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() { return statusCode; }
    public String getResponseBody() { return responseBody; }
}
