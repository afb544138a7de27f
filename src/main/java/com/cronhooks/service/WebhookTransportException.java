package com.cronhooks.service;

/**
 * The request never completed: DNS failure, refused connection, timeout or an unreadable response.
 */
public class WebhookTransportException extends WebhookException {

    public WebhookTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
