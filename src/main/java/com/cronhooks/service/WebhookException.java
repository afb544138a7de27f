package com.cronhooks.service;

import java.io.IOException;

/**
 * A webhook call that did not produce a usable response.
 */
public class WebhookException extends IOException {

    public WebhookException(String message) {
        super(message);
    }

    public WebhookException(String message, Throwable cause) {
        super(message, cause);
    }
}
