package com.cronhooks.service;

/**
 * A response that was expected to be JSON could not be parsed.
 */
public class JsonDocumentException extends Exception {

    public JsonDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
