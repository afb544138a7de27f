package com.cronhooks.repository;

/**
 * The repository could not durably save its state.
 */
public class PersistenceException extends Exception {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
