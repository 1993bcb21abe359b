package com.example.voice.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised once retries of a transient datastore failure are exhausted.
 */
public class TransientStoreException extends ServiceException {

    public TransientStoreException(String operation, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "Datastore unavailable during " + operation, "store_unavailable", cause);
    }
}
