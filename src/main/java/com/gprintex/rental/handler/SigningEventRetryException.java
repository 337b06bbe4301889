package com.gprintex.rental.handler;

/**
 * Raised when a queued signing event could not be resolved for a transient reason
 * and should be redelivered.
 */
public class SigningEventRetryException extends RuntimeException {

    public SigningEventRetryException(String message) {
        super(message);
    }
}
