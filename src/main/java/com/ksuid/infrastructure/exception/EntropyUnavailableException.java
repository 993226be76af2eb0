package com.ksuid.infrastructure.exception;

/**
 * The entropy source failed while generating a KSUID through the non-fallible API.
 * Not meant to be caught; a broken entropy source is unrecoverable.
 */
public class EntropyUnavailableException extends IllegalStateException {

    public EntropyUnavailableException(String message) {
        super(message);
    }
}
