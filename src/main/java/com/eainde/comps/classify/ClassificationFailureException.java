package com.eainde.comps.classify;

/**
 * The classification call failed on every attempt. Fatal for the request; never cached.
 */
public class ClassificationFailureException extends RuntimeException {

    public ClassificationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
