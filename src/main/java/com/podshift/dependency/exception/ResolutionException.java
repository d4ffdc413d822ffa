package com.podshift.dependency.exception;

/**
 * A pipeline stage failed for reasons unrelated to the input data.
 */
public class ResolutionException extends RuntimeException {

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
