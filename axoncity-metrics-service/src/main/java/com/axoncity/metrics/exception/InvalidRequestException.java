package com.axoncity.metrics.exception;

/**
 * A request body that parsed but cannot be analyzed, such as a comparison missing one side.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
