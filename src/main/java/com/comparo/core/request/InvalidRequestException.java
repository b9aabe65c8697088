package com.comparo.core.request;

/**
 * Thrown when a request is malformed and nothing has been dispatched.
 */
public class InvalidRequestException extends ComparisonException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
