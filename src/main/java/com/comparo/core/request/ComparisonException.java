package com.comparo.core.request;

/**
 * Base type for errors reported synchronously by the comparison entry points.
 */
public class ComparisonException extends RuntimeException {

    public ComparisonException(String message) {
        super(message);
    }
}
