package com.comparo.core.request;

/**
 * Thrown when an aggregation is started for a request id that is already tracked.
 */
public class DuplicateRequestException extends ComparisonException {

    private final String requestId;

    public DuplicateRequestException(String requestId) {
        super("Request " + requestId + " is already being aggregated");
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
