package com.netflexity.anomaly.client;

/**
 * Failed call to the query service. Keeps the HTTP status for retry filtering;
 * the status is 0 when the service answered 2xx with an error envelope.
 *
 * @author Netflexity
 * @version 1.0.0
 */
public class QueryServiceException extends RuntimeException {

    private final int statusCode;

    public QueryServiceException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Server errors, throttling and envelope-less failures are worth a retry
     */
    public boolean isRetryable() {
        return statusCode >= 500 || statusCode == 429;
    }
}
