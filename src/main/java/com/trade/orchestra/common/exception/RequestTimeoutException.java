package com.trade.orchestra.common.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * A request on the bus did not see a correlated reply before its deadline.
 */
@Getter
public class RequestTimeoutException extends BaseOrchestraException {
    private static final String DEFAULT_ERROR_CODE = "ERR-BUS-002";

    private final String topic;
    private final String correlationId;

    public RequestTimeoutException(String topic, String correlationId, Duration timeout) {
        super("Request timeout after " + timeout.toMillis() + " ms on " + topic);
        this.topic = topic;
        this.correlationId = correlationId;
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
