package com.trade.orchestra.common.exception;

/**
 * Raised when the bus cannot accept an operation: not connected, broker send failure,
 * or an event that cannot be encoded/decoded.
 */
public class EventBusException extends BaseOrchestraException {
    private static final String DEFAULT_ERROR_CODE = "ERR-BUS-001";

    public EventBusException(String message) {
        super(message);
    }

    public EventBusException(String message, Throwable cause) {
        super(message, cause);
    }

    public static EventBusException notConnected() {
        return new EventBusException("Event bus not connected");
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
