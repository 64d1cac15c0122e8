package com.trade.orchestra.common.exception;

/**
 * Exception for malformed input: topics, subscription patterns, limit values.
 */
public class ValidationException extends BaseOrchestraException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-001";

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String errorCode, String message) {
        super(errorCode, message, null);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
