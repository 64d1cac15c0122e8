package com.trade.orchestra.common.exception;

import lombok.Getter;

/**
 * Base exception for the coordination core.
 * Every failure carries an error code so callers can branch without parsing messages.
 */
@Getter
public abstract class BaseOrchestraException extends RuntimeException {

    private final String errorCode;

    protected BaseOrchestraException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseOrchestraException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected BaseOrchestraException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
