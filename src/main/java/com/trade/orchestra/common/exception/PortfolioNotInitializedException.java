package com.trade.orchestra.common.exception;

/**
 * Thrown when a risk or portfolio operation is invoked before {@code initialize}.
 */
public class PortfolioNotInitializedException extends BaseOrchestraException {
    private static final String DEFAULT_ERROR_CODE = "ERR-CFG-001";

    public PortfolioNotInitializedException(String portfolioId) {
        super("Portfolio '" + portfolioId + "' is not initialized");
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
