package com.trade.orchestra.model.exchange;

import com.trade.orchestra.enums.ExchangeCode;

/**
 * Per-asset balance as reported by an exchange collaborator.
 *
 * @param usdValue USD valuation of {@code total}; absent for assets the exchange does not price
 */
public record BalanceSnapshot(
        String asset,
        ExchangeCode exchange,
        double free,
        double locked,
        double total,
        Double usdValue
) {
}
