package com.trade.orchestra.model.exchange;

import com.trade.orchestra.enums.ExchangeCode;

import java.util.List;

public record AccountSnapshot(
        ExchangeCode exchange,
        List<BalanceSnapshot> balances,
        double totalEquity,
        double availableBalance,
        double usedMargin,
        double unrealizedPnl,
        Double marginLevel,
        long timestamp
) {
    public AccountSnapshot {
        balances = balances == null ? List.of() : List.copyOf(balances);
    }
}
