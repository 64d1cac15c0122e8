package com.trade.orchestra.enums;

public enum LimitScope {
    PORTFOLIO,
    BOT,
    SYMBOL,
    EXCHANGE
}
