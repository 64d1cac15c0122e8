package com.trade.orchestra.enums;

public enum RiskLimitType {
    MAX_DRAWDOWN,
    MAX_DAILY_LOSS,
    MAX_POSITION_SIZE,
    MAX_LEVERAGE,
    MAX_CORRELATION,
    MAX_EXPOSURE,
    MAX_OPEN_POSITIONS,
    MAX_ORDERS_PER_MINUTE,
    MIN_BALANCE
}
