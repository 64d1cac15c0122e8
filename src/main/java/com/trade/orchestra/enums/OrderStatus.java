package com.trade.orchestra.enums;

public enum OrderStatus {
    PENDING,
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    EXPIRED
}
