package com.trade.orchestra.enums;

public enum OrderSide {
    BUY,
    SELL
}
