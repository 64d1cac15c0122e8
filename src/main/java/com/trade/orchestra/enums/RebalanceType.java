package com.trade.orchestra.enums;

public enum RebalanceType {
    BUY,
    SELL,
    TRANSFER
}
