package com.trade.orchestra.enums;

public enum PositionStatus {
    OPEN,
    CLOSED,
    LIQUIDATED
}
