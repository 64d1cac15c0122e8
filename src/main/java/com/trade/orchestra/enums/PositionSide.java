package com.trade.orchestra.enums;

public enum PositionSide {
    LONG,
    SHORT
}
