package com.trade.orchestra.enums;

public enum LimitUnit {
    PERCENT,
    ABSOLUTE,
    COUNT,
    RATIO
}
