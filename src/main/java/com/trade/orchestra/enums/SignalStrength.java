package com.trade.orchestra.enums;

public enum SignalStrength {
    WEAK,
    MODERATE,
    STRONG,
    EXTREME
}
