package com.trade.orchestra.enums;

public enum SignalDirection {
    LONG,
    SHORT,
    EXIT_LONG,
    EXIT_SHORT,
    CLOSE_ALL
}
