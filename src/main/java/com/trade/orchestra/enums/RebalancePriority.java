package com.trade.orchestra.enums;

/**
 * Declared from most to least urgent so natural ordering sorts urgent actions first.
 */
public enum RebalancePriority {
    HIGH,
    MEDIUM,
    LOW
}
