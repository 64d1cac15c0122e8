package com.trade.orchestra.enums;

/**
 * What the platform is expected to do once a limit is crossed.
 */
public enum LimitAction {
    ALERT,
    BLOCK,
    REDUCE,
    CLOSE_ALL
}
