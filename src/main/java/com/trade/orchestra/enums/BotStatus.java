package com.trade.orchestra.enums;

public enum BotStatus {
    STARTING,
    RUNNING,
    PAUSED,
    STOPPING,
    STOPPED,
    ERROR
}
