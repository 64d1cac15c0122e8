package com.trade.orchestra.enums;

public enum BotCategory {
    OPERATIONAL,
    INSTITUTIONAL,
    FREQUENCY,
    INTEGRATION,
    ANALYTICS
}
