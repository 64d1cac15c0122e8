package com.trade.orchestra.dto;

import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.BotStatus;

import java.util.List;

public record BotStatePayload(
        BotCode code,
        String name,
        BotStatus status,
        boolean enabled,
        boolean tradingEnabled,
        boolean paperTrading,
        List<String> symbols,
        List<String> exchanges,
        int positions,
        double dailyPnl,
        int dailyTrades,
        int errorCount,
        String lastError,
        Long startedAt
) {
}
