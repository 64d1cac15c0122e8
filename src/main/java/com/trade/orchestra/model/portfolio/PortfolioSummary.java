package com.trade.orchestra.model.portfolio;

import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.ExchangeCode;

import java.util.Map;

/**
 * Read-only reporting snapshot. Never stored, always rebuilt on demand.
 * Also the payload of {@code risk.portfolio.*} events.
 */
public record PortfolioSummary(
        String id,
        String name,
        double totalEquity,
        double availableBalance,
        double usedMargin,
        double totalPnl,
        double totalPnlPercent,
        double dailyPnl,
        double dailyPnlPercent,
        double weeklyPnl,
        double weeklyPnlPercent,
        double monthlyPnl,
        double monthlyPnlPercent,
        int openPositions,
        double positionValue,
        double longValue,
        double shortValue,
        Map<ExchangeCode, Integer> positionsByExchange,
        Map<BotCode, Integer> positionsByBot,
        double totalExposure,
        double exposurePercent,
        double netExposure,
        double hedgeRatio,
        double avgLeverage,
        double maxLeverage,
        double winRate,
        double profitFactor,
        double sharpeRatio,
        double sortinoRatio,
        double calmarRatio,
        double maxDrawdown,
        double maxDrawdownPercent,
        long updatedAt
) {
}
