package com.trade.orchestra.model.portfolio;

/**
 * Statistics over the recorded trade PnL series.
 *
 * @param winRate percent of trades with positive PnL
 */
public record PerformanceMetrics(
        int totalTrades,
        int winningTrades,
        int losingTrades,
        double winRate,
        double avgWin,
        double avgLoss,
        double profitFactor,
        double sharpeRatio,
        double sortinoRatio,
        double calmarRatio,
        double maxDrawdown,
        double maxDrawdownPercent,
        int maxConsecutiveWins,
        int maxConsecutiveLosses,
        double largestWin,
        double largestLoss
) {
}
