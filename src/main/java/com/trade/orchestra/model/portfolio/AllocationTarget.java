package com.trade.orchestra.model.portfolio;

/**
 * Desired share of equity for one asset. All values in percent.
 *
 * @param tolerancePercent   deviation beyond which a rebalance becomes HIGH priority
 * @param rebalanceThreshold deviation beyond which a rebalance is proposed at all
 */
public record AllocationTarget(String asset, double targetPercent, double tolerancePercent, double rebalanceThreshold) {
}
