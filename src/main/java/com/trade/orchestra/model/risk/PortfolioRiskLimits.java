package com.trade.orchestra.model.risk;

import com.trade.orchestra.common.exception.ValidationException;
import com.trade.orchestra.enums.LimitAction;
import com.trade.orchestra.enums.LimitScope;
import com.trade.orchestra.enums.LimitUnit;
import com.trade.orchestra.enums.RiskLimitType;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Portfolio-wide thresholds, one per limit type plus per-exchange and per-bot exposure caps.
 * Percentages are expressed in percent of equity (15 = 15%).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioRiskLimits {

    @Positive
    @Builder.Default
    private double maxDrawdownPercent = 15;
    @Positive
    @Builder.Default
    private double maxDailyLossPercent = 5;
    @Positive
    @Builder.Default
    private double maxPositionSizePercent = 10;
    @Positive
    @Builder.Default
    private double maxLeverage = 20;
    @Positive
    @Builder.Default
    private double maxCorrelation = 0.7;
    @Positive
    @Builder.Default
    private double maxExposurePercent = 80;
    @Positive
    @Builder.Default
    private int maxOpenPositions = 20;
    @Positive
    @Builder.Default
    private int maxOrdersPerMinute = 30;
    @Positive
    @Builder.Default
    private double minBalancePercent = 10;
    @Positive
    @Builder.Default
    private double maxExposurePerExchange = 40;
    @Positive
    @Builder.Default
    private double maxExposurePerBot = 25;

    public static PortfolioRiskLimits defaults() {
        return builder().build();
    }

    public PortfolioRiskLimits copy() {
        return toBuilder().build();
    }

    /**
     * Rejects non-positive thresholds; a zero limit would turn every ratio into a division by zero.
     */
    public PortfolioRiskLimits validate() {
        requirePositive("maxDrawdownPercent", maxDrawdownPercent);
        requirePositive("maxDailyLossPercent", maxDailyLossPercent);
        requirePositive("maxPositionSizePercent", maxPositionSizePercent);
        requirePositive("maxLeverage", maxLeverage);
        requirePositive("maxCorrelation", maxCorrelation);
        requirePositive("maxExposurePercent", maxExposurePercent);
        requirePositive("maxOpenPositions", maxOpenPositions);
        requirePositive("maxOrdersPerMinute", maxOrdersPerMinute);
        requirePositive("minBalancePercent", minBalancePercent);
        requirePositive("maxExposurePerExchange", maxExposurePerExchange);
        requirePositive("maxExposurePerBot", maxExposurePerBot);
        return this;
    }

    /**
     * Expand the bundle into typed limit descriptors.
     */
    public List<RiskLimit> asRiskLimits() {
        return List.of(
                RiskLimit.of(RiskLimitType.MAX_DRAWDOWN, maxDrawdownPercent, LimitUnit.PERCENT, LimitScope.PORTFOLIO, LimitAction.BLOCK),
                RiskLimit.of(RiskLimitType.MAX_DAILY_LOSS, maxDailyLossPercent, LimitUnit.PERCENT, LimitScope.PORTFOLIO, LimitAction.BLOCK),
                RiskLimit.of(RiskLimitType.MAX_POSITION_SIZE, maxPositionSizePercent, LimitUnit.PERCENT, LimitScope.SYMBOL, LimitAction.BLOCK),
                RiskLimit.of(RiskLimitType.MAX_LEVERAGE, maxLeverage, LimitUnit.RATIO, LimitScope.PORTFOLIO, LimitAction.BLOCK),
                RiskLimit.of(RiskLimitType.MAX_CORRELATION, maxCorrelation, LimitUnit.RATIO, LimitScope.PORTFOLIO, LimitAction.ALERT),
                RiskLimit.of(RiskLimitType.MAX_EXPOSURE, maxExposurePercent, LimitUnit.PERCENT, LimitScope.PORTFOLIO, LimitAction.BLOCK),
                RiskLimit.of(RiskLimitType.MAX_EXPOSURE, maxExposurePerExchange, LimitUnit.PERCENT, LimitScope.EXCHANGE, LimitAction.BLOCK),
                RiskLimit.of(RiskLimitType.MAX_EXPOSURE, maxExposurePerBot, LimitUnit.PERCENT, LimitScope.BOT, LimitAction.BLOCK),
                RiskLimit.of(RiskLimitType.MAX_OPEN_POSITIONS, maxOpenPositions, LimitUnit.COUNT, LimitScope.PORTFOLIO, LimitAction.BLOCK),
                RiskLimit.of(RiskLimitType.MAX_ORDERS_PER_MINUTE, maxOrdersPerMinute, LimitUnit.COUNT, LimitScope.PORTFOLIO, LimitAction.BLOCK),
                RiskLimit.of(RiskLimitType.MIN_BALANCE, minBalancePercent, LimitUnit.PERCENT, LimitScope.PORTFOLIO, LimitAction.BLOCK)
        );
    }

    private static void requirePositive(String name, double v) {
        if (!(v > 0)) {
            throw new ValidationException("Risk limit " + name + " must be positive, got " + v);
        }
    }
}
