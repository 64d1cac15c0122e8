package com.trade.orchestra.model.risk;

import com.trade.orchestra.enums.LimitAction;
import com.trade.orchestra.enums.LimitScope;
import com.trade.orchestra.enums.LimitUnit;
import com.trade.orchestra.enums.RiskLimitType;

/**
 * A single typed threshold.
 *
 * @param cooldownMinutes optional pause before the limit may fire again
 */
public record RiskLimit(
        RiskLimitType type,
        double value,
        LimitUnit unit,
        LimitScope scope,
        LimitAction action,
        Integer cooldownMinutes
) {
    public static RiskLimit of(RiskLimitType type, double value, LimitUnit unit, LimitScope scope, LimitAction action) {
        return new RiskLimit(type, value, unit, scope, action, null);
    }
}
