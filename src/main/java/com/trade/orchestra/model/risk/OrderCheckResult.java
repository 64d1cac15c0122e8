package com.trade.orchestra.model.risk;

import com.trade.orchestra.enums.LimitScope;
import com.trade.orchestra.enums.RiskLimitType;

/**
 * Outcome of a pre-trade check. Rejections carry the first violated limit and a human reason;
 * approvals may carry a soft warning.
 */
public record OrderCheckResult(
        boolean allowed,
        String reason,
        String warning,
        RiskLimitType violatedLimit,
        LimitScope violatedScope
) {
    public static OrderCheckResult allow() {
        return new OrderCheckResult(true, null, null, null, null);
    }

    public static OrderCheckResult allowWithWarning(String warning) {
        return new OrderCheckResult(true, null, warning, null, null);
    }

    public static OrderCheckResult reject(RiskLimitType type, String reason) {
        return new OrderCheckResult(false, reason, null, type, LimitScope.PORTFOLIO);
    }

    public static OrderCheckResult reject(RiskLimitType type, LimitScope scope, String reason) {
        return new OrderCheckResult(false, reason, null, type, scope);
    }

    public boolean hasWarning() {
        return warning != null;
    }
}
