package com.trade.orchestra.model.portfolio;

import com.trade.orchestra.enums.ExchangeCode;
import com.trade.orchestra.enums.RebalancePriority;
import com.trade.orchestra.enums.RebalanceType;

/**
 * @param quantity       asset units, derived from the current USD unit price (0 if unknown)
 * @param estimatedValue USD amount that closes the allocation gap
 */
public record RebalanceAction(
        RebalanceType type,
        String asset,
        ExchangeCode fromExchange,
        ExchangeCode toExchange,
        double quantity,
        double estimatedValue,
        String reason,
        RebalancePriority priority
) {
}
