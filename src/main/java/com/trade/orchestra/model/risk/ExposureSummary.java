package com.trade.orchestra.model.risk;

import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.ExchangeCode;

import java.util.Map;

/**
 * @param hedgeRatio 1 - |net| / gross; 0 when flat
 */
public record ExposureSummary(
        double totalExposure,
        Map<ExchangeCode, Double> exposureByExchange,
        Map<String, Double> exposureBySymbol,
        Map<BotCode, Double> exposureByBot,
        double longExposure,
        double shortExposure,
        double netExposure,
        double hedgeRatio
) {
}
