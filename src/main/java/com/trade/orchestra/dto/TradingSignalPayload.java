package com.trade.orchestra.dto;

import com.trade.orchestra.enums.SignalDirection;
import com.trade.orchestra.enums.SignalStrength;

import java.util.Map;

/**
 * Payload of {@code trading.signal.*} events.
 *
 * @param confidence 0..100
 */
public record TradingSignalPayload(
        String symbol,
        String exchange,
        SignalDirection direction,
        SignalStrength strength,
        double confidence,
        Double entryPrice,
        Double stopLoss,
        Double takeProfit,
        Double positionSize,
        Double positionSizePercent,
        Double leverage,
        Double riskRewardRatio,
        String timeframe,
        String strategy,
        Long expiresAt,
        Map<String, Object> metadata
) {
}
