package com.trade.orchestra.dto;

import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.PositionSide;
import com.trade.orchestra.enums.PositionStatus;

/**
 * Payload of {@code trading.position.*} events.
 */
public record PositionPayload(
        String positionId,
        String symbol,
        String exchange,
        PositionSide side,
        PositionStatus status,
        double entryPrice,
        double currentPrice,
        double quantity,
        double notionalValue,
        double unrealizedPnl,
        double realizedPnl,
        double leverage,
        double margin,
        Long openedAt,
        Long closedAt,
        BotCode botCode
) {
}
