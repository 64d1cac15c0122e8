package com.trade.orchestra.model.exchange;

import com.trade.orchestra.enums.ExchangeCode;
import com.trade.orchestra.enums.PositionSide;

/**
 * Position as reported by an exchange collaborator. Quantity is signed: negative for shorts.
 */
public record PositionSnapshot(
        String positionId,
        String symbol,
        ExchangeCode exchange,
        PositionSide side,
        double entryPrice,
        double markPrice,
        double quantity,
        double notionalValue,
        double unrealizedPnl,
        double realizedPnl,
        double leverage,
        double margin,
        Double liquidationPrice,
        long openedAt,
        long updatedAt
) {
}
