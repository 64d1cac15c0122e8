package com.trade.orchestra.model.risk;

import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.ExchangeCode;
import com.trade.orchestra.enums.PositionSide;

/**
 * One open position as seen by the risk manager.
 */
public record PositionExposure(
        String symbol,
        ExchangeCode exchange,
        BotCode botCode,
        PositionSide side,
        double quantity,
        double notionalValue,
        double margin,
        double leverage,
        double pnl,
        double pnlPercent,
        double entryPrice,
        double currentPrice,
        Double liquidationPrice
) {
}
