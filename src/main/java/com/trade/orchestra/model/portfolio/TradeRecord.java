package com.trade.orchestra.model.portfolio;

import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.ExchangeCode;

public record TradeRecord(long timestamp, double pnl, String symbol, ExchangeCode exchange, BotCode botCode) {
}
