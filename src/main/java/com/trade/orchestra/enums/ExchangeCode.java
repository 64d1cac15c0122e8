package com.trade.orchestra.enums;

public enum ExchangeCode {
    BINANCE,
    BYBIT,
    OKX,
    BITGET,
    BINGX
}
