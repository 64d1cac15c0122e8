package com.trade.orchestra.dto;

public record KlinePayload(
        String symbol,
        String exchange,
        String interval,
        long openTime,
        long closeTime,
        double open,
        double high,
        double low,
        double close,
        double volume
) {
}
