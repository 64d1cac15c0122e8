package com.trade.orchestra.dto;

public record TickerPayload(
        String symbol,
        String exchange,
        double lastPrice,
        double bidPrice,
        double askPrice,
        double bidQuantity,
        double askQuantity,
        Double volume,
        Double priceChangePercent,
        Double fundingRate,
        long timestamp
) {
}
