package com.trade.orchestra.dto;

import java.util.List;

public record OrderbookPayload(
        String symbol,
        String exchange,
        List<Level> bids,
        List<Level> asks,
        long timestamp,
        Long sequence
) {
    public record Level(double price, double quantity) {
    }

    public Double midPrice() {
        if (bids == null || asks == null || bids.isEmpty() || asks.isEmpty()) return null;
        return (bids.get(0).price() + asks.get(0).price()) / 2.0;
    }
}
