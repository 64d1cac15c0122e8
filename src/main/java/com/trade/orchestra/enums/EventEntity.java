package com.trade.orchestra.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Second topic segment: the kind of thing an event is about.
 */
public enum EventEntity {
    SIGNAL,
    ORDER,
    POSITION,
    ORDERBOOK,
    TICKER,
    KLINE,
    PORTFOLIO,
    BALANCE,
    BOT,
    ALERT;

    /**
     * Lower-case form used in topics and on the wire.
     */
    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EventEntity fromCode(String code) {
        if (code == null) return null;
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
