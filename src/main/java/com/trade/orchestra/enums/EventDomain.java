package com.trade.orchestra.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * First topic segment: the area of the platform an event belongs to.
 */
public enum EventDomain {
    TRADING,
    MARKET,
    RISK,
    EXECUTION,
    ANALYTICS,
    SYSTEM,
    NOTIFICATION;

    /**
     * Lower-case form used in topics and on the wire.
     */
    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EventDomain fromCode(String code) {
        if (code == null) return null;
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
