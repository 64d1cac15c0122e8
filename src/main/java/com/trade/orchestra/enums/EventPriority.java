package com.trade.orchestra.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Delivery priority tag carried on every event.
 */
public enum EventPriority {
    CRITICAL,
    HIGH,
    NORMAL,
    LOW;

    /**
     * Lower-case form used in topics and on the wire.
     */
    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EventPriority fromCode(String code) {
        if (code == null) return null;
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
