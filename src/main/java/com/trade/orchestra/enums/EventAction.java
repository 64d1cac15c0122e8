package com.trade.orchestra.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Optional third topic segment.
 */
public enum EventAction {
    CREATED,
    UPDATED,
    DELETED,
    EXECUTED,
    FILLED,
    CANCELLED,
    REJECTED,
    GENERATED,
    TRIGGERED,
    STARTED,
    STOPPED,
    ERROR;

    /**
     * Lower-case form used in topics and on the wire.
     */
    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EventAction fromCode(String code) {
        if (code == null) return null;
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
