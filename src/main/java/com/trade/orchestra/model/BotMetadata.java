package com.trade.orchestra.model;

import com.trade.orchestra.enums.BotCategory;
import com.trade.orchestra.enums.BotCode;

public record BotMetadata(
        BotCode code,
        String name,
        BotCategory category,
        String description,
        String version,
        boolean enabled
) {
    public BotMetadata withEnabled(boolean value) {
        return new BotMetadata(code, name, category, description, version, value);
    }
}
