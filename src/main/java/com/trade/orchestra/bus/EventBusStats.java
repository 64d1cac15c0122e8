package com.trade.orchestra.bus;

import java.util.Map;

/**
 * Point-in-time copy of bus counters.
 *
 * @param topics published event count per concrete topic
 */
public record EventBusStats(
        long totalPublished,
        long totalReceived,
        int activeSubscriptions,
        Map<String, Long> topics,
        long errors,
        String lastError,
        Long lastErrorTime
) {
}
