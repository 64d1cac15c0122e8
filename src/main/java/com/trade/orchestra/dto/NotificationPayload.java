package com.trade.orchestra.dto;

import java.util.List;
import java.util.Map;

/**
 * @param type     info / success / warning / error
 * @param channels ui / telegram / email / webhook
 */
public record NotificationPayload(
        String type,
        String title,
        String message,
        List<String> channels,
        Map<String, Object> data
) {
}
