package com.trade.orchestra.model;

import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.EventAction;
import com.trade.orchestra.enums.EventDomain;
import com.trade.orchestra.enums.EventEntity;
import com.trade.orchestra.enums.EventPriority;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable envelope routed by the event bus.
 * <p>
 * {@code topic} is normally {@code domain.entity[.action]} (see {@code Events#create});
 * request and reply events carry the caller's topic and {@code <topic>.reply} respectively.
 *
 * @param <T> payload type, fixed per domain/entity pair by {@code EventPayloads}
 */
public record Event<T>(
        String id,
        String topic,
        EventDomain domain,
        EventEntity entity,
        EventAction action,
        long timestamp,
        BotCode source,
        EventPriority priority,
        String correlationId,
        String causationId,
        Map<String, Object> metadata,
        T payload
) {
    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(entity, "entity");
        if (priority == null) priority = EventPriority.NORMAL;
        metadata = (metadata == null || metadata.isEmpty())
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean hasCorrelationId() {
        return correlationId != null && !correlationId.isEmpty();
    }

    public boolean isReply() {
        return topic.endsWith(".reply");
    }
}
