package com.trade.orchestra.bus;

import com.trade.orchestra.common.exception.ValidationException;
import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.EventAction;
import com.trade.orchestra.enums.EventDomain;
import com.trade.orchestra.enums.EventEntity;
import com.trade.orchestra.enums.EventPriority;
import com.trade.orchestra.model.Event;

import java.util.Map;
import java.util.UUID;

/**
 * Event construction helpers. Every event built here has {@code topic == domain.entity[.action]},
 * except requests (caller's topic) and replies ({@code <request topic>.reply}).
 */
public final class Events {

    private Events() {
    }

    public static String generateEventId() {
        return "evt_" + UUID.randomUUID();
    }

    public static String generateCorrelationId() {
        return "cor_" + UUID.randomUUID();
    }

    public static String buildTopic(EventDomain domain, EventEntity entity, EventAction action) {
        String base = domain.code() + "." + entity.code();
        return action == null ? base : base + "." + action.code();
    }

    public static <T> Event<T> create(EventDomain domain, EventEntity entity, EventAction action,
                                      BotCode source, T payload) {
        return create(domain, entity, action, source, payload, EventPriority.NORMAL, null, null, null);
    }

    public static <T> Event<T> create(EventDomain domain, EventEntity entity, EventAction action,
                                      BotCode source, T payload, EventPriority priority,
                                      String correlationId, String causationId, Map<String, Object> metadata) {
        return new Event<>(generateEventId(), buildTopic(domain, entity, action), domain, entity, action,
                System.currentTimeMillis(), source, priority, correlationId, causationId, metadata, payload);
    }

    /**
     * Event on an explicit topic; the topic must start with {@code domain.entity}.
     */
    public static <T> Event<T> onTopic(String topic, EventDomain domain, EventEntity entity, EventAction action,
                                       BotCode source, T payload, EventPriority priority) {
        String prefix = domain.code() + "." + entity.code();
        if (!topic.equals(prefix) && !topic.startsWith(prefix + ".")) {
            throw new ValidationException("Topic '" + topic + "' does not belong to " + prefix);
        }
        return new Event<>(generateEventId(), topic, domain, entity, action,
                System.currentTimeMillis(), source, priority, null, null, null, payload);
    }

    /**
     * Request event on the caller's topic. Domain and entity come from the first two segments,
     * falling back to system/bot when they are not known codes.
     */
    public static <T> Event<T> request(String topic, T payload, String correlationId) {
        String[] parts = topic.split("\\.");
        EventDomain domain = EventDomain.SYSTEM;
        EventEntity entity = EventEntity.BOT;
        try {
            if (parts.length > 0) domain = EventDomain.fromCode(parts[0]);
            if (parts.length > 1) entity = EventEntity.fromCode(parts[1]);
        } catch (IllegalArgumentException e) {
            domain = EventDomain.SYSTEM;
            entity = EventEntity.BOT;
        }
        return new Event<>(generateEventId(), topic, domain, entity, null, System.currentTimeMillis(),
                null, EventPriority.NORMAL, correlationId, null, null, payload);
    }

    public static <R> Event<R> reply(Event<?> request, R payload) {
        return new Event<>(generateEventId(), request.topic() + EventTopics.REPLY_SUFFIX,
                request.domain(), request.entity(), EventAction.UPDATED, System.currentTimeMillis(),
                request.source(), request.priority(), request.correlationId(), request.id(), null, payload);
    }
}
