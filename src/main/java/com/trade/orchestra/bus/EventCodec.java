package com.trade.orchestra.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.trade.orchestra.common.exception.EventBusException;
import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.EventAction;
import com.trade.orchestra.enums.EventDomain;
import com.trade.orchestra.enums.EventEntity;
import com.trade.orchestra.enums.EventPriority;
import com.trade.orchestra.model.Event;

import java.util.Map;

/**
 * JSON form of {@link Event} on the broker. The payload class is picked by {@link EventPayloads}
 * from the decoded domain and entity.
 */
public class EventCodec {

    private final ObjectMapper mapper;

    public EventCodec() {
        this(JsonMapper.builder()
                .findAndAddModules()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build());
    }

    public EventCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(Event<?> event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventBusException("Cannot encode event " + event.id() + " on " + event.topic(), e);
        }
    }

    public Event<Object> decode(String json) {
        try {
            JsonNode root = mapper.readTree(json);
            EventDomain domain = EventDomain.fromCode(text(root, "domain"));
            EventEntity entity = EventEntity.fromCode(text(root, "entity"));
            Object payload = null;
            JsonNode p = root.get("payload");
            if (p != null && !p.isNull()) {
                Class<?> type = EventPayloads.resolve(domain, entity);
                payload = type == JsonNode.class ? p : mapper.treeToValue(p, type);
            }
            Map<String, Object> metadata = null;
            JsonNode m = root.get("metadata");
            if (m != null && m.isObject()) {
                metadata = mapper.convertValue(m, mapper.getTypeFactory()
                        .constructMapType(Map.class, String.class, Object.class));
            }
            String source = text(root, "source");
            return new Event<>(
                    text(root, "id"),
                    text(root, "topic"),
                    domain,
                    entity,
                    EventAction.fromCode(text(root, "action")),
                    root.path("timestamp").asLong(),
                    source == null ? null : BotCode.valueOf(source),
                    EventPriority.fromCode(text(root, "priority")),
                    text(root, "correlationId"),
                    text(root, "causationId"),
                    metadata,
                    payload);
        } catch (JsonProcessingException | IllegalArgumentException | NullPointerException e) {
            throw new EventBusException("Cannot decode event: " + e.getMessage(), e);
        }
    }

    /**
     * Coerce a decoded payload (for instance a {@link JsonNode} or a map) to the requested type.
     */
    public <R> R convert(Object value, Class<R> type) {
        if (value == null) return null;
        if (type.isInstance(value)) return type.cast(value);
        try {
            return mapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new EventBusException("Cannot convert payload to " + type.getSimpleName(), e);
        }
    }

    private static String text(JsonNode root, String field) {
        JsonNode n = root.get(field);
        return n == null || n.isNull() ? null : n.asText();
    }
}
