package com.trade.orchestra.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.orchestra.dto.BotStatePayload;
import com.trade.orchestra.dto.KlinePayload;
import com.trade.orchestra.dto.NotificationPayload;
import com.trade.orchestra.dto.OrderPayload;
import com.trade.orchestra.dto.OrderbookPayload;
import com.trade.orchestra.dto.PositionPayload;
import com.trade.orchestra.dto.TickerPayload;
import com.trade.orchestra.dto.TradingSignalPayload;
import com.trade.orchestra.enums.EventDomain;
import com.trade.orchestra.enums.EventEntity;
import com.trade.orchestra.model.portfolio.PortfolioSummary;
import com.trade.orchestra.model.risk.RiskWarning;

import java.util.EnumMap;
import java.util.Map;

/**
 * Payload type per domain/entity pair, used when decoding events off the wire.
 * Pairs without an entry decode to a {@link JsonNode}.
 */
public final class EventPayloads {

    private static final Map<EventDomain, Map<EventEntity, Class<?>>> TYPES = new EnumMap<>(EventDomain.class);

    static {
        register(EventDomain.TRADING, EventEntity.SIGNAL, TradingSignalPayload.class);
        register(EventDomain.TRADING, EventEntity.ORDER, OrderPayload.class);
        register(EventDomain.TRADING, EventEntity.POSITION, PositionPayload.class);
        register(EventDomain.EXECUTION, EventEntity.ORDER, OrderPayload.class);
        register(EventDomain.MARKET, EventEntity.TICKER, TickerPayload.class);
        register(EventDomain.MARKET, EventEntity.ORDERBOOK, OrderbookPayload.class);
        register(EventDomain.MARKET, EventEntity.KLINE, KlinePayload.class);
        register(EventDomain.RISK, EventEntity.ALERT, RiskWarning.class);
        register(EventDomain.RISK, EventEntity.PORTFOLIO, PortfolioSummary.class);
        register(EventDomain.SYSTEM, EventEntity.BOT, BotStatePayload.class);
        register(EventDomain.NOTIFICATION, EventEntity.ALERT, NotificationPayload.class);
    }

    private EventPayloads() {
    }

    private static void register(EventDomain domain, EventEntity entity, Class<?> type) {
        TYPES.computeIfAbsent(domain, d -> new EnumMap<>(EventEntity.class)).put(entity, type);
    }

    public static Class<?> resolve(EventDomain domain, EventEntity entity) {
        Map<EventEntity, Class<?>> byEntity = TYPES.get(domain);
        Class<?> type = byEntity == null ? null : byEntity.get(entity);
        return type == null ? JsonNode.class : type;
    }
}
