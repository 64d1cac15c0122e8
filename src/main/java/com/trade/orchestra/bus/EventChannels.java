package com.trade.orchestra.bus;

import com.trade.orchestra.dto.OrderPayload;
import com.trade.orchestra.dto.PositionPayload;
import com.trade.orchestra.dto.TradingSignalPayload;
import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.EventAction;
import com.trade.orchestra.enums.EventDomain;
import com.trade.orchestra.enums.EventEntity;
import com.trade.orchestra.enums.EventPriority;
import com.trade.orchestra.enums.RiskLevel;
import com.trade.orchestra.model.risk.RiskWarning;
import lombok.RequiredArgsConstructor;

/**
 * Typed shortcuts over {@link EventBus} for the channels bots use most.
 */
@RequiredArgsConstructor
public class EventChannels {

    private final EventBus bus;

    public String subscribeToSignals(EventHandler<TradingSignalPayload> handler) {
        return bus.subscribe(EventTopics.TRADING_SIGNALS, handler);
    }

    /**
     * Signals whose source is {@code bot}. Topics do not carry the bot code, so this filters
     * on {@link com.trade.orchestra.model.Event#source()}.
     */
    public String subscribeToBotSignals(BotCode bot, EventHandler<TradingSignalPayload> handler) {
        return bus.<TradingSignalPayload>subscribe(EventTopics.TRADING_SIGNALS, event -> {
            if (event.source() == bot) handler.handle(event);
        });
    }

    public String subscribeToOrders(EventHandler<OrderPayload> handler) {
        return bus.subscribe(EventTopics.TRADING_ORDERS, handler);
    }

    public String subscribeToPositions(EventHandler<PositionPayload> handler) {
        return bus.subscribe(EventTopics.TRADING_POSITIONS, handler);
    }

    public String subscribeToRiskAlerts(EventHandler<RiskWarning> handler) {
        return bus.subscribe(EventTopics.RISK_ALERTS, handler);
    }

    public void publishSignal(BotCode source, TradingSignalPayload signal) {
        bus.publish(Events.create(EventDomain.TRADING, EventEntity.SIGNAL, EventAction.GENERATED, source, signal));
    }

    /**
     * @param action one of created, filled, cancelled, rejected
     */
    public void publishOrder(BotCode source, OrderPayload order, EventAction action) {
        bus.publish(Events.create(EventDomain.TRADING, EventEntity.ORDER, action, source, order));
    }

    /**
     * @param action one of created, updated, deleted
     */
    public void publishPosition(BotCode source, PositionPayload position, EventAction action) {
        bus.publish(Events.create(EventDomain.TRADING, EventEntity.POSITION, action, source, position));
    }

    public void publishRiskAlert(BotCode source, RiskWarning alert) {
        EventPriority priority = alert.getSeverity() == RiskLevel.CRITICAL ? EventPriority.CRITICAL : EventPriority.HIGH;
        bus.publish(Events.create(EventDomain.RISK, EventEntity.ALERT, EventAction.TRIGGERED, source, alert,
                priority, null, null, null));
    }
}
