package com.trade.orchestra.bus;

import com.trade.orchestra.common.exception.EventBusException;
import com.trade.orchestra.model.Event;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single-process bus. {@link #publish} runs every matching handler on the caller's thread,
 * in registration order, before it returns. A failing handler is logged and counted; the
 * remaining handlers still run.
 * <p>
 * Subscription and publish options are accepted and ignored. The last {@code historySize}
 * events are kept for inspection.
 */
@Slf4j
public class InMemoryEventBus extends AbstractEventBus {

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Deque<Event<?>> history = new ArrayDeque<>();
    private final int historySize;
    private volatile boolean connected;

    private record Subscription(String id, String pattern, EventHandler<Object> handler) {
    }

    public InMemoryEventBus(EventCodec codec, int historySize) {
        super(codec);
        this.historySize = Math.max(0, historySize);
    }

    public InMemoryEventBus() {
        this(new EventCodec(), 1000);
    }

    @Override
    public void connect() {
        connected = true;
        log.info("In-memory event bus connected");
    }

    @Override
    public void disconnect() {
        connected = false;
        subscriptions.clear();
        failPending(EventBusException.notConnected());
        log.info("In-memory event bus disconnected");
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void publish(Event<?> event, PublishOptions options) {
        requireConnected();
        recordPublished(event.topic());
        remember(event);

        @SuppressWarnings("unchecked")
        Event<Object> e = (Event<Object>) event;
        for (Subscription s : subscriptions) {
            if (!TopicMatcher.matches(event.topic(), s.pattern())) continue;
            recordReceived();
            try {
                s.handler().handle(e);
            } catch (Exception ex) {
                recordError(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
                log.warn("Handler {} failed on {} ({}): {}", s.id(), event.topic(), event.id(), ex.toString());
            }
        }
        resolvePending(event);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> String subscribe(String pattern, EventHandler<T> handler, SubscriptionOptions options) {
        requireConnected();
        TopicMatcher.validate(pattern);
        String id = "sub_" + UUID.randomUUID();
        subscriptions.add(new Subscription(id, pattern, (EventHandler<Object>) (EventHandler<?>) handler));
        log.info("Subscribed {} to {}", id, pattern);
        return id;
    }

    @Override
    public void unsubscribe(String subscriptionId) {
        if (subscriptions.removeIf(s -> s.id().equals(subscriptionId))) {
            log.info("Unsubscribed {}", subscriptionId);
        }
    }

    @Override
    protected int activeSubscriptions() {
        return subscriptions.size();
    }

    @Override
    public void reset() {
        subscriptions.clear();
        failPending(new EventBusException("Event bus reset"));
        super.reset();
        synchronized (history) {
            history.clear();
        }
    }

    /**
     * Retained events, oldest first.
     */
    public List<Event<?>> getHistory() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public List<Event<?>> getHistory(String pattern) {
        List<Event<?>> out = new ArrayList<>();
        for (Event<?> e : getHistory()) {
            if (TopicMatcher.matches(e.topic(), pattern)) out.add(e);
        }
        return out;
    }

    private void remember(Event<?> event) {
        if (historySize == 0) return;
        synchronized (history) {
            history.addLast(event);
            while (history.size() > historySize) history.removeFirst();
        }
    }
}
