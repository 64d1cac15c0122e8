package com.trade.orchestra.bus;

import com.trade.orchestra.common.exception.EventBusException;
import com.trade.orchestra.common.exception.RequestTimeoutException;
import com.trade.orchestra.common.exception.ValidationException;
import com.trade.orchestra.model.Event;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters, pending requests and the request/reply protocol shared by both backends.
 * Subclasses call {@link #resolvePending(Event)} for every event they see.
 */
@Slf4j
public abstract class AbstractEventBus implements EventBus {

    protected final EventCodec codec;

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong received = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final Map<String, AtomicLong> topicCounts = new ConcurrentHashMap<>();
    private volatile String lastError;
    private volatile Long lastErrorTime;

    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();
    private volatile Duration defaultRequestTimeout = Duration.ofSeconds(5);

    private record PendingRequest(String requestEventId, CompletableFuture<Object> future) {
    }

    protected AbstractEventBus(EventCodec codec) {
        this.codec = codec;
    }

    protected abstract int activeSubscriptions();

    protected void requireConnected() {
        if (!isConnected()) throw EventBusException.notConnected();
    }

    public Duration getDefaultRequestTimeout() {
        return defaultRequestTimeout;
    }

    public void setDefaultRequestTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new ValidationException("Default request timeout must be positive");
        }
        this.defaultRequestTimeout = timeout;
    }

    @Override
    public <R> R request(String topic, Object payload, Class<R> replyType) {
        return request(topic, payload, defaultRequestTimeout, replyType);
    }

    @Override
    public <R> R request(String topic, Object payload, Duration timeout, Class<R> replyType) {
        requireConnected();
        String correlationId = Events.generateCorrelationId();
        Event<Object> req = Events.request(topic, payload, correlationId);
        CompletableFuture<Object> future = new CompletableFuture<>();
        pending.put(correlationId, new PendingRequest(req.id(), future));
        try {
            publish(req);
            Object result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return codec.convert(result, replyType);
        } catch (TimeoutException e) {
            log.warn("No reply on {} within {} ms (correlationId={})", topic, timeout.toMillis(), correlationId);
            throw new RequestTimeoutException(topic, correlationId, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventBusException("Interrupted while waiting for reply on " + topic, e);
        } catch (ExecutionException e) {
            throw new EventBusException("Request on " + topic + " failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            pending.remove(correlationId);
        }
    }

    @Override
    public <T, R> String reply(String pattern, ReplyHandler<T, R> handler) {
        return reply(pattern, null, handler);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T, R> String reply(String pattern, Class<T> requestType, ReplyHandler<T, R> handler) {
        return subscribe(pattern, (Event<Object> event) -> {
            // replies share the correlation id; answering them would loop
            if (!event.hasCorrelationId() || event.isReply()) return;
            T payload = requestType == null ? (T) event.payload() : codec.convert(event.payload(), requestType);
            R result = handler.handle(payload);
            publish(Events.reply(event, result));
        });
    }

    /**
     * Complete the waiting request whose correlation id this event carries. The request event
     * itself never resolves its own wait.
     */
    protected void resolvePending(Event<?> event) {
        if (!event.hasCorrelationId()) return;
        PendingRequest p = pending.get(event.correlationId());
        if (p == null || p.requestEventId().equals(event.id())) return;
        if (pending.remove(event.correlationId(), p)) {
            p.future().complete(event.payload());
        }
    }

    protected void failPending(Exception cause) {
        for (PendingRequest p : pending.values()) {
            p.future().completeExceptionally(cause);
        }
        pending.clear();
    }

    protected int pendingRequests() {
        return pending.size();
    }

    protected void recordPublished(String topic) {
        published.incrementAndGet();
        topicCounts.computeIfAbsent(topic, t -> new AtomicLong()).incrementAndGet();
    }

    protected void recordReceived() {
        received.incrementAndGet();
    }

    protected void recordError(String message) {
        errors.incrementAndGet();
        lastError = message;
        lastErrorTime = System.currentTimeMillis();
    }

    @Override
    public EventBusStats getStats() {
        Map<String, Long> topics = new TreeMap<>();
        topicCounts.forEach((k, v) -> topics.put(k, v.get()));
        return new EventBusStats(published.get(), received.get(), activeSubscriptions(),
                topics, errors.get(), lastError, lastErrorTime);
    }

    @Override
    public void reset() {
        published.set(0);
        received.set(0);
        errors.set(0);
        topicCounts.clear();
        lastError = null;
        lastErrorTime = null;
    }
}
