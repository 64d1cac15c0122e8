package com.trade.orchestra.bus;

import com.trade.orchestra.model.Event;

import java.time.Duration;

/**
 * Topic-based publish/subscribe with request/reply.
 * <p>
 * Backends differ in delivery guarantees only: {@link InMemoryEventBus} delivers synchronously
 * inside the process, {@link KafkaEventBus} persists events on a broker and delivers
 * at-least-once. All operations except {@link #connect()}, {@link #isConnected()} and
 * {@link #getStats()} require a connected bus.
 */
public interface EventBus {

    void connect();

    void disconnect();

    boolean isConnected();

    void publish(Event<?> event, PublishOptions options);

    default void publish(Event<?> event) {
        publish(event, PublishOptions.defaults());
    }

    /**
     * @param pattern topic pattern, see {@link TopicMatcher}
     * @return subscription id for {@link #unsubscribe(String)}
     */
    <T> String subscribe(String pattern, EventHandler<T> handler, SubscriptionOptions options);

    default <T> String subscribe(String pattern, EventHandler<T> handler) {
        return subscribe(pattern, handler, SubscriptionOptions.defaults());
    }

    /**
     * Unknown ids are ignored.
     */
    void unsubscribe(String subscriptionId);

    /**
     * Publish {@code payload} on {@code topic} and block until a correlated reply arrives.
     *
     * @throws com.trade.orchestra.common.exception.RequestTimeoutException when no reply arrives in time
     */
    <R> R request(String topic, Object payload, Duration timeout, Class<R> replyType);

    /**
     * As {@link #request(String, Object, Duration, Class)} with the bus's default timeout.
     */
    <R> R request(String topic, Object payload, Class<R> replyType);

    /**
     * Answer every request matching {@code pattern} with the handler's result on {@code <topic>.reply}.
     *
     * @return subscription id
     */
    <T, R> String reply(String pattern, ReplyHandler<T, R> handler);

    /**
     * As {@link #reply(String, ReplyHandler)}, converting each request payload to {@code requestType}
     * first. Needed on the broker backend where payloads arrive decoded from JSON.
     */
    <T, R> String reply(String pattern, Class<T> requestType, ReplyHandler<T, R> handler);

    EventBusStats getStats();

    /**
     * Drop every subscription, fail pending requests and zero the counters. The bus stays
     * connected. Events already retained by a broker are not touched.
     */
    void reset();
}
