package com.trade.orchestra.bus;

import com.trade.orchestra.common.exception.EventBusException;
import com.trade.orchestra.model.Event;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * One subscription on the Kafka bus: its own consumer, its own poll thread.
 * <p>
 * Each record is handed to the handler up to {@code maxDeliver} times, each attempt bounded by
 * {@code ackWait}. A successful attempt acknowledges the record by committing its offset; a failed
 * one is a negative acknowledgement and the record is delivered again. Once attempts are exhausted
 * the record is logged, counted and committed so the partition does not stall.
 */
@Slf4j
class KafkaSubscription implements Runnable {

    @Getter
    private final String id;
    @Getter
    private final String pattern;
    private final Pattern regex;
    private final EventHandler<Object> handler;
    private final SubscriptionOptions options;
    private final Consumer<String, String> consumer;
    private final AbstractEventBus bus;
    private final Duration pollTimeout;
    private volatile ExecutorService handlerExec;

    private volatile boolean running;
    private Thread thread;

    KafkaSubscription(String id, String pattern, Pattern regex, EventHandler<Object> handler,
                      SubscriptionOptions options, Consumer<String, String> consumer,
                      AbstractEventBus bus, Duration pollTimeout) {
        this.id = id;
        this.pattern = pattern;
        this.regex = regex;
        this.handler = handler;
        this.options = options;
        this.consumer = consumer;
        this.bus = bus;
        this.pollTimeout = pollTimeout;
        this.handlerExec = newHandlerExecutor();
    }

    private ExecutorService newHandlerExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "bus-handler-" + id);
            t.setDaemon(true);
            return t;
        });
    }

    void open() {
        consumer.subscribe(regex);
        running = true;
    }

    void start() {
        thread = new Thread(this, "bus-consumer-" + id);
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public void run() {
        try {
            while (running) {
                pollOnce();
            }
        } catch (WakeupException e) {
            if (running) {
                log.error("Consumer {} on {} woken up unexpectedly", id, pattern, e);
                bus.recordError("Consumer " + id + " stopped: " + e);
            }
        } catch (Exception e) {
            log.error("Consumer loop {} on {} failed", id, pattern, e);
            bus.recordError("Consumer " + id + " stopped: " + e.getMessage());
        } finally {
            shutdownClients();
        }
    }

    /**
     * Poll once and process everything returned.
     *
     * @return number of records seen
     */
    int pollOnce() {
        ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
        for (ConsumerRecord<String, String> r : records) {
            if (!running) break;
            deliver(r);
        }
        return records.count();
    }

    void close() {
        running = false;
        if (thread != null) {
            consumer.wakeup();
            try {
                thread.join(pollTimeout.toMillis() + 5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        } else {
            shutdownClients();
        }
    }

    private void deliver(ConsumerRecord<String, String> record) {
        Event<Object> event;
        try {
            event = bus.codec.decode(record.value());
        } catch (EventBusException e) {
            log.error("Dropping undecodable record topic={} partition={} offset={}: {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            bus.recordError(e.getMessage());
            commit(record);
            return;
        }

        bus.recordReceived();
        int maxDeliver = Math.max(1, options.getMaxDeliver());
        boolean acked = false;
        for (int attempt = 1; attempt <= maxDeliver && running; attempt++) {
            try {
                invoke(event);
                acked = true;
                break;
            } catch (InterruptedException e) {
                // stop without committing; the group redelivers the record
                Thread.currentThread().interrupt();
                running = false;
                log.warn("Consumer {} interrupted while handling {}", id, event.id());
                return;
            } catch (Exception e) {
                bus.recordError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
                log.warn("Handler {} nak {} on {} (attempt {}/{}): {}",
                        id, event.id(), event.topic(), attempt, maxDeliver, e.toString());
            }
        }
        if (!acked && !running) {
            // left uncommitted; the group redelivers it after restart
            return;
        }
        if (!acked) {
            log.error("Giving up on {} from {} after {} attempts", event.id(), event.topic(), maxDeliver);
        }
        bus.resolvePending(event);
        commit(record);
    }

    private void invoke(Event<Object> event) throws Exception {
        Future<?> f = handlerExec.submit(() -> {
            handler.handle(event);
            return null;
        });
        try {
            f.get(options.getAckWait().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            replaceHandlerThread();
            throw new EventBusException("Handler exceeded ackWait of " + options.getAckWait().toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            // the handler's own interrupt is a failed attempt, not a shutdown of this consumer
            if (cause instanceof InterruptedException) throw new EventBusException("Handler interrupted", cause);
            if (cause instanceof Exception ex) throw ex;
            throw e;
        }
    }

    /**
     * A handler that ignores cancellation would block every later attempt on the single handler
     * thread, so its executor is dropped and the next attempt gets a fresh one.
     */
    private void replaceHandlerThread() throws InterruptedException {
        ExecutorService current = handlerExec;
        current.shutdownNow();
        if (!current.awaitTermination(100, TimeUnit.MILLISECONDS)) {
            log.warn("Handler thread of {} ignored cancellation; replacing it", id);
        }
        handlerExec = newHandlerExecutor();
    }

    private void commit(ConsumerRecord<String, String> record) {
        consumer.commitSync(Collections.singletonMap(
                new TopicPartition(record.topic(), record.partition()),
                new OffsetAndMetadata(record.offset() + 1)));
    }

    private void shutdownClients() {
        handlerExec.shutdownNow();
        try {
            consumer.close();
        } catch (Exception e) {
            log.warn("Closing consumer {} failed: {}", id, e.toString());
        }
    }
}
