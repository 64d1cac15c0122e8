package com.trade.orchestra.bus;

import com.trade.orchestra.bus.SubscriptionOptions.ReplayPolicy;
import com.trade.orchestra.common.exception.EventBusException;
import com.trade.orchestra.config.BusProperties;
import com.trade.orchestra.model.Event;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Event bus on Kafka. Topics map one to one onto Kafka topics and events travel as JSON.
 * <p>
 * {@link #publish} returns once the broker acknowledged the record. Every subscription polls
 * on its own consumer thread with a regex subscription derived from its pattern, so a slow
 * handler never holds up another subscription. Subscription options map to consumer groups:
 * {@code durable} or {@code queue} name a stable, shared group; without either the subscription
 * gets a private throwaway group. Replies to {@link #request} are collected by a dedicated inbox
 * consumer on {@code *.reply} topics.
 */
@Slf4j
public class KafkaEventBus extends AbstractEventBus {

    private static final Pattern REPLY_TOPICS = Pattern.compile("^.+\\.reply$");

    private final BusProperties.Kafka cfg;
    private final KafkaClientFactory clients;
    private final Map<String, KafkaSubscription> subscriptions = new ConcurrentHashMap<>();

    private volatile Producer<String, String> producer;
    private volatile boolean connected;
    private volatile String replyInboxId;

    public KafkaEventBus(EventCodec codec, BusProperties.Kafka cfg, KafkaClientFactory clients) {
        super(codec);
        this.cfg = cfg;
        this.clients = clients;
    }

    @Override
    public synchronized void connect() {
        if (connected) return;
        Properties p = KafkaPropertiesHelper.producerProps(cfg);
        producer = clients.createProducer(p);
        connected = true;
        replyInboxId = startSubscription("*.reply", REPLY_TOPICS, e -> { },
                SubscriptionOptions.builder().replay(ReplayPolicy.ORIGINAL).maxDeliver(1).build());
        log.info("Kafka event bus connected bootstrap.servers={}", p.getProperty("bootstrap.servers"));
    }

    @Override
    public synchronized void disconnect() {
        if (!connected) return;
        connected = false;
        for (KafkaSubscription s : subscriptions.values()) {
            s.close();
        }
        subscriptions.clear();
        replyInboxId = null;
        failPending(EventBusException.notConnected());
        try {
            producer.flush();
            producer.close(Duration.ofSeconds(5));
        } catch (Exception e) {
            log.warn("Closing Kafka producer failed: {}", e.toString());
        }
        log.info("Kafka event bus disconnected");
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void publish(Event<?> event, PublishOptions options) {
        requireConnected();
        PublishOptions o = options == null ? PublishOptions.defaults() : options;
        String topic = event.topic();
        String key = o.getPartitionKey() != null ? o.getPartitionKey() : topic;
        Duration timeout = o.getSendTimeout() != null ? o.getSendTimeout() : cfg.getSendTimeout();
        String json = codec.encode(event);

        Future<RecordMetadata> sent = producer.send(new ProducerRecord<>(topic, key, json), (m, e) -> {
            if (e == null) {
                log.debug("kafka sent topic={} partition={} offset={}", m.topic(), m.partition(), m.offset());
            } else {
                log.warn("kafka send failed topic={} key={} cause={}", topic, key, e.toString());
            }
        });
        try {
            sent.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            recordError("Publish to " + topic + " failed: " + e.getCause());
            throw new EventBusException("Publish to " + topic + " failed", e.getCause());
        } catch (TimeoutException e) {
            recordError("Publish to " + topic + " timed out");
            throw new EventBusException("Publish to " + topic + " not acknowledged within " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventBusException("Interrupted while publishing to " + topic, e);
        }
        recordPublished(topic);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> String subscribe(String pattern, EventHandler<T> handler, SubscriptionOptions options) {
        requireConnected();
        Pattern regex = TopicMatcher.toRegex(pattern);
        SubscriptionOptions o = options == null ? SubscriptionOptions.defaults() : options;
        return startSubscription(pattern, regex, (EventHandler<Object>) (EventHandler<?>) handler, o);
    }

    @Override
    public void unsubscribe(String subscriptionId) {
        KafkaSubscription s = subscriptions.remove(subscriptionId);
        if (s != null) {
            s.close();
            log.info("Unsubscribed {} from {}", subscriptionId, s.getPattern());
        }
    }

    /**
     * Closes every subscription except the reply inbox.
     */
    @Override
    public synchronized void reset() {
        for (String id : List.copyOf(subscriptions.keySet())) {
            if (!id.equals(replyInboxId)) unsubscribe(id);
        }
        failPending(new EventBusException("Event bus reset"));
        super.reset();
    }

    @Override
    protected int activeSubscriptions() {
        String inbox = replyInboxId;
        return inbox != null && subscriptions.containsKey(inbox) ? subscriptions.size() - 1 : subscriptions.size();
    }

    /**
     * Consumer group for a subscription: stable when named, private otherwise.
     */
    String groupIdFor(SubscriptionOptions o) {
        String prefix = cfg.getGroupPrefix();
        if (o.getDurable() != null && !o.getDurable().isBlank()) return prefix + "-" + o.getDurable();
        if (o.getQueue() != null && !o.getQueue().isBlank()) return prefix + "-" + o.getQueue();
        return prefix + "-eph-" + UUID.randomUUID();
    }

    private String startSubscription(String pattern, Pattern regex, EventHandler<Object> handler, SubscriptionOptions o) {
        String id = "sub_" + UUID.randomUUID();
        String group = groupIdFor(o);
        Consumer<String, String> consumer = clients.createConsumer(KafkaPropertiesHelper.consumerProps(cfg, group, o.getReplay()));
        KafkaSubscription s = new KafkaSubscription(id, pattern, regex, handler, o, consumer, this, cfg.getPollTimeout());
        s.open();
        subscriptions.put(id, s);
        s.start();
        log.info("Subscribed {} to {} (group={}, replay={}, maxDeliver={})", id, pattern, group, o.getReplay(), o.getMaxDeliver());
        return id;
    }
}
