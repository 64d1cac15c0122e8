package com.trade.orchestra.bus;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.util.Properties;

/**
 * Creates Kafka clients for {@link KafkaEventBus}. Keys and values are strings; values hold
 * JSON produced by {@link EventCodec}.
 */
public interface KafkaClientFactory {

    Producer<String, String> createProducer(Properties props);

    Consumer<String, String> createConsumer(Properties props);

    static KafkaClientFactory defaultFactory() {
        return new KafkaClientFactory() {
            @Override
            public Producer<String, String> createProducer(Properties props) {
                return new KafkaProducer<>(props, new StringSerializer(), new StringSerializer());
            }

            @Override
            public Consumer<String, String> createConsumer(Properties props) {
                return new KafkaConsumer<>(props, new StringDeserializer(), new StringDeserializer());
            }
        };
    }
}
