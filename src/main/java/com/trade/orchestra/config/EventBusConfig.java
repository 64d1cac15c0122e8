package com.trade.orchestra.config;

import com.trade.orchestra.bus.EventBus;
import com.trade.orchestra.bus.EventChannels;
import com.trade.orchestra.bus.EventCodec;
import com.trade.orchestra.bus.InMemoryEventBus;
import com.trade.orchestra.bus.KafkaClientFactory;
import com.trade.orchestra.bus.KafkaEventBus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the bus backend once, at startup, from {@code orchestra.bus.type}.
 */
@Configuration
@EnableConfigurationProperties(BusProperties.class)
public class EventBusConfig {

    @Bean
    public EventCodec eventCodec() {
        return new EventCodec();
    }

    @Bean(initMethod = "connect", destroyMethod = "disconnect")
    @ConditionalOnProperty(name = "orchestra.bus.type", havingValue = "memory", matchIfMissing = true)
    public EventBus inMemoryEventBus(EventCodec codec, BusProperties props) {
        InMemoryEventBus bus = new InMemoryEventBus(codec, props.getHistorySize());
        bus.setDefaultRequestTimeout(props.getDefaultRequestTimeout());
        return bus;
    }

    @Bean
    @ConditionalOnMissingBean
    public KafkaClientFactory kafkaClientFactory() {
        return KafkaClientFactory.defaultFactory();
    }

    @Bean(initMethod = "connect", destroyMethod = "disconnect")
    @ConditionalOnProperty(name = "orchestra.bus.type", havingValue = "kafka")
    public EventBus kafkaEventBus(EventCodec codec, BusProperties props, KafkaClientFactory clients) {
        KafkaEventBus bus = new KafkaEventBus(codec, props.getKafka(), clients);
        bus.setDefaultRequestTimeout(props.getDefaultRequestTimeout());
        return bus;
    }

    @Bean
    public EventChannels eventChannels(EventBus bus) {
        return new EventChannels(bus);
    }
}
