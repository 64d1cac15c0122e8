package com.trade.orchestra.test.bus;

import com.trade.orchestra.bus.EventBus;
import com.trade.orchestra.bus.EventChannels;
import com.trade.orchestra.bus.KafkaEventBus;
import com.trade.orchestra.bus.SubscriptionOptions;
import com.trade.orchestra.dto.TradingSignalPayload;
import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.SignalDirection;
import com.trade.orchestra.enums.SignalStrength;
import com.trade.orchestra.model.Event;
import com.trade.orchestra.test.BaseContainers;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@SpringBootTest
@ActiveProfiles("test")
class KafkaEventBusIT extends BaseContainers {

    @Autowired
    EventBus bus;
    @Autowired
    EventChannels channels;

    @BeforeAll
    static void createTopics() throws Exception {
        try (Admin admin = Admin.create(Map.of(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, KAFKA.getBootstrapServers()))) {
            admin.createTopics(List.of(
                    new NewTopic("trading.signal.generated", 1, (short) 1),
                    new NewTopic("analytics.bot.ping", 1, (short) 1),
                    new NewTopic("analytics.bot.ping.reply", 1, (short) 1))).all().get(30, TimeUnit.SECONDS);
        }
    }

    @Test
    void brokerBackendIsSelected() {
        assertThat(bus).isInstanceOf(KafkaEventBus.class);
        assertThat(bus.isConnected()).isTrue();
    }

    @Test
    void signalRoundTripsThroughBroker() {
        List<Event<TradingSignalPayload>> seen = new CopyOnWriteArrayList<>();
        bus.<TradingSignalPayload>subscribe("trading.signal.*", seen::add,
                SubscriptionOptions.builder().durable("it-signals").replay(SubscriptionOptions.ReplayPolicy.ORIGINAL).build());

        channels.publishSignal(BotCode.MFT, new TradingSignalPayload("BTC/USDT", "bybit", SignalDirection.SHORT,
                SignalStrength.MODERATE, 65, 42_000.0, null, null, null, null, null, null, "4h", "trend", null, null));

        await().atMost(60, TimeUnit.SECONDS).until(() -> !seen.isEmpty());
        Event<TradingSignalPayload> e = seen.get(0);
        assertThat(e.source()).isEqualTo(BotCode.MFT);
        assertThat(e.payload().direction()).isEqualTo(SignalDirection.SHORT);
    }

    @Test
    void requestIsAnsweredOverBroker() {
        bus.reply("analytics.bot.ping", String.class, p -> p + "-pong");

        // the responder's group may still be joining; repeat until one request lands
        String answer = await().atMost(90, TimeUnit.SECONDS).ignoreExceptions()
                .until(() -> bus.request("analytics.bot.ping", "ping", Duration.ofSeconds(15), String.class),
                        "ping-pong"::equals);

        assertThat(answer).isEqualTo("ping-pong");
    }
}
