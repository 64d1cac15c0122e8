package com.trade.orchestra.test.bus;

import com.trade.orchestra.bus.EventBusStats;
import com.trade.orchestra.bus.EventCodec;
import com.trade.orchestra.bus.Events;
import com.trade.orchestra.bus.InMemoryEventBus;
import com.trade.orchestra.common.exception.EventBusException;
import com.trade.orchestra.common.exception.RequestTimeoutException;
import com.trade.orchestra.common.exception.ValidationException;
import com.trade.orchestra.enums.BotCode;
import com.trade.orchestra.enums.EventAction;
import com.trade.orchestra.enums.EventDomain;
import com.trade.orchestra.enums.EventEntity;
import com.trade.orchestra.model.Event;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryEventBusTest {

    private InMemoryEventBus bus;

    @BeforeEach
    void setUp() {
        bus = new InMemoryEventBus(new EventCodec(), 3);
        bus.connect();
    }

    @AfterEach
    void tearDown() {
        bus.disconnect();
    }

    private static Event<String> signal(String payload) {
        return Events.create(EventDomain.TRADING, EventEntity.SIGNAL, EventAction.GENERATED, BotCode.GRD, payload);
    }

    @Test
    void handlersRunBeforePublishReturns() {
        List<String> seen = new ArrayList<>();
        bus.<String>subscribe("trading.signal.*", e -> seen.add(e.payload()));

        bus.publish(signal("x"));

        assertThat(seen).containsExactly("x");
    }

    @Test
    void handlersRunInRegistrationOrder() {
        List<String> order = new ArrayList<>();
        bus.subscribe("trading.>", e -> order.add("first"));
        bus.subscribe("trading.signal.generated", e -> order.add("second"));
        bus.subscribe("*.signal.*", e -> order.add("third"));
        bus.subscribe("market.>", e -> order.add("never"));

        bus.publish(signal("x"));

        assertThat(order).containsExactly("first", "second", "third");
    }

    @Test
    void failingHandlerDoesNotStopOthers() {
        List<String> seen = new ArrayList<>();
        bus.subscribe("trading.>", e -> {
            throw new IllegalStateException("boom");
        });
        bus.<String>subscribe("trading.>", e -> seen.add(e.payload()));

        bus.publish(signal("x"));

        assertThat(seen).containsExactly("x");
        EventBusStats stats = bus.getStats();
        assertThat(stats.errors()).isEqualTo(1);
        assertThat(stats.lastError()).isEqualTo("boom");
        assertThat(stats.lastErrorTime()).isNotNull();
        assertThat(stats.totalPublished()).isEqualTo(1);
        assertThat(stats.totalReceived()).isEqualTo(2);
        assertThat(stats.topics()).containsEntry("trading.signal.generated", 1L);
    }

    @Test
    void unsubscribeStopsDelivery() {
        List<String> seen = new ArrayList<>();
        String id = bus.<String>subscribe("trading.>", e -> seen.add(e.payload()));
        bus.unsubscribe(id);
        bus.unsubscribe("unknown");

        bus.publish(signal("x"));

        assertThat(seen).isEmpty();
        assertThat(bus.getStats().activeSubscriptions()).isZero();
    }

    @Test
    void requestResolvesWithReply() {
        bus.<Integer, Integer>reply("system.bot.echo", n -> n * 2);

        Integer answer = bus.request("system.bot.echo", 21, Duration.ofSeconds(1), Integer.class);

        assertThat(answer).isEqualTo(42);
        assertThat(bus.getHistory("system.bot.echo.reply")).hasSize(1);
    }

    @Test
    void replyCarriesCorrelationAndCausation() {
        AtomicReference<Event<?>> reply = new AtomicReference<>();
        bus.reply("system.bot.ping", p -> "pong");
        bus.subscribe("system.bot.ping.reply", reply::set);

        bus.request("system.bot.ping", "ping", Duration.ofSeconds(1), String.class);

        Event<?> r = reply.get();
        assertThat(r).isNotNull();
        assertThat(r.correlationId()).startsWith("cor_");
        assertThat(r.causationId()).startsWith("evt_");
        assertThat(r.isReply()).isTrue();
        assertThat(r.payload()).isEqualTo("pong");
    }

    @Test
    void requestWithoutResponderTimesOut() {
        assertThatThrownBy(() -> bus.request("system.bot.nobody", "x", Duration.ofMillis(50), String.class))
                .isInstanceOf(RequestTimeoutException.class)
                .hasMessageContaining("system.bot.nobody");
    }

    @Test
    void requestWithoutTimeoutUsesBusDefault() {
        bus.setDefaultRequestTimeout(Duration.ofMillis(50));
        bus.<Integer, Integer>reply("system.bot.echo", n -> n + 1);

        assertThat(bus.request("system.bot.echo", 1, Integer.class)).isEqualTo(2);
        assertThatThrownBy(() -> bus.request("system.bot.nobody", "x", String.class))
                .isInstanceOf(RequestTimeoutException.class);
        assertThatThrownBy(() -> bus.setDefaultRequestTimeout(Duration.ZERO))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void requestDoesNotResolveOnItsOwnEvent() {
        // a plain subscriber on the request topic sees the request but must not answer it
        List<Object> seen = new ArrayList<>();
        bus.subscribe("system.bot.*", e -> seen.add(e.payload()));

        assertThatThrownBy(() -> bus.request("system.bot.quiet", "q", Duration.ofMillis(50), String.class))
                .isInstanceOf(RequestTimeoutException.class);
        assertThat(seen).containsExactly("q");
    }

    @Test
    void historyIsBounded() {
        for (int i = 0; i < 5; i++) bus.publish(signal("s" + i));

        assertThat(bus.getHistory()).extracting(e -> (Object) e.payload()).containsExactly("s2", "s3", "s4");
    }

    @Test
    void resetDropsSubscriptionsHistoryAndCounters() {
        List<String> seen = new ArrayList<>();
        bus.<String>subscribe("trading.>", e -> seen.add(e.payload()));
        bus.publish(signal("before"));

        bus.reset();
        bus.publish(signal("after"));

        assertThat(seen).containsExactly("before");
        assertThat(bus.isConnected()).isTrue();
        assertThat(bus.getHistory()).extracting(e -> (Object) e.payload()).containsExactly("after");
        EventBusStats stats = bus.getStats();
        assertThat(stats.totalPublished()).isEqualTo(1);
        assertThat(stats.totalReceived()).isZero();
        assertThat(stats.activeSubscriptions()).isZero();
    }

    @Test
    void operationsRequireConnection() {
        bus.disconnect();

        assertThat(bus.isConnected()).isFalse();
        assertThatThrownBy(() -> bus.publish(signal("x")))
                .isInstanceOf(EventBusException.class)
                .hasMessage("Event bus not connected");
        assertThatThrownBy(() -> bus.subscribe("a.b", e -> { }))
                .isInstanceOf(EventBusException.class);
    }
}
