package com.trade.orchestra.bus;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Delivery options for one subscription. The in-memory bus ignores all of them.
 */
@Value
@Builder(toBuilder = true)
public class SubscriptionOptions {

    public enum ReplayPolicy {
        /** only events published after the subscription starts */
        INSTANT,
        /** everything the broker still retains */
        ORIGINAL
    }

    /** Members of the same queue group share the load: one of them receives each event. */
    String queue;

    /** Stable consumer name; progress survives restarts. */
    String durable;

    @Builder.Default
    ReplayPolicy replay = ReplayPolicy.INSTANT;

    /** Delivery attempts before an event is dropped. */
    @Builder.Default
    int maxDeliver = 3;

    /** Time the handler has to finish one attempt. */
    @Builder.Default
    Duration ackWait = Duration.ofSeconds(30);

    public static SubscriptionOptions defaults() {
        return builder().build();
    }
}
