package com.trade.orchestra.bus;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class PublishOptions {

    /** Broker partition key; the event topic when absent. */
    String partitionKey;

    /** Upper bound for a broker acknowledgement; the backend default when absent. */
    Duration sendTimeout;

    public static PublishOptions defaults() {
        return builder().build();
    }
}
