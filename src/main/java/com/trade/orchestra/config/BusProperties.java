package com.trade.orchestra.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "orchestra.bus")
public class BusProperties {

    public enum Type { MEMORY, KAFKA }

    private Type type = Type.MEMORY;

    @Positive
    private int historySize = 1000;

    @NotNull
    private Duration defaultRequestTimeout = Duration.ofSeconds(5);

    @Valid
    private Kafka kafka = new Kafka();

    @Data
    public static class Kafka {
        @NotEmpty
        private List<String> servers = new ArrayList<>(List.of("localhost:9092"));
        private String username;
        private String password;
        // delegation token, "<tokenId>:<hmac>"
        private String token;
        // PLAIN | SCRAM-SHA-256 | SCRAM-SHA-512
        private String saslMechanism = "PLAIN";
        private String securityProtocol;
        private String clientId = "trade-orchestra";
        private String groupPrefix = "orchestra";
        @NotNull
        private Duration pollTimeout = Duration.ofMillis(500);
        @NotNull
        private Duration sendTimeout = Duration.ofSeconds(10);
    }
}
