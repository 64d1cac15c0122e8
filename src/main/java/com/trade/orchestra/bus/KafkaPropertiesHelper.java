package com.trade.orchestra.bus;

import com.trade.orchestra.bus.SubscriptionOptions.ReplayPolicy;
import com.trade.orchestra.common.exception.ValidationException;
import com.trade.orchestra.config.BusProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SaslConfigs;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Builds producer and consumer Properties for {@link KafkaEventBus}.
 * <p>
 * Base values come from {@code producer.properties} / {@code consumer.properties} on the classpath,
 * then {@code orchestra.bus.kafka.*} is applied on top. bootstrap.servers resolves as:
 * <ol>
 *   <li>Env: KAFKA_BOOTSTRAP_SERVERS</li>
 *   <li>Sys Prop: kafka.bootstrap.servers</li>
 *   <li>orchestra.bus.kafka.servers</li>
 * </ol>
 */
@Slf4j
public final class KafkaPropertiesHelper {

    private static final String PRODUCER_PROPS = "/producer.properties";
    private static final String CONSUMER_PROPS = "/consumer.properties";

    private static final String PLAIN_MODULE = "org.apache.kafka.common.security.plain.PlainLoginModule";
    private static final String SCRAM_MODULE = "org.apache.kafka.common.security.scram.ScramLoginModule";

    private KafkaPropertiesHelper() {
    }

    public static Properties producerProps(BusProperties.Kafka cfg) {
        Properties p = readProps(PRODUCER_PROPS);
        applyCommon(p, cfg, "-publisher");
        putIfAbsent(p, ProducerConfig.ACKS_CONFIG, "all");
        putIfAbsent(p, ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        putIfAbsent(p, ProducerConfig.RETRIES_CONFIG, String.valueOf(Integer.MAX_VALUE));
        putIfAbsent(p, ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, "120000");
        putIfAbsent(p, ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, "30000");
        putIfAbsent(p, ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");
        return p;
    }

    /**
     * Consumer settings for one subscription. Offsets are committed by the bus after each
     * acknowledged message, never automatically.
     */
    public static Properties consumerProps(BusProperties.Kafka cfg, String groupId, ReplayPolicy replay) {
        Properties p = readProps(CONSUMER_PROPS);
        applyCommon(p, cfg, "-" + groupId);
        p.setProperty(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        p.setProperty(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        p.setProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, replay == ReplayPolicy.ORIGINAL ? "earliest" : "latest");
        putIfAbsent(p, ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, "300000");
        putIfAbsent(p, ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, "10000");
        putIfAbsent(p, ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, "3000");
        // new topics matching a wildcard subscription are picked up on the next metadata refresh
        putIfAbsent(p, ConsumerConfig.METADATA_MAX_AGE_CONFIG, "5000");
        return p;
    }

    public static String resolveBootstrapServers(BusProperties.Kafka cfg) {
        String env = System.getenv("KAFKA_BOOTSTRAP_SERVERS");
        if (notBlank(env)) return env.trim();

        String sys = System.getProperty("kafka.bootstrap.servers");
        if (notBlank(sys)) return sys.trim();

        if (cfg.getServers() != null && !cfg.getServers().isEmpty()) {
            return String.join(",", cfg.getServers());
        }
        return null;
    }

    static String jaasConfig(String mechanism, String username, String password) {
        String module = isScram(mechanism) ? SCRAM_MODULE : PLAIN_MODULE;
        return module + " required username=\"" + escape(username) + "\" password=\"" + escape(password) + "\";";
    }

    /**
     * Delegation tokens authenticate through SCRAM with the token id as user and the HMAC as password.
     */
    static String tokenJaasConfig(String token) {
        int sep = token.indexOf(':');
        if (sep <= 0 || sep == token.length() - 1) {
            throw new ValidationException("Kafka token must look like <tokenId>:<hmac>");
        }
        return SCRAM_MODULE + " required username=\"" + escape(token.substring(0, sep))
                + "\" password=\"" + escape(token.substring(sep + 1)) + "\" tokenauth=\"true\";";
    }

    private static boolean isScram(String mechanism) {
        return mechanism.toUpperCase(Locale.ROOT).startsWith("SCRAM");
    }

    private static void applyCommon(Properties p, BusProperties.Kafka cfg, String clientSuffix) {
        String bs = resolveBootstrapServers(cfg);
        if (notBlank(bs)) {
            p.setProperty(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, bs);
        }
        putIfAbsent(p, CommonClientConfigs.CLIENT_ID_CONFIG, cfg.getClientId() + clientSuffix);

        if (notBlank(cfg.getToken())) {
            String mechanism = notBlank(cfg.getSaslMechanism()) && isScram(cfg.getSaslMechanism())
                    ? cfg.getSaslMechanism().trim() : "SCRAM-SHA-256";
            p.setProperty(SaslConfigs.SASL_MECHANISM, mechanism);
            p.setProperty(SaslConfigs.SASL_JAAS_CONFIG, tokenJaasConfig(cfg.getToken().trim()));
            putIfAbsent(p, CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, "SASL_SSL");
        } else if (notBlank(cfg.getUsername())) {
            String mechanism = notBlank(cfg.getSaslMechanism()) ? cfg.getSaslMechanism().trim() : "PLAIN";
            p.setProperty(SaslConfigs.SASL_MECHANISM, mechanism);
            p.setProperty(SaslConfigs.SASL_JAAS_CONFIG, jaasConfig(mechanism, cfg.getUsername(), cfg.getPassword()));
            putIfAbsent(p, CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, "SASL_SSL");
        }
        if (notBlank(cfg.getSecurityProtocol())) {
            p.setProperty(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, cfg.getSecurityProtocol().trim());
        }
    }

    private static Properties readProps(String classpathResource) {
        Properties p = new Properties();
        try (InputStream in = KafkaPropertiesHelper.class.getResourceAsStream(classpathResource)) {
            if (in != null) p.load(in);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", classpathResource, e.toString());
        }
        return p;
    }

    private static String escape(String s) {
        return s == null ? "" : s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static boolean notBlank(String s) {
        return s != null && !s.trim().isEmpty();
    }

    private static void putIfAbsent(Properties p, String key, String value) {
        if (!notBlank(p.getProperty(key))) {
            p.setProperty(key, value);
        }
    }
}
