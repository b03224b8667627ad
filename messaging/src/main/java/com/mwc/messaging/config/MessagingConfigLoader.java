package com.mwc.messaging.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link MessagingConfig} from a YAML file.
 *
 * <p>Broker settings left empty in YAML fall back to the environment:
 * {@code RABBITMQ_URL}, {@code RABBITMQ_USE_TLS}, {@code RABBITMQ_CERT_PATH}.</p>
 */
public class MessagingConfigLoader {

    static final String ENV_URL = "RABBITMQ_URL";
    static final String ENV_USE_TLS = "RABBITMQ_USE_TLS";
    static final String ENV_CERT_PATH = "RABBITMQ_CERT_PATH";

    /**
     * Load config from a YAML file path.
     */
    public static MessagingConfig fromYaml(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return fromYaml(is);
        }
    }

    /**
     * Load config from a classpath resource.
     */
    public static MessagingConfig fromClasspath(String resource) {
        try (InputStream is = MessagingConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException("Resource not found: " + resource);
            }
            return fromYaml(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load config from classpath: " + resource, e);
        }
    }

    /**
     * Config with defaults and broker settings from the environment only.
     */
    public static MessagingConfig fromEnvironment() {
        MessagingConfig config = new MessagingConfig();
        applyEnvironment(config, System.getenv());
        return config;
    }

    public static MessagingConfig fromYaml(InputStream is) {
        return fromYaml(is, System.getenv());
    }

    static MessagingConfig fromYaml(InputStream is, Map<String, String> env) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(is);
        if (root == null) {
            throw new IllegalArgumentException("Empty messaging configuration");
        }

        // Navigate to mwc.messaging
        Map<String, Object> mwc = getMap(root, "mwc");
        Map<String, Object> messaging = getMap(mwc, "messaging");

        MessagingConfig config = new MessagingConfig();

        if (messaging.containsKey("enabled")) {
            config.setEnabled(Boolean.parseBoolean(String.valueOf(messaging.get("enabled"))));
        }
        if (messaging.containsKey("fail-fast")) {
            config.setFailFast(Boolean.parseBoolean(String.valueOf(messaging.get("fail-fast"))));
        }
        if (messaging.containsKey("unread-check-delay")) {
            config.setUnreadCheckDelay(parseDuration(String.valueOf(messaging.get("unread-check-delay"))));
        }

        parseRabbitmq(getMapOrEmpty(messaging, "rabbitmq"), config.getRabbitmq());
        parseTopology(getMapOrEmpty(messaging, "topology"), config.getTopology());

        applyEnvironment(config, env);
        return config;
    }

    private static void parseRabbitmq(Map<String, Object> map, MessagingConfig.RabbitmqConfig rmq) {
        if (map.containsKey("url")) rmq.setUrl(toStringOrNull(map.get("url")));
        if (map.containsKey("use-tls")) rmq.setUseTls(Boolean.parseBoolean(String.valueOf(map.get("use-tls"))));
        if (map.containsKey("cert-path")) rmq.setCertPath(toStringOrNull(map.get("cert-path")));
        if (map.containsKey("connection-name")) rmq.setConnectionName(String.valueOf(map.get("connection-name")));
        if (map.containsKey("connection-timeout"))
            rmq.setConnectionTimeout(toInt(map.get("connection-timeout"), 10_000));
        if (map.containsKey("heartbeat")) rmq.setHeartbeat(toInt(map.get("heartbeat"), 30));
        if (map.containsKey("prefetch-count")) rmq.setPrefetchCount(toInt(map.get("prefetch-count"), 10));
    }

    private static void parseTopology(Map<String, Object> map, MessagingConfig.TopologyConfig topology) {
        for (Map<String, Object> item : getListOfMaps(map, "delayed")) {
            var delayed = new MessagingConfig.DelayedConfig();
            delayed.setDelayExchange(required(item, "delay-exchange", "delayed"));
            delayed.setDelayQueue(required(item, "delay-queue", "delayed"));
            delayed.setActualExchange(required(item, "actual-exchange", "delayed"));
            delayed.setActualRoutingKey(required(item, "actual-routing-key", "delayed"));
            topology.getDelayed().add(delayed);
        }

        for (Map<String, Object> item : getListOfMaps(map, "exchanges")) {
            var exchange = new MessagingConfig.ExchangeConfig();
            exchange.setName(required(item, "name", "exchanges"));
            if (item.containsKey("type")) exchange.setType(String.valueOf(item.get("type")));
            if (item.containsKey("durable")) exchange.setDurable(Boolean.parseBoolean(String.valueOf(item.get("durable"))));
            if (item.containsKey("auto-delete"))
                exchange.setAutoDelete(Boolean.parseBoolean(String.valueOf(item.get("auto-delete"))));
            if (item.containsKey("internal")) exchange.setInternal(Boolean.parseBoolean(String.valueOf(item.get("internal"))));
            topology.getExchanges().add(exchange);
        }

        for (Map<String, Object> item : getListOfMaps(map, "queues")) {
            var queue = new MessagingConfig.QueueConfig();
            queue.setName(required(item, "name", "queues"));
            if (item.containsKey("durable")) queue.setDurable(Boolean.parseBoolean(String.valueOf(item.get("durable"))));
            if (item.containsKey("auto-delete"))
                queue.setAutoDelete(Boolean.parseBoolean(String.valueOf(item.get("auto-delete"))));
            if (item.containsKey("exclusive")) queue.setExclusive(Boolean.parseBoolean(String.valueOf(item.get("exclusive"))));
            if (item.containsKey("dead-letter-exchange"))
                queue.setDeadLetterExchange(toStringOrNull(item.get("dead-letter-exchange")));
            if (item.containsKey("dead-letter-routing-key"))
                queue.setDeadLetterRoutingKey(toStringOrNull(item.get("dead-letter-routing-key")));
            topology.getQueues().add(queue);
        }

        for (Map<String, Object> item : getListOfMaps(map, "bindings")) {
            var binding = new MessagingConfig.BindingConfig();
            binding.setQueue(required(item, "queue", "bindings"));
            binding.setExchange(required(item, "exchange", "bindings"));
            if (item.containsKey("routing-key")) binding.setRoutingKey(String.valueOf(item.get("routing-key")));
            topology.getBindings().add(binding);
        }
    }

    static void applyEnvironment(MessagingConfig config, Map<String, String> env) {
        MessagingConfig.RabbitmqConfig rmq = config.getRabbitmq();
        if (isBlank(rmq.getUrl()) && !isBlank(env.get(ENV_URL))) {
            rmq.setUrl(env.get(ENV_URL).trim());
        }
        String useTls = env.get(ENV_USE_TLS);
        if (!rmq.isUseTls() && useTls != null) {
            rmq.setUseTls("true".equalsIgnoreCase(useTls.trim()) || "1".equals(useTls.trim()));
        }
        if (isBlank(rmq.getCertPath()) && !isBlank(env.get(ENV_CERT_PATH))) {
            rmq.setCertPath(env.get(ENV_CERT_PATH).trim());
        }
    }

    // ========== Utility ==========

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        throw new IllegalArgumentException("Missing or invalid key: " + key);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMapOrEmpty(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        return new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> getListOfMaps(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val == null) return List.of();
        if (!(val instanceof List<?> list)) {
            throw new IllegalArgumentException("Expected a list for key: " + key);
        }
        for (Object item : list) {
            if (!(item instanceof Map)) {
                throw new IllegalArgumentException("Expected a list of mappings for key: " + key);
            }
        }
        return (List<Map<String, Object>>) val;
    }

    private static String required(Map<String, Object> map, String key, String section) {
        String val = toStringOrNull(map.get(key));
        if (isBlank(val)) {
            throw new IllegalArgumentException("Missing '" + key + "' in topology." + section);
        }
        return val;
    }

    private static String toStringOrNull(Object val) {
        return val == null ? null : String.valueOf(val);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static int toInt(Object val, int defaultVal) {
        if (val == null) return defaultVal;
        if (val instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(val));
        } catch (NumberFormatException e) {
            return defaultVal;
        }
    }

    /**
     * Parse simple duration strings: "5s", "30m", "1h", "500ms".
     * Falls back to seconds if no unit specified.
     */
    static Duration parseDuration(String str) {
        if (str == null || str.isBlank()) return Duration.ofMinutes(5);
        str = str.trim().toLowerCase();
        if (str.endsWith("ms")) return Duration.ofMillis(Long.parseLong(str.replace("ms", "").trim()));
        if (str.endsWith("s")) return Duration.ofSeconds(Long.parseLong(str.replace("s", "").trim()));
        if (str.endsWith("m")) return Duration.ofMinutes(Long.parseLong(str.replace("m", "").trim()));
        if (str.endsWith("h")) return Duration.ofHours(Long.parseLong(str.replace("h", "").trim()));
        return Duration.ofSeconds(Long.parseLong(str));
    }
}
