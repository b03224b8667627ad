package com.mwc.messaging.manager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mwc.messaging.config.MessagingConfig;
import com.mwc.messaging.config.MessagingConfig.BindingConfig;
import com.mwc.messaging.config.MessagingConfig.DelayedConfig;
import com.mwc.messaging.config.MessagingConfig.ExchangeConfig;
import com.mwc.messaging.config.MessagingConfig.QueueConfig;
import com.mwc.messaging.config.MessagingConfig.TopologyConfig;
import com.mwc.messaging.config.MessagingConfigLoader;
import com.mwc.messaging.notification.UnreadMessageNotifier;
import com.mwc.messaging.transport.ConnectionException;
import com.mwc.messaging.transport.ConsumerLoop;
import com.mwc.messaging.transport.DeliveryHandler;
import com.mwc.messaging.transport.ExchangeType;
import com.mwc.messaging.transport.MessageQueueService;
import com.mwc.messaging.transport.NoopMessageQueueService;
import com.mwc.messaging.transport.PublishException;
import com.mwc.messaging.transport.QueueArguments;
import com.mwc.messaging.transport.TransportException;
import com.mwc.messaging.transport.rabbitmq.RabbitMQConfig;
import com.mwc.messaging.transport.rabbitmq.RabbitMQService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main entry point of the messaging library.
 *
 * <p>Owns the single {@link MessageQueueService} of the process: connects at
 * {@link #start()}, declares the configured topology, starts the registered
 * consumers and releases everything on {@link #close()}. When the broker is
 * not configured, or unreachable and {@code fail-fast} is off, the manager runs
 * on a {@link NoopMessageQueueService} so the rest of the application keeps
 * working without messaging.</p>
 *
 * <h3>Usage with YAML config:</h3>
 * <pre>
 * var manager = MessagingManager.fromYaml(Path.of("messaging.yml"));
 * manager.subscribe("q.orders", "order-worker", delivery -&gt; handle(delivery.body()));
 * manager.start();
 * manager.publishJson("orders.exchange", "orders.created", order, 0);
 * // ...
 * manager.close();
 * </pre>
 *
 * <h3>Custom service:</h3>
 * <pre>
 * manager.setService(new InMemoryMessageQueueService());
 * manager.start();
 * </pre>
 */
public class MessagingManager implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(MessagingManager.class);

    private final MessagingConfig config;
    private final ObjectMapper objectMapper;

    /** consumerTag → subscription registered before or after start */
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    private volatile MessageQueueService service;
    private volatile UnreadMessageNotifier unreadMessageNotifier;
    private volatile boolean running = false;

    // ========== Factory methods ==========

    public static MessagingManager fromYaml(Path path) {
        try {
            return new MessagingManager(MessagingConfigLoader.fromYaml(path));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config from " + path, e);
        }
    }

    public static MessagingManager fromClasspath(String resource) {
        return new MessagingManager(MessagingConfigLoader.fromClasspath(resource));
    }

    public static MessagingManager fromEnvironment() {
        return new MessagingManager(MessagingConfigLoader.fromEnvironment());
    }

    // ========== Constructor ==========

    public MessagingManager(MessagingConfig config) {
        this(config, new ObjectMapper());
    }

    public MessagingManager(MessagingConfig config, ObjectMapper objectMapper) {
        this.config = Objects.requireNonNull(config, "config");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    // ========== Service management ==========

    /**
     * Override the message queue service instead of connecting to RabbitMQ.
     * Must be called before {@link #start()}.
     */
    public synchronized void setService(MessageQueueService service) {
        if (running) {
            throw new IllegalStateException("Cannot replace the message queue service while running");
        }
        MessageQueueService old = this.service;
        this.service = service;
        if (old != null && old != service) {
            old.close();
        }
    }

    // ========== Lifecycle ==========

    public synchronized void start() {
        if (running) {
            log.warn("MessagingManager is already running");
            return;
        }
        if (!config.isEnabled()) {
            log.info("Messaging is disabled by configuration");
            if (service == null) {
                service = new NoopMessageQueueService();
            }
            running = true;
            return;
        }

        log.info("Starting messaging...");

        if (service == null) {
            service = connect();
        }

        try {
            declareTopology(service, config.getTopology());
        } catch (TransportException e) {
            log.error("Failed to declare messaging topology: {}", e.getMessage());
            closeQuietly(service);
            service = null;
            throw e;
        }

        if (service.isInitialized()) {
            for (Subscription subscription : subscriptions.values()) {
                try {
                    service.consume(subscription.queueName(), subscription.consumerTag(), subscription.handler());
                } catch (TransportException e) {
                    log.error("Failed to start consumer for queue {} (tag {}): {}",
                            subscription.queueName(), subscription.consumerTag(), e.getMessage(), e);
                }
            }
        } else if (!subscriptions.isEmpty()) {
            log.warn("Message queue not initialized, {} consumer(s) will not be started", subscriptions.size());
        }

        running = true;
        log.info("Messaging started (initialized: {}, active consumers: {})",
                service.isInitialized(), service.getActiveConsumerCount());
    }

    public synchronized void stop() {
        if (!running) return;
        running = false;
        unreadMessageNotifier = null;

        MessageQueueService current = service;
        service = null;
        if (current != null) {
            try {
                current.close();
            } catch (TransportException e) {
                log.warn("Error closing message queue service: {}", e.getMessage());
            }
        }
        log.info("Messaging stopped");
    }

    @Override
    public void close() {
        stop();
    }

    // ========== Consumers ==========

    /**
     * Register a consumer. Started immediately when the manager is running,
     * otherwise at {@link #start()}.
     *
     * @return the consumer tag, generated when {@code consumerTag} is blank
     */
    public synchronized String subscribe(String queueName, String consumerTag, DeliveryHandler handler) {
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(handler, "handler");
        String tag = ConsumerLoop.resolveTag(consumerTag);
        if (subscriptions.containsKey(tag)) {
            throw new IllegalArgumentException("Consumer tag already registered: " + tag);
        }

        if (running) {
            requireService().consume(queueName, tag, handler);
        }
        subscriptions.put(tag, new Subscription(queueName, tag, handler));
        log.info("Registered consumer: queue={}, tag={}", queueName, tag);
        return tag;
    }

    // ========== Publishing ==========

    /**
     * Publish through the running service. Before {@link #start()} or after
     * {@link #stop()} there is no broker, so the message is dropped like on the
     * no-op service.
     */
    public void publish(String exchange, String routingKey, byte[] body, long delayMillis) {
        MessageQueueService current = service;
        if (current == null) {
            log.debug("MessagingManager not running, dropping message for exchange '{}'", exchange);
            return;
        }
        current.publish(exchange, routingKey, body, delayMillis);
    }

    /**
     * Serialize {@code payload} with the manager's {@link ObjectMapper} and publish it.
     *
     * @throws PublishException if the payload cannot be serialized or the publish fails
     */
    public void publishJson(String exchange, String routingKey, Object payload, long delayMillis) {
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new PublishException("failed to serialize payload for exchange '" + exchange + "'", e);
        }
        publish(exchange, routingKey, body, delayMillis);
    }

    /**
     * Notifier for delayed unread-message checks, bound to the running service.
     */
    public UnreadMessageNotifier unreadMessages() {
        UnreadMessageNotifier notifier = unreadMessageNotifier;
        if (notifier == null) {
            synchronized (this) {
                notifier = unreadMessageNotifier;
                if (notifier == null) {
                    notifier = new UnreadMessageNotifier(requireService(), objectMapper, config.getUnreadCheckDelay());
                    unreadMessageNotifier = notifier;
                }
            }
        }
        return notifier;
    }

    // ========== Internal ==========

    private MessageQueueService connect() {
        var rmq = config.getRabbitmq();
        var brokerConfig = new RabbitMQConfig(
                rmq.getUrl(), rmq.isUseTls(), rmq.getCertPath(), rmq.getConnectionName(),
                rmq.getConnectionTimeout(), rmq.getHeartbeat(), rmq.getPrefetchCount()
        );
        try {
            return RabbitMQService.connect(brokerConfig);
        } catch (ConnectionException e) {
            if (config.isFailFast()) {
                throw e;
            }
            log.warn("Failed to initialize RabbitMQ, continuing without messaging: {}", e.getMessage());
            return new NoopMessageQueueService();
        }
    }

    static void declareTopology(MessageQueueService service, TopologyConfig topology) {
        if (topology.isEmpty()) return;
        if (!service.isInitialized()) {
            log.info("Message queue not initialized, skipping topology declaration");
            return;
        }

        for (DelayedConfig delayed : topology.getDelayed()) {
            service.declareDelayedSetup(delayed.getDelayExchange(), delayed.getDelayQueue(),
                    delayed.getActualExchange(), delayed.getActualRoutingKey());
        }
        for (ExchangeConfig exchange : topology.getExchanges()) {
            service.declareExchange(exchange.getName(), ExchangeType.fromString(exchange.getType()),
                    exchange.isDurable(), exchange.isAutoDelete(), exchange.isInternal(), false, null);
        }
        for (QueueConfig queue : topology.getQueues()) {
            Map<String, Object> args = queue.getDeadLetterExchange() == null ? null
                    : QueueArguments.deadLetter(queue.getDeadLetterExchange(), queue.getDeadLetterRoutingKey());
            service.declareQueue(queue.getName(), queue.isDurable(), queue.isAutoDelete(),
                    queue.isExclusive(), false, args);
        }
        for (BindingConfig binding : topology.getBindings()) {
            service.bindQueue(binding.getQueue(), binding.getRoutingKey(), binding.getExchange());
        }

        log.info("Declared topology: {} delayed setup(s), {} exchange(s), {} queue(s), {} binding(s)",
                topology.getDelayed().size(), topology.getExchanges().size(),
                topology.getQueues().size(), topology.getBindings().size());
    }

    private MessageQueueService requireService() {
        MessageQueueService current = service;
        if (current == null) {
            throw new IllegalStateException("MessagingManager is not started");
        }
        return current;
    }

    private static void closeQuietly(MessageQueueService service) {
        try {
            service.close();
        } catch (TransportException e) {
            log.warn("Error closing message queue service: {}", e.getMessage());
        }
    }

    private record Subscription(String queueName, String consumerTag, DeliveryHandler handler) {
    }

    // ========== Status ==========

    public MessageQueueService getService() {
        return service;
    }

    public int getActiveConsumerCount() {
        MessageQueueService current = service;
        return current == null ? 0 : current.getActiveConsumerCount();
    }

    public boolean isConnected() {
        MessageQueueService current = service;
        return current != null && current.isInitialized();
    }

    public boolean isRunning() {
        return running;
    }

    public MessagingConfig getConfig() {
        return config;
    }
}
