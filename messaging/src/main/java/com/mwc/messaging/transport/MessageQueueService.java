package com.mwc.messaging.transport;

import java.io.Closeable;
import java.util.Map;

/**
 * SPI for the broker that carries asynchronous work between parts of the backend.
 *
 * <p>A service owns one broker connection. Topology is declared up front
 * ({@link #declareExchange}, {@link #declareQueue}, {@link #bindQueue},
 * {@link #declareDelayedSetup}), messages are handed over with
 * {@link #publish}, and {@link #consume} starts a manual-ack delivery loop
 * per subscription.</p>
 *
 * <h3>Uninitialized services:</h3>
 * <p>When no broker is configured, or after {@link #close()}, {@link #isInitialized()}
 * is false. In that state declarations and {@link #consume} throw
 * {@link NotInitializedException}, {@link #declareDelayedSetup} does nothing,
 * and {@link #publish} returns without contacting a broker.</p>
 *
 * <h3>Implementations:</h3>
 * <ul>
 *   <li>{@code RabbitMQService}: AMQP 0-9-1 over a single connection and channel</li>
 *   <li>{@code NoopMessageQueueService}: used when no broker URL is configured</li>
 *   <li>{@code InMemoryMessageQueueService}: broker-less, for tests</li>
 * </ul>
 */
public interface MessageQueueService extends Closeable {

    /**
     * Hand a message to the broker.
     *
     * <p>The message is persistent and timestamped. With {@code delayMillis > 0}
     * its expiration is set to that many milliseconds; route it to a delay
     * exchange declared with {@link #declareDelayedSetup} for the expiry to act
     * as a delay. Success means the broker accepted the frame, not that a
     * consumer received it.</p>
     *
     * @throws PublishException if the broker rejects the publish, or exchange or routing key is null
     */
    void publish(String exchange, String routingKey, byte[] body, long delayMillis);

    default void publish(String exchange, String routingKey, byte[] body) {
        publish(exchange, routingKey, body, 0);
    }

    /**
     * Start a manual-ack subscription on {@code queueName}.
     *
     * @param consumerTag tag identifying the subscription; blank generates one
     * @param handler     invoked sequentially for each delivery
     * @throws NotInitializedException if there is no broker connection
     * @throws ConsumeException        if the broker refuses the subscription
     */
    void consume(String queueName, String consumerTag, DeliveryHandler handler);

    /**
     * Provision a dead-letter based delay: messages published with a TTL to
     * {@code delayExchange} (routing key {@code delayQueue}) wait in
     * {@code delayQueue} and are then routed to {@code actualExchange} with
     * {@code actualRoutingKey}.
     *
     * @throws TopologyException naming the declaration that failed
     */
    void declareDelayedSetup(String delayExchange, String delayQueue,
                             String actualExchange, String actualRoutingKey);

    void declareExchange(String name, ExchangeType type, boolean durable, boolean autoDelete,
                         boolean internal, boolean noWait, Map<String, Object> args);

    default void declareExchange(String name, ExchangeType type, boolean durable) {
        declareExchange(name, type, durable, false, false, false, null);
    }

    QueueInfo declareQueue(String name, boolean durable, boolean autoDelete, boolean exclusive,
                           boolean noWait, Map<String, Object> args);

    default QueueInfo declareQueue(String name, boolean durable, Map<String, Object> args) {
        return declareQueue(name, durable, false, false, false, args);
    }

    void bindQueue(String queueName, String routingKey, String exchange, boolean noWait,
                   Map<String, Object> args);

    default void bindQueue(String queueName, String routingKey, String exchange) {
        bindQueue(queueName, routingKey, exchange, false, null);
    }

    /**
     * @return true only while both the connection and the channel are usable
     */
    boolean isInitialized();

    /**
     * @return number of subscriptions whose delivery loop is still running
     */
    default int getActiveConsumerCount() {
        return 0;
    }

    /**
     * Release the channel and then the connection. Safe to call repeatedly;
     * a closed service cannot be reopened.
     *
     * @throws ConnectionException if closing the connection fails
     */
    @Override
    void close();
}
