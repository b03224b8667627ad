package com.mwc.messaging.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Stand-in used when no broker URL is configured or the broker is unreachable
 * at startup. Publishing is silently skipped; anything that needs a broker to
 * have an effect fails with {@link NotInitializedException}.
 */
public final class NoopMessageQueueService implements MessageQueueService {

    private static final Logger log = LoggerFactory.getLogger(NoopMessageQueueService.class);

    @Override
    public void publish(String exchange, String routingKey, byte[] body, long delayMillis) {
        log.debug("Message queue not initialized, skipping publish to exchange={}, routingKey={}",
                exchange, routingKey);
    }

    @Override
    public void consume(String queueName, String consumerTag, DeliveryHandler handler) {
        log.warn("Message queue not initialized, cannot consume from queue {}", queueName);
        throw new NotInitializedException("consume from queue '" + queueName + "'");
    }

    @Override
    public void declareDelayedSetup(String delayExchange, String delayQueue,
                                    String actualExchange, String actualRoutingKey) {
        DelayedDeliveryTopology.declare(this, delayExchange, delayQueue, actualExchange, actualRoutingKey);
    }

    @Override
    public void declareExchange(String name, ExchangeType type, boolean durable, boolean autoDelete,
                                boolean internal, boolean noWait, Map<String, Object> args) {
        throw new NotInitializedException("declare exchange '" + name + "'");
    }

    @Override
    public QueueInfo declareQueue(String name, boolean durable, boolean autoDelete, boolean exclusive,
                                  boolean noWait, Map<String, Object> args) {
        throw new NotInitializedException("declare queue '" + name + "'");
    }

    @Override
    public void bindQueue(String queueName, String routingKey, String exchange, boolean noWait,
                          Map<String, Object> args) {
        throw new NotInitializedException("bind queue '" + queueName + "'");
    }

    @Override
    public boolean isInitialized() {
        return false;
    }

    @Override
    public void close() {
        // nothing to release
    }
}
