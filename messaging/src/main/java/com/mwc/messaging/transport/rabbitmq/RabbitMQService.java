package com.mwc.messaging.transport.rabbitmq;

import com.mwc.messaging.transport.ConnectionException;
import com.mwc.messaging.transport.ConsumeException;
import com.mwc.messaging.transport.ConsumerLoop;
import com.mwc.messaging.transport.DelayedDeliveryTopology;
import com.mwc.messaging.transport.Delivery;
import com.mwc.messaging.transport.DeliveryAcknowledger;
import com.mwc.messaging.transport.DeliveryHandler;
import com.mwc.messaging.transport.ExchangeType;
import com.mwc.messaging.transport.MessageQueueService;
import com.mwc.messaging.transport.NoopMessageQueueService;
import com.mwc.messaging.transport.NotInitializedException;
import com.mwc.messaging.transport.PublishException;
import com.mwc.messaging.transport.QueueInfo;
import com.mwc.messaging.transport.TopologyException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * RabbitMQ implementation of {@link MessageQueueService}.
 *
 * <p>Owns exactly one {@link Connection} and one {@link Channel}. A channel must
 * not be used by several threads at once, so every command issued on it
 * (declare, publish, consume, ack, nack, close) is serialized on a single lock.
 * Publishers on different threads therefore share the channel one at a time.</p>
 *
 * <p>Each {@link #consume} call registers a manual-ack consumer whose callback
 * feeds a {@link ConsumerLoop}; the loop ends when the channel shuts down or
 * the broker cancels the consumer.</p>
 *
 * <p>Automatic connection recovery is disabled: a lost connection ends the
 * consumer loops and leaves the service uninitialized. Reconnecting is up to
 * the application.</p>
 */
public class RabbitMQService implements MessageQueueService {

    private static final Logger log = LoggerFactory.getLogger(RabbitMQService.class);

    static final String CONTENT_TYPE = "application/json";
    static final int PERSISTENT_DELIVERY_MODE = 2;

    private final Object channelLock = new Object();

    /** consumerTag → running loop */
    private final Map<String, ConsumerLoop> consumers = new ConcurrentHashMap<>();

    private volatile Connection connection;
    private volatile Channel channel;

    public RabbitMQService(Connection connection, Channel channel) {
        this.connection = connection;
        this.channel = channel;
    }

    // ========== Connection lifecycle ==========

    /**
     * Connect to the broker described by {@code config}.
     *
     * @return a connected service, or a {@link NoopMessageQueueService} when no URI is configured
     * @throws ConnectionException if the connection or channel cannot be opened
     */
    public static MessageQueueService connect(RabbitMQConfig config) {
        if (config == null || !config.isConfigured()) {
            log.info("RabbitMQ URL is empty, message queue will be a no-op");
            return new NoopMessageQueueService();
        }
        return connect(createConnectionFactory(config), config);
    }

    static RabbitMQService connect(ConnectionFactory factory, RabbitMQConfig config) {
        Connection conn;
        try {
            conn = factory.newConnection(config.connectionName());
        } catch (IOException | TimeoutException e) {
            throw new ConnectionException("failed to connect to RabbitMQ", e);
        }

        Channel ch;
        try {
            ch = conn.createChannel();
            if (ch == null) {
                throw new IOException("no channel number available");
            }
            if (config.prefetchCount() > 0) {
                ch.basicQos(config.prefetchCount());
            }
        } catch (IOException | ShutdownSignalException e) {
            closeQuietly(conn);
            throw new ConnectionException("failed to open a channel", e);
        }

        log.info("Connected to RabbitMQ: connection={}, channel={}",
                config.connectionName(), ch.getChannelNumber());
        return new RabbitMQService(conn, ch);
    }

    static ConnectionFactory createConnectionFactory(RabbitMQConfig config) {
        ConnectionFactory factory = new ConnectionFactory();
        try {
            factory.setUri(config.uri());
        } catch (URISyntaxException | GeneralSecurityException | IllegalArgumentException e) {
            // the URI carries credentials, keep it out of the message
            throw new ConnectionException("invalid RabbitMQ URL", e);
        }
        factory.setConnectionTimeout(config.connectionTimeout());
        factory.setRequestedHeartbeat(config.heartbeat());
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);

        if (config.useTls() || config.uri().startsWith("amqps://")) {
            try {
                factory.useSslProtocol(createSslContext(config.certPath()));
                factory.enableHostnameVerification();
            } catch (IOException | GeneralSecurityException e) {
                throw new ConnectionException("failed to configure TLS for RabbitMQ", e);
            }
        }
        return factory;
    }

    /**
     * TLS context trusting the CA certificate at {@code certPath}, or the JVM
     * default trust store when no path is given.
     */
    static SSLContext createSslContext(String certPath) throws IOException, GeneralSecurityException {
        if (certPath == null || certPath.isBlank()) {
            return SSLContext.getDefault();
        }
        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustStore.load(null, null);
        try (InputStream is = Files.newInputStream(Path.of(certPath))) {
            CertificateFactory cf = CertificateFactory.getInstance("X.509");
            int i = 0;
            for (Certificate cert : cf.generateCertificates(is)) {
                trustStore.setCertificateEntry("mq-ca-" + i++, cert);
            }
        }
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);
        SSLContext context = SSLContext.getInstance("TLSv1.2");
        context.init(null, tmf.getTrustManagers(), null);
        return context;
    }

    @Override
    public boolean isInitialized() {
        Connection conn = connection;
        Channel ch = channel;
        return conn != null && ch != null && conn.isOpen() && ch.isOpen();
    }

    @Override
    public void close() {
        synchronized (channelLock) {
            Channel ch = channel;
            Connection conn = connection;
            channel = null;
            connection = null;

            if (ch != null) {
                try {
                    ch.close();
                    log.info("RabbitMQ channel closed");
                } catch (IOException | TimeoutException | ShutdownSignalException e) {
                    // keep going, the connection still has to be released
                    log.warn("Error closing RabbitMQ channel: {}", e.getMessage());
                }
            }

            for (ConsumerLoop loop : consumers.values()) {
                loop.finish("service closed");
            }
            consumers.clear();

            if (conn != null) {
                try {
                    conn.close();
                    log.info("RabbitMQ connection closed");
                } catch (AlreadyClosedException e) {
                    log.debug("RabbitMQ connection was already closed: {}", e.getMessage());
                } catch (IOException e) {
                    throw new ConnectionException("failed to close RabbitMQ connection", e);
                }
            }
        }
    }

    // ========== Publisher ==========

    @Override
    public void publish(String exchange, String routingKey, byte[] body, long delayMillis) {
        if (!isInitialized()) {
            log.debug("RabbitMQ channel not initialized, skipping publish to exchange={}, routingKey={}",
                    exchange, routingKey);
            return;
        }
        if (exchange == null || routingKey == null) {
            throw new PublishException("failed to publish a message: exchange and routing key are required"
                    + " (\"\" selects the default exchange)");
        }

        AMQP.BasicProperties.Builder props = new AMQP.BasicProperties.Builder()
                .contentType(CONTENT_TYPE)
                .deliveryMode(PERSISTENT_DELIVERY_MODE)
                .timestamp(new Date());
        if (delayMillis > 0) {
            props.expiration(Long.toString(delayMillis));
        }

        try {
            synchronized (channelLock) {
                Channel ch = channel;
                if (ch == null) {
                    log.debug("RabbitMQ channel closed concurrently, skipping publish to exchange={}", exchange);
                    return;
                }
                ch.basicPublish(exchange, routingKey, false, props.build(), body);
            }
        } catch (IOException | ShutdownSignalException e) {
            throw new PublishException("failed to publish a message to exchange '" + exchange
                    + "' with routing key '" + routingKey + "'", e);
        }
        log.debug("Published message to exchange={}, routingKey={}, delayMs={}", exchange, routingKey, delayMillis);
    }

    // ========== Topology ==========

    @Override
    public void declareDelayedSetup(String delayExchange, String delayQueue,
                                    String actualExchange, String actualRoutingKey) {
        DelayedDeliveryTopology.declare(this, delayExchange, delayQueue, actualExchange, actualRoutingKey);
    }

    @Override
    public void declareExchange(String name, ExchangeType type, boolean durable, boolean autoDelete,
                                boolean internal, boolean noWait, Map<String, Object> args) {
        try {
            synchronized (channelLock) {
                Channel ch = requireChannel("declare exchange '" + name + "'");
                if (noWait) {
                    ch.exchangeDeclareNoWait(name, type.getType(), durable, autoDelete, internal, args);
                } else {
                    ch.exchangeDeclare(name, type.getType(), durable, autoDelete, internal, args);
                }
            }
        } catch (IOException | ShutdownSignalException e) {
            throw new TopologyException("failed to declare exchange '" + name + "'", e);
        }
        log.debug("Declared exchange {} ({})", name, type.getType());
    }

    @Override
    public QueueInfo declareQueue(String name, boolean durable, boolean autoDelete, boolean exclusive,
                                  boolean noWait, Map<String, Object> args) {
        try {
            synchronized (channelLock) {
                Channel ch = requireChannel("declare queue '" + name + "'");
                if (noWait) {
                    ch.queueDeclareNoWait(name, durable, exclusive, autoDelete, args);
                    return QueueInfo.unknown(name);
                }
                AMQP.Queue.DeclareOk ok = ch.queueDeclare(name, durable, exclusive, autoDelete, args);
                log.debug("Declared queue {} (messages={}, consumers={})",
                        ok.getQueue(), ok.getMessageCount(), ok.getConsumerCount());
                return new QueueInfo(ok.getQueue(), ok.getMessageCount(), ok.getConsumerCount());
            }
        } catch (IOException | ShutdownSignalException e) {
            throw new TopologyException("failed to declare queue '" + name + "'", e);
        }
    }

    @Override
    public void bindQueue(String queueName, String routingKey, String exchange, boolean noWait,
                          Map<String, Object> args) {
        try {
            synchronized (channelLock) {
                Channel ch = requireChannel("bind queue '" + queueName + "'");
                if (noWait) {
                    ch.queueBindNoWait(queueName, exchange, routingKey, args);
                } else {
                    ch.queueBind(queueName, exchange, routingKey, args);
                }
            }
        } catch (IOException | ShutdownSignalException e) {
            throw new TopologyException("failed to bind queue '" + queueName + "' to exchange '"
                    + exchange + "' with key '" + routingKey + "'", e);
        }
        log.debug("Bound queue {} to exchange {} with key {}", queueName, exchange, routingKey);
    }

    // ========== Consumer runtime ==========

    @Override
    public void consume(String queueName, String consumerTag, DeliveryHandler handler) {
        String tag = ConsumerLoop.resolveTag(consumerTag);

        synchronized (channelLock) {
            Channel ch = requireChannel("consume from queue '" + queueName + "'");
            ConsumerLoop loop = new ConsumerLoop(queueName, tag, handler, new ChannelAcknowledger(ch));
            // registered before basicConsume so a cancel or shutdown callback can always remove it
            if (consumers.putIfAbsent(tag, loop) != null) {
                throw new ConsumeException("consumer tag '" + tag + "' is already in use");
            }
            loop.start();
            try {
                ch.basicConsume(queueName, false, tag, new LoopConsumer(ch, loop));
            } catch (IOException | ShutdownSignalException e) {
                loop.finish("subscription refused");
                consumers.remove(tag, loop);
                throw new ConsumeException("failed to register a consumer for queue '" + queueName + "'", e);
            }
        }
        log.info("Registered consumer for queue {} with tag {}", queueName, tag);
    }

    @Override
    public int getActiveConsumerCount() {
        return (int) consumers.values().stream().filter(ConsumerLoop::isRunning).count();
    }

    ConsumerLoop getConsumerLoop(String consumerTag) {
        return consumers.get(consumerTag);
    }

    private Channel requireChannel(String operation) {
        Channel ch = channel;
        if (connection == null || ch == null || !ch.isOpen()) {
            throw new NotInitializedException(operation);
        }
        return ch;
    }

    private static void closeQuietly(Connection conn) {
        try {
            conn.close();
        } catch (IOException | ShutdownSignalException e) {
            log.debug("Error closing RabbitMQ connection after failed setup: {}", e.getMessage());
        }
    }

    static Delivery toDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties props, byte[] body) {
        String contentType = null;
        Date timestamp = null;
        boolean persistent = false;
        String expiration = null;
        Map<String, Object> headers = null;
        if (props != null) {
            contentType = props.getContentType();
            timestamp = props.getTimestamp();
            persistent = Integer.valueOf(PERSISTENT_DELIVERY_MODE).equals(props.getDeliveryMode());
            expiration = props.getExpiration();
            headers = props.getHeaders();
        }
        return new Delivery(consumerTag, envelope.getDeliveryTag(), envelope.isRedeliver(),
                envelope.getExchange(), envelope.getRoutingKey(), body, contentType,
                timestamp == null ? null : timestamp.toInstant(), persistent, expiration, headers);
    }

    // ========== Inner: channel callbacks ==========

    /** Resolves deliveries on the channel they arrived on. */
    private class ChannelAcknowledger implements DeliveryAcknowledger {
        private final Channel ch;

        ChannelAcknowledger(Channel ch) {
            this.ch = ch;
        }

        @Override
        public void ack(long deliveryTag) throws IOException {
            synchronized (channelLock) {
                ch.basicAck(deliveryTag, false);
            }
        }

        @Override
        public void reject(long deliveryTag, boolean requeue) throws IOException {
            synchronized (channelLock) {
                ch.basicNack(deliveryTag, false, requeue);
            }
        }
    }

    /** Hands deliveries to the loop; never runs business code on the client's dispatch thread. */
    private class LoopConsumer extends DefaultConsumer {
        private final ConsumerLoop loop;

        LoopConsumer(Channel ch, ConsumerLoop loop) {
            super(ch);
            this.loop = loop;
        }

        @Override
        public void handleDelivery(String ct, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            loop.offer(toDelivery(ct, envelope, properties, body));
        }

        @Override
        public void handleCancel(String ct) {
            stop(ct, "consumer cancelled by broker");
        }

        @Override
        public void handleCancelOk(String ct) {
            stop(ct, "consumer cancelled");
        }

        @Override
        public void handleShutdownSignal(String ct, ShutdownSignalException sig) {
            stop(ct, "channel closed: " + sig.getMessage());
        }

        private void stop(String ct, String reason) {
            loop.finish(reason);
            consumers.remove(ct, loop);
        }
    }
}
