package com.mwc.messaging.transport.memory;

import com.mwc.messaging.transport.ConsumeException;
import com.mwc.messaging.transport.ConsumerLoop;
import com.mwc.messaging.transport.DelayedDeliveryTopology;
import com.mwc.messaging.transport.Delivery;
import com.mwc.messaging.transport.DeliveryAcknowledger;
import com.mwc.messaging.transport.DeliveryHandler;
import com.mwc.messaging.transport.ExchangeType;
import com.mwc.messaging.transport.MessageQueueService;
import com.mwc.messaging.transport.NotInitializedException;
import com.mwc.messaging.transport.PublishException;
import com.mwc.messaging.transport.QueueArguments;
import com.mwc.messaging.transport.QueueInfo;
import com.mwc.messaging.transport.TopologyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Broker-less {@link MessageQueueService} that keeps exchanges, queues and
 * messages in memory.
 *
 * <p>Follows the RabbitMQ rules the rest of the code relies on:</p>
 * <ul>
 *   <li>re-declaring an exchange or queue with the same attributes is a no-op,
 *       with different attributes a {@link TopologyException}; bindings are a set</li>
 *   <li>direct, topic and fanout routing, plus the default exchange ({@code ""})
 *       routing to the queue named by the key; headers exchanges route nothing</li>
 *   <li>per-message expiration counted from enqueue, applied only at the head
 *       of the queue and only while the message waits for a consumer</li>
 *   <li>expired and rejected messages go to the queue's dead-letter exchange,
 *       without their expiration, and never back into the queue they left</li>
 *   <li>manual ack: a delivery tag can be resolved once; closing the service
 *       returns unacknowledged messages to their queues as redelivered</li>
 * </ul>
 *
 * <p>All broker state is guarded by one lock. Expiry runs on a single
 * scheduler thread and each subscription has its own {@link ConsumerLoop}.</p>
 */
public class InMemoryMessageQueueService implements MessageQueueService {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageQueueService.class);

    static final String CONTENT_TYPE = "application/json";

    private final Object lock = new Object();

    private final Map<String, MemoryExchange> exchanges = new HashMap<>();
    private final Map<String, MemoryQueue> queues = new HashMap<>();
    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();

    /** deliveryTag → message handed to a consumer and not yet resolved */
    private final Map<Long, Unacked> unacked = new HashMap<>();

    private final AtomicLong deliveryTags = new AtomicLong();
    private final ScheduledExecutorService expiry;

    private volatile boolean open = true;

    public InMemoryMessageQueueService() {
        this.expiry = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "mq-memory-expiry");
            t.setDaemon(true);
            return t;
        });
    }

    // ========== Topology ==========

    @Override
    public void declareExchange(String name, ExchangeType type, boolean durable, boolean autoDelete,
                                boolean internal, boolean noWait, Map<String, Object> args) {
        synchronized (lock) {
            requireOpen("declare exchange '" + name + "'");
            if (name == null || name.isEmpty() || name.startsWith("amq.")) {
                throw new TopologyException("failed to declare exchange '" + name + "': name is reserved");
            }
            var decl = new ExchangeDecl(type, durable, autoDelete, internal, QueueArguments.normalize(args));
            MemoryExchange existing = exchanges.get(name);
            if (existing != null) {
                if (!existing.decl.equals(decl)) {
                    throw new TopologyException("failed to declare exchange '" + name
                            + "': inequivalent arguments, existing " + existing.decl + ", requested " + decl);
                }
                return;
            }
            exchanges.put(name, new MemoryExchange(decl));
        }
        log.debug("Declared exchange {} ({})", name, type.getType());
    }

    @Override
    public QueueInfo declareQueue(String name, boolean durable, boolean autoDelete, boolean exclusive,
                                  boolean noWait, Map<String, Object> args) {
        String queueName = (name == null || name.isEmpty()) ? "amq.gen-" + UUID.randomUUID() : name;
        synchronized (lock) {
            requireOpen("declare queue '" + queueName + "'");
            var decl = new QueueDecl(durable, autoDelete, exclusive, QueueArguments.normalize(args));
            MemoryQueue queue = queues.get(queueName);
            if (queue == null) {
                queue = new MemoryQueue(queueName, decl);
                queues.put(queueName, queue);
                log.debug("Declared queue {}", queueName);
            } else if (!queue.decl.equals(decl)) {
                throw new TopologyException("failed to declare queue '" + queueName
                        + "': inequivalent arguments, existing " + queue.decl + ", requested " + decl);
            }
            return noWait ? QueueInfo.unknown(queueName)
                    : new QueueInfo(queueName, queue.ready.size(), queue.subscriptions.size());
        }
    }

    @Override
    public void bindQueue(String queueName, String routingKey, String exchange, boolean noWait,
                          Map<String, Object> args) {
        synchronized (lock) {
            requireOpen("bind queue '" + queueName + "'");
            MemoryExchange ex = exchanges.get(exchange);
            if (ex == null) {
                throw new TopologyException("failed to bind queue '" + queueName + "': no exchange '" + exchange + "'");
            }
            if (!queues.containsKey(queueName)) {
                throw new TopologyException("failed to bind queue '" + queueName + "': no such queue");
            }
            ex.bindings.add(new Binding(queueName, routingKey == null ? "" : routingKey));
        }
        log.debug("Bound queue {} to exchange {} with key {}", queueName, exchange, routingKey);
    }

    @Override
    public void declareDelayedSetup(String delayExchange, String delayQueue,
                                    String actualExchange, String actualRoutingKey) {
        DelayedDeliveryTopology.declare(this, delayExchange, delayQueue, actualExchange, actualRoutingKey);
    }

    // ========== Publisher ==========

    @Override
    public void publish(String exchange, String routingKey, byte[] body, long delayMillis) {
        if (!open) {
            log.debug("In-memory queue closed, skipping publish to exchange={}, routingKey={}", exchange, routingKey);
            return;
        }
        if (exchange == null || routingKey == null) {
            throw new PublishException("failed to publish a message: exchange and routing key are required"
                    + " (\"\" selects the default exchange)");
        }
        var message = new StoredMessage(exchange, routingKey, body == null ? new byte[0] : body.clone(),
                CONTENT_TYPE, Instant.now(), true, delayMillis > 0 ? Long.toString(delayMillis) : null,
                Map.of(), false);

        synchronized (lock) {
            if (!exchange.isEmpty()) {
                MemoryExchange ex = exchanges.get(exchange);
                if (ex == null) {
                    throw new PublishException("failed to publish a message: no exchange '" + exchange + "'");
                }
                if (ex.decl.internal()) {
                    throw new PublishException("failed to publish a message: exchange '" + exchange + "' is internal");
                }
            }
            Set<String> targets = route(exchange, routingKey);
            if (targets.isEmpty()) {
                log.debug("Unroutable message dropped: exchange={}, routingKey={}", exchange, routingKey);
            }
            for (String target : targets) {
                enqueue(queues.get(target), message);
            }
        }
        log.debug("Published message to exchange={}, routingKey={}, delayMs={}", exchange, routingKey, delayMillis);
    }

    // ========== Consumer runtime ==========

    @Override
    public void consume(String queueName, String consumerTag, DeliveryHandler handler) {
        String tag = ConsumerLoop.resolveTag(consumerTag);
        synchronized (lock) {
            requireOpen("consume from queue '" + queueName + "'");
            MemoryQueue queue = queues.get(queueName);
            if (queue == null) {
                throw new ConsumeException("failed to register a consumer for queue '" + queueName + "': no such queue");
            }
            if (subscriptions.containsKey(tag)) {
                throw new ConsumeException("consumer tag '" + tag + "' is already in use");
            }
            var loop = new ConsumerLoop(queueName, tag, handler, new MemoryAcknowledger());
            loop.start();
            var subscription = new Subscription(tag, loop);
            subscriptions.put(tag, subscription);
            queue.subscriptions.add(subscription);
            dispatch(queue);
        }
        log.info("Registered consumer for queue {} with tag {}", queueName, tag);
    }

    @Override
    public int getActiveConsumerCount() {
        synchronized (lock) {
            return (int) subscriptions.values().stream().filter(s -> s.loop.isRunning()).count();
        }
    }

    // ========== Lifecycle ==========

    @Override
    public boolean isInitialized() {
        return open;
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (!open) return;
            open = false;

            // highest tag first so addFirst restores the original order
            List<Map.Entry<Long, Unacked>> pending = new ArrayList<>(unacked.entrySet());
            pending.sort(Map.Entry.<Long, Unacked>comparingByKey(Comparator.reverseOrder()));
            for (Map.Entry<Long, Unacked> entry : pending) {
                MemoryQueue queue = queues.get(entry.getValue().queueName());
                if (queue != null) {
                    queue.ready.addFirst(new QueuedMessage(entry.getValue().message().asRedelivered(), -1));
                }
            }
            unacked.clear();

            for (Subscription subscription : subscriptions.values()) {
                subscription.loop.finish("service closed");
            }
            subscriptions.clear();
            for (MemoryQueue queue : queues.values()) {
                queue.subscriptions.clear();
                queue.cancelTimer();
            }
        }
        expiry.shutdownNow();
        log.info("In-memory message queue closed");
    }

    // ========== Inspection ==========

    public Set<String> getExchangeNames() {
        synchronized (lock) {
            return Set.copyOf(exchanges.keySet());
        }
    }

    public Set<String> getQueueNames() {
        synchronized (lock) {
            return Set.copyOf(queues.keySet());
        }
    }

    public Set<Binding> getBindings(String exchange) {
        synchronized (lock) {
            MemoryExchange ex = exchanges.get(exchange);
            return ex == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(ex.bindings));
        }
    }

    public Map<String, Object> getQueueArguments(String queueName) {
        synchronized (lock) {
            MemoryQueue queue = queues.get(queueName);
            return queue == null ? Map.of() : queue.decl.args();
        }
    }

    /**
     * @return messages waiting in {@code queueName} that have not been handed to a consumer
     */
    public int getReadyCount(String queueName) {
        synchronized (lock) {
            MemoryQueue queue = queues.get(queueName);
            return queue == null ? 0 : queue.ready.size();
        }
    }

    public int getUnackedCount() {
        synchronized (lock) {
            return unacked.size();
        }
    }

    // ========== Internal (callers hold the lock) ==========

    private void requireOpen(String operation) {
        if (!open) {
            throw new NotInitializedException(operation);
        }
    }

    private Set<String> route(String exchange, String routingKey) {
        Set<String> targets = new LinkedHashSet<>();
        if (exchange.isEmpty()) {
            if (queues.containsKey(routingKey)) {
                targets.add(routingKey);
            }
            return targets;
        }
        MemoryExchange ex = exchanges.get(exchange);
        if (ex == null) {
            return targets;
        }
        for (Binding binding : ex.bindings) {
            boolean matches = switch (ex.decl.type()) {
                case DIRECT -> binding.routingKey().equals(routingKey);
                case FANOUT -> true;
                case TOPIC -> topicMatches(routingKey, binding.routingKey());
                case HEADERS -> false;
            };
            if (matches && queues.containsKey(binding.queue())) {
                targets.add(binding.queue());
            }
        }
        return targets;
    }

    private void enqueue(MemoryQueue queue, StoredMessage message) {
        long deadline = -1;
        if (message.expiration() != null) {
            deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Long.parseLong(message.expiration()));
        }
        queue.ready.addLast(new QueuedMessage(message, deadline));
        dispatch(queue);
        scheduleExpiry(queue);
    }

    private void dispatch(MemoryQueue queue) {
        while (!queue.ready.isEmpty() && !queue.subscriptions.isEmpty()) {
            QueuedMessage head = queue.ready.pollFirst();
            if (head.isExpired(System.nanoTime())) {
                deadLetter(queue, head.message(), "expired");
                continue;
            }
            Subscription subscription = queue.nextSubscription();
            long tag = deliveryTags.incrementAndGet();
            StoredMessage message = head.message();
            unacked.put(tag, new Unacked(queue.name, message));
            subscription.loop.offer(new Delivery(subscription.tag, tag, message.redelivered(),
                    message.exchange(), message.routingKey(), message.body(), message.contentType(),
                    message.timestamp(), message.persistent(), message.expiration(), message.headers()));
        }
    }

    private void scheduleExpiry(MemoryQueue queue) {
        QueuedMessage head = queue.ready.peekFirst();
        if (head == null || head.deadline() < 0 || !open) {
            return;
        }
        if (queue.timer != null && !queue.timer.isDone()) {
            if (queue.timerDeadline <= head.deadline()) {
                return;
            }
            queue.timer.cancel(false);
        }
        long delay = Math.max(0, head.deadline() - System.nanoTime());
        queue.timerDeadline = head.deadline();
        queue.timer = expiry.schedule(() -> expireHead(queue.name), delay, TimeUnit.NANOSECONDS);
    }

    private void expireHead(String queueName) {
        synchronized (lock) {
            MemoryQueue queue = queues.get(queueName);
            if (!open || queue == null) {
                return;
            }
            queue.timer = null;
            long now = System.nanoTime();
            while (!queue.ready.isEmpty() && queue.ready.peekFirst().isExpired(now)) {
                deadLetter(queue, queue.ready.pollFirst().message(), "expired");
            }
            scheduleExpiry(queue);
        }
    }

    private void deadLetter(MemoryQueue source, StoredMessage message, String reason) {
        String dlx = QueueArguments.deadLetterExchange(source.decl.args());
        if (dlx == null) {
            log.debug("Message {} in queue {} discarded, no dead-letter exchange", reason, source.name);
            return;
        }
        String dlk = QueueArguments.deadLetterRoutingKey(source.decl.args());
        String routingKey = dlk != null ? dlk : message.routingKey();

        Map<String, Object> headers = new LinkedHashMap<>(message.headers());
        headers.putIfAbsent("x-first-death-reason", reason);
        headers.putIfAbsent("x-first-death-queue", source.name);
        headers.putIfAbsent("x-first-death-exchange", message.exchange());
        var dead = new StoredMessage(dlx, routingKey, message.body(), message.contentType(),
                message.timestamp(), message.persistent(), null, Collections.unmodifiableMap(headers), false);

        if (!dlx.isEmpty() && !exchanges.containsKey(dlx)) {
            log.warn("Dead-letter exchange {} of queue {} does not exist, message dropped", dlx, source.name);
            return;
        }
        Set<String> targets = route(dlx, routingKey);
        if (targets.remove(source.name)) {
            log.warn("Dead-letter route of queue {} leads back to itself, skipping that target", source.name);
        }
        for (String target : targets) {
            enqueue(queues.get(target), dead);
        }
        log.debug("Dead-lettered {} message from queue {} to exchange={}, routingKey={} ({} queues)",
                reason, source.name, dlx, routingKey, targets.size());
    }

    /**
     * AMQP topic match: {@code *} is exactly one word, {@code #} zero or more.
     */
    static boolean topicMatches(String routingKey, String pattern) {
        if (pattern.equals("#")) {
            return true;
        }
        return topicMatches(routingKey.split("\\.", -1), 0, pattern.split("\\.", -1), 0);
    }

    private static boolean topicMatches(String[] words, int w, String[] pattern, int p) {
        if (p == pattern.length) {
            return w == words.length;
        }
        if (pattern[p].equals("#")) {
            for (int i = w; i <= words.length; i++) {
                if (topicMatches(words, i, pattern, p + 1)) {
                    return true;
                }
            }
            return false;
        }
        if (w == words.length) {
            return false;
        }
        return (pattern[p].equals("*") || pattern[p].equals(words[w]))
                && topicMatches(words, w + 1, pattern, p + 1);
    }

    // ========== Inner types ==========

    /**
     * A (queue, routing key) pair bound to an exchange.
     */
    public record Binding(String queue, String routingKey) {}

    private record ExchangeDecl(ExchangeType type, boolean durable, boolean autoDelete, boolean internal,
                                Map<String, Object> args) {}

    private record QueueDecl(boolean durable, boolean autoDelete, boolean exclusive, Map<String, Object> args) {}

    private record StoredMessage(String exchange, String routingKey, byte[] body, String contentType,
                                 Instant timestamp, boolean persistent, String expiration,
                                 Map<String, Object> headers, boolean redelivered) {
        StoredMessage asRedelivered() {
            return new StoredMessage(exchange, routingKey, body, contentType, timestamp, persistent,
                    expiration, headers, true);
        }
    }

    private record QueuedMessage(StoredMessage message, long deadline) {
        boolean isExpired(long now) {
            return deadline >= 0 && deadline <= now;
        }
    }

    private record Unacked(String queueName, StoredMessage message) {}

    private static final class MemoryExchange {
        final ExchangeDecl decl;
        final Set<Binding> bindings = new LinkedHashSet<>();

        MemoryExchange(ExchangeDecl decl) {
            this.decl = decl;
        }
    }

    private static final class MemoryQueue {
        final String name;
        final QueueDecl decl;
        final Deque<QueuedMessage> ready = new ArrayDeque<>();
        final List<Subscription> subscriptions = new ArrayList<>();
        int nextSubscription;
        ScheduledFuture<?> timer;
        long timerDeadline;

        MemoryQueue(String name, QueueDecl decl) {
            this.name = name;
            this.decl = decl;
        }

        Subscription nextSubscription() {
            Subscription s = subscriptions.get(nextSubscription % subscriptions.size());
            nextSubscription = (nextSubscription + 1) % subscriptions.size();
            return s;
        }

        void cancelTimer() {
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
        }
    }

    private record Subscription(String tag, ConsumerLoop loop) {}

    class MemoryAcknowledger implements DeliveryAcknowledger {

        @Override
        public void ack(long deliveryTag) {
            synchronized (lock) {
                resolve(deliveryTag, "ack");
            }
        }

        @Override
        public void reject(long deliveryTag, boolean requeue) {
            synchronized (lock) {
                Unacked pending = resolve(deliveryTag, "reject");
                MemoryQueue queue = queues.get(pending.queueName());
                if (queue == null) {
                    return;
                }
                if (requeue) {
                    queue.ready.addFirst(new QueuedMessage(pending.message().asRedelivered(), -1));
                    dispatch(queue);
                } else {
                    deadLetter(queue, pending.message(), "rejected");
                }
            }
        }

        private Unacked resolve(long deliveryTag, String operation) {
            requireOpen(operation + " deliveryTag " + deliveryTag);
            Unacked pending = unacked.remove(deliveryTag);
            if (pending == null) {
                throw new IllegalStateException("unknown delivery tag " + deliveryTag);
            }
            return pending;
        }
    }
}
