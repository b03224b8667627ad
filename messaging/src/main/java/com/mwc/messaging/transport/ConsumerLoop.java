package com.mwc.messaging.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One delivery loop per subscription.
 *
 * <p>The transport pushes deliveries with {@link #offer(Delivery)} from its own
 * callback thread; a dedicated thread takes them in arrival order, runs the
 * handler, and resolves each delivery exactly once: ack on success, reject
 * without requeue on failure. A failed ack or reject is logged and the loop
 * moves on.</p>
 *
 * <p>The loop ends after {@link #finish(String)}, once every delivery queued
 * before it has been handled. It is never restarted.</p>
 */
public class ConsumerLoop {

    private static final Logger log = LoggerFactory.getLogger(ConsumerLoop.class);

    private static final Delivery END = new Delivery("", -1, false, "", "", new byte[0],
            null, null, false, null, null);

    private final String queueName;
    private final String consumerTag;
    private final DeliveryHandler handler;
    private final DeliveryAcknowledger acknowledger;

    private final BlockingQueue<Delivery> inbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private final AtomicLong acked = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    private volatile String stopReason = "unknown";

    public ConsumerLoop(String queueName, String consumerTag,
                        DeliveryHandler handler, DeliveryAcknowledger acknowledger) {
        this.queueName = queueName;
        this.consumerTag = consumerTag;
        this.handler = handler;
        this.acknowledger = acknowledger;
    }

    /**
     * Generate a consumer tag when the caller did not supply one.
     */
    public static String resolveTag(String consumerTag) {
        if (consumerTag == null || consumerTag.isBlank()) {
            return "mwc.ctag-" + UUID.randomUUID();
        }
        return consumerTag;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Consumer loop already started: " + consumerTag);
        }
        Thread thread = new Thread(this::run, "mq-consumer-" + queueName + "-" + consumerTag);
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Queue a delivery for handling. Ignored once the loop has been finished.
     */
    public void offer(Delivery delivery) {
        if (finished.get()) {
            log.warn("Consumer {} on queue {} already stopped, dropping deliveryTag {}",
                    consumerTag, queueName, delivery.deliveryTag());
            return;
        }
        inbox.add(delivery);
    }

    /**
     * Stop the loop after the deliveries already queued. Idempotent.
     */
    public void finish(String reason) {
        if (finished.compareAndSet(false, true)) {
            stopReason = reason;
            inbox.add(END);
            if (!started.get()) {
                terminated.countDown();
            }
        }
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isRunning() {
        return started.get() && terminated.getCount() > 0;
    }

    public String getQueueName() { return queueName; }

    public String getConsumerTag() { return consumerTag; }

    public long getAckedCount() { return acked.get(); }

    public long getRejectedCount() { return rejected.get(); }

    private void run() {
        try {
            while (true) {
                Delivery delivery = inbox.take();
                if (delivery == END) {
                    break;
                }
                process(delivery);
            }
        } catch (InterruptedException e) {
            stopReason = "interrupted";
            Thread.currentThread().interrupt();
        } finally {
            log.info("Consumer for queue {} (tag {}) has stopped: {}", queueName, consumerTag, stopReason);
            terminated.countDown();
        }
    }

    private void process(Delivery delivery) {
        long tag = delivery.deliveryTag();
        log.debug("Received message on queue {}, deliveryTag {}", queueName, tag);

        // errors too: an escaping Throwable would end the loop with the delivery unresolved
        Throwable failure = null;
        try {
            handler.handle(delivery);
        } catch (Throwable t) {
            failure = t;
        }

        if (failure == null) {
            try {
                acknowledger.ack(tag);
                acked.incrementAndGet();
                log.debug("Processed message (deliveryTag {}) from queue {}, acked", tag, queueName);
            } catch (Exception e) {
                log.error("Error acking message (deliveryTag {}) on queue {}: {}", tag, queueName, e.getMessage());
            }
        } else {
            log.error("Error processing message (deliveryTag {}) from queue {}: {}. Rejecting without requeue.",
                    tag, queueName, failure.getMessage(), failure);
            try {
                acknowledger.reject(tag, false);
                rejected.incrementAndGet();
            } catch (Exception e) {
                log.error("Error rejecting message (deliveryTag {}) on queue {}: {}", tag, queueName, e.getMessage());
            }
        }
    }
}
