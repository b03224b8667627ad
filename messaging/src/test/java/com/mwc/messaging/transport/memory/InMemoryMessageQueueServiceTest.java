package com.mwc.messaging.transport.memory;

import com.mwc.messaging.transport.ConsumeException;
import com.mwc.messaging.transport.Delivery;
import com.mwc.messaging.transport.ExchangeType;
import com.mwc.messaging.transport.NotInitializedException;
import com.mwc.messaging.transport.PublishException;
import com.mwc.messaging.transport.QueueArguments;
import com.mwc.messaging.transport.QueueInfo;
import com.mwc.messaging.transport.TopologyException;
import com.mwc.messaging.transport.memory.InMemoryMessageQueueService.Binding;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@DisplayName("InMemoryMessageQueueService")
class InMemoryMessageQueueServiceTest {

    private final InMemoryMessageQueueService service = new InMemoryMessageQueueService();

    @AfterEach
    void tearDown() {
        service.close();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private void declareDelayPipeline() {
        service.declareDelayedSetup("ex.delay", "q.delay", "ex.actual", "rk.actual");
        service.declareQueue("q.actual", true, null);
        service.bindQueue("q.actual", "rk.actual", "ex.actual");
    }

    @Test
    @DisplayName("delayed setup declares both exchanges, the delay queue and its binding")
    void delayedSetupTopology() {
        service.declareDelayedSetup("ex.delay", "q.delay", "ex.actual", "rk.actual");

        assertThat(service.getExchangeNames()).containsExactlyInAnyOrder("ex.delay", "ex.actual");
        assertThat(service.getQueueNames()).containsExactly("q.delay");
        assertThat(service.getBindings("ex.delay")).containsExactly(new Binding("q.delay", "q.delay"));
        assertThat(service.getQueueArguments("q.delay"))
                .containsEntry(QueueArguments.DEAD_LETTER_EXCHANGE, "ex.actual")
                .containsEntry(QueueArguments.DEAD_LETTER_ROUTING_KEY, "rk.actual");
    }

    @Test
    @DisplayName("running the delayed setup twice changes nothing")
    void delayedSetupIsIdempotent() {
        service.declareDelayedSetup("ex.delay", "q.delay", "ex.actual", "rk.actual");
        service.declareDelayedSetup("ex.delay", "q.delay", "ex.actual", "rk.actual");

        assertThat(service.getExchangeNames()).hasSize(2);
        assertThat(service.getQueueNames()).hasSize(1);
        assertThat(service.getBindings("ex.delay")).hasSize(1);
    }

    @Test
    @DisplayName("a delayed message reaches the actual queue once its delay has elapsed")
    void delayedDelivery() {
        declareDelayPipeline();
        List<Delivery> received = new CopyOnWriteArrayList<>();
        service.consume("q.actual", "worker", received::add);

        long publishedAt = System.nanoTime();
        service.publish("ex.delay", "q.delay", bytes("{\"message_id\":1}"), 500);

        assertThat(service.getReadyCount("q.delay")).isEqualTo(1);
        await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 1);
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - publishedAt).toMillis();

        Delivery delivery = received.get(0);
        assertThat(elapsedMillis).isGreaterThanOrEqualTo(500);
        assertThat(delivery.exchange()).isEqualTo("ex.actual");
        assertThat(delivery.routingKey()).isEqualTo("rk.actual");
        assertThat(delivery.expiration()).isNull();
        assertThat(delivery.headers())
                .containsEntry("x-first-death-reason", "expired")
                .containsEntry("x-first-death-queue", "q.delay")
                .containsEntry("x-first-death-exchange", "ex.delay");
        assertThat(delivery.bodyAsString()).isEqualTo("{\"message_id\":1}");
        await().atMost(Duration.ofSeconds(5)).until(() -> service.getUnackedCount() == 0);
        assertThat(service.getReadyCount("q.delay")).isZero();
    }

    @Test
    @DisplayName("a shorter delay queued behind a longer one waits for it")
    void expiryOnlyAtHead() {
        declareDelayPipeline();
        List<String> received = new CopyOnWriteArrayList<>();
        service.consume("q.actual", "worker", d -> received.add(d.bodyAsString()));

        service.publish("ex.delay", "q.delay", bytes("long"), 600);
        service.publish("ex.delay", "q.delay", bytes("short"), 50);

        await().during(Duration.ofMillis(300)).atMost(Duration.ofSeconds(1)).until(received::isEmpty);
        await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 2);
        assertThat(received).containsExactly("long", "short");
    }

    @Test
    @DisplayName("a failing handler sends the message to the dead-letter queue exactly once")
    void poisonMessageIsDeadLettered() {
        service.declareExchange("ex.dlx", ExchangeType.DIRECT, true);
        service.declareQueue("q.dead", true, null);
        service.bindQueue("q.dead", "dead", "ex.dlx");
        service.declareQueue("q.work", true, QueueArguments.deadLetter("ex.dlx", "dead"));

        AtomicInteger attempts = new AtomicInteger();
        service.consume("q.work", "worker", d -> {
            attempts.incrementAndGet();
            throw new IllegalArgumentException("cannot parse " + d.bodyAsString());
        });

        service.publish("", "q.work", bytes("poison"));

        await().atMost(Duration.ofSeconds(5)).until(() -> service.getReadyCount("q.dead") == 1);
        await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(1))
                .until(() -> attempts.get() == 1);
        assertThat(service.getReadyCount("q.work")).isZero();
        assertThat(service.getUnackedCount()).isZero();
    }

    @Test
    @DisplayName("a rejected message without a dead-letter exchange is dropped")
    void rejectWithoutDeadLetterExchange() {
        service.declareQueue("q.work", true, null);
        AtomicInteger attempts = new AtomicInteger();
        service.consume("q.work", "worker", d -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        service.publish("", "q.work", bytes("x"));

        await().atMost(Duration.ofSeconds(5)).until(() -> attempts.get() == 1 && service.getUnackedCount() == 0);
        assertThat(service.getReadyCount("q.work")).isZero();
    }

    @Test
    @DisplayName("messages are handled one at a time in publish order")
    void sequentialHandling() {
        service.declareQueue("q.work", true, null);
        List<String> received = new CopyOnWriteArrayList<>();
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        service.consume("q.work", "worker", d -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(10);
            received.add(d.bodyAsString());
            inFlight.decrementAndGet();
        });

        for (int i = 0; i < 10; i++) {
            service.publish("", "q.work", bytes("m" + i));
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 10);
        assertThat(received).containsExactly("m0", "m1", "m2", "m3", "m4", "m5", "m6", "m7", "m8", "m9");
        assertThat(maxInFlight.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("topic exchanges route by pattern")
    void topicRouting() {
        service.declareExchange("ex.events", ExchangeType.TOPIC, true);
        service.declareQueue("q.orders", true, null);
        service.declareQueue("q.all", true, null);
        service.bindQueue("q.orders", "orders.*", "ex.events");
        service.bindQueue("q.all", "#", "ex.events");

        service.publish("ex.events", "orders.created", bytes("1"));
        service.publish("ex.events", "orders.created.eu", bytes("2"));
        service.publish("ex.events", "users.deleted", bytes("3"));

        assertThat(service.getReadyCount("q.orders")).isEqualTo(1);
        assertThat(service.getReadyCount("q.all")).isEqualTo(3);
    }

    @Test
    @DisplayName("topic pattern matching")
    void topicMatches() {
        assertThat(InMemoryMessageQueueService.topicMatches("a.b.c", "a.*.c")).isTrue();
        assertThat(InMemoryMessageQueueService.topicMatches("a.c", "a.*.c")).isFalse();
        assertThat(InMemoryMessageQueueService.topicMatches("a.c", "a.#.c")).isTrue();
        assertThat(InMemoryMessageQueueService.topicMatches("a.b.b.c", "a.#.c")).isTrue();
        assertThat(InMemoryMessageQueueService.topicMatches("a", "a.#")).isTrue();
        assertThat(InMemoryMessageQueueService.topicMatches("b.a", "a.#")).isFalse();
        assertThat(InMemoryMessageQueueService.topicMatches("", "#")).isTrue();
    }

    @Test
    @DisplayName("fanout exchanges copy the message to every bound queue")
    void fanoutRouting() {
        service.declareExchange("ex.broadcast", ExchangeType.FANOUT, true);
        service.declareQueue("q.a", true, null);
        service.declareQueue("q.b", true, null);
        service.bindQueue("q.a", "", "ex.broadcast");
        service.bindQueue("q.b", "ignored", "ex.broadcast");

        service.publish("ex.broadcast", "anything", bytes("hi"));

        assertThat(service.getReadyCount("q.a")).isEqualTo(1);
        assertThat(service.getReadyCount("q.b")).isEqualTo(1);
    }

    @Test
    @DisplayName("re-declaring with different attributes is rejected")
    void inequivalentRedeclare() {
        service.declareQueue("q.delay", true, QueueArguments.deadLetter("ex.actual", "rk.actual"));
        service.declareExchange("ex.actual", ExchangeType.DIRECT, true);

        assertThatThrownBy(() -> service.declareQueue("q.delay", true, QueueArguments.deadLetter("ex.other", "rk")))
                .isInstanceOf(TopologyException.class)
                .hasMessageContaining("inequivalent");
        assertThatThrownBy(() -> service.declareExchange("ex.actual", ExchangeType.TOPIC, true))
                .isInstanceOf(TopologyException.class)
                .hasMessageContaining("inequivalent");
    }

    @Test
    @DisplayName("a blank queue name gets a generated one")
    void serverNamedQueue() {
        QueueInfo info = service.declareQueue("", false, null);
        assertThat(info.name()).startsWith("amq.gen-");
        assertThat(service.getQueueNames()).contains(info.name());
    }

    @Test
    @DisplayName("binding or consuming unknown entities fails")
    void unknownEntities() {
        service.declareQueue("q.work", true, null);

        assertThatThrownBy(() -> service.bindQueue("q.work", "rk", "ex.missing"))
                .isInstanceOf(TopologyException.class);
        assertThatThrownBy(() -> service.consume("q.missing", "worker", d -> { }))
                .isInstanceOf(ConsumeException.class);
        assertThatThrownBy(() -> service.publish("ex.missing", "rk", bytes("x")))
                .isInstanceOf(PublishException.class);
    }

    @Test
    @DisplayName("a missing exchange or routing key fails the publish")
    void publishWithoutExchangeOrRoutingKey() {
        service.declareQueue("q.work", true, null);

        assertThatThrownBy(() -> service.publish(null, "q.work", bytes("x")))
                .isInstanceOf(PublishException.class)
                .hasMessageContaining("default exchange");
        assertThatThrownBy(() -> service.publish("", null, bytes("x")))
                .isInstanceOf(PublishException.class);
        assertThat(service.getReadyCount("q.work")).isZero();
    }

    @Test
    @DisplayName("a consumer tag can only be used once")
    void duplicateConsumerTag() {
        service.declareQueue("q.work", true, null);
        service.consume("q.work", "worker", d -> { });

        assertThatThrownBy(() -> service.consume("q.work", "worker", d -> { }))
                .isInstanceOf(ConsumeException.class)
                .hasMessageContaining("already in use");
    }

    @Test
    @DisplayName("a delivery tag can be resolved only once")
    void deliveryTagResolvedOnce() throws Exception {
        var acknowledger = service.new MemoryAcknowledger();

        assertThatThrownBy(() -> acknowledger.ack(99))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("unknown delivery tag 99");
    }

    @Test
    @DisplayName("after close the service is uninitialized and publish is skipped")
    void closedService() {
        service.declareQueue("q.work", true, null);
        service.consume("q.work", "worker", d -> { });
        assertThat(service.getActiveConsumerCount()).isEqualTo(1);

        service.close();

        assertThat(service.isInitialized()).isFalse();
        assertThatCode(() -> service.publish("", "q.work", bytes("late"))).doesNotThrowAnyException();
        assertThat(service.getReadyCount("q.work")).isZero();
        assertThatThrownBy(() -> service.declareQueue("q.other", true, null))
                .isInstanceOf(NotInitializedException.class);
        await().atMost(Duration.ofSeconds(5)).until(() -> service.getActiveConsumerCount() == 0);
    }

    @Test
    @DisplayName("messages still being handled at close are returned to their queue")
    void closeRequeuesUnacked() throws Exception {
        service.declareQueue("q.work", true, null);
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        service.consume("q.work", "worker", d -> {
            started.countDown();
            release.await();
        });
        service.publish("", "q.work", bytes("in-flight"));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        service.close();
        release.countDown();

        assertThat(service.getReadyCount("q.work")).isEqualTo(1);
        assertThat(service.getUnackedCount()).isZero();
    }
}
