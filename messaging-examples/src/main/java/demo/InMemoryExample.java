package demo;

import com.mwc.messaging.config.MessagingConfig;
import com.mwc.messaging.manager.MessagingManager;
import com.mwc.messaging.transport.memory.InMemoryMessageQueueService;

import java.nio.charset.StandardCharsets;

/**
 * Runs the delayed-delivery flow without a broker.
 *
 * The in-memory service implements the same MessageQueueService contract as
 * RabbitMQService and is injected into the manager before start().
 */
public class InMemoryExample {

    public static void main(String[] args) throws InterruptedException {

        var config = new MessagingConfig();
        var delayed = new MessagingConfig.DelayedConfig();
        delayed.setDelayExchange("ex.delay");
        delayed.setDelayQueue("q.delay");
        delayed.setActualExchange("ex.actual");
        delayed.setActualRoutingKey("rk.actual");
        config.getTopology().getDelayed().add(delayed);

        var queue = new MessagingConfig.QueueConfig();
        queue.setName("q.actual");
        config.getTopology().getQueues().add(queue);

        var binding = new MessagingConfig.BindingConfig();
        binding.setQueue("q.actual");
        binding.setExchange("ex.actual");
        binding.setRoutingKey("rk.actual");
        config.getTopology().getBindings().add(binding);

        var manager = new MessagingManager(config);

        // inject the in-memory service (must be called before start())
        manager.setService(new InMemoryMessageQueueService());

        long startedAt = System.currentTimeMillis();
        manager.subscribe("q.actual", "in-memory-example", delivery ->
                System.out.printf("Got '%s' after %d ms%n",
                        delivery.bodyAsString(), System.currentTimeMillis() - startedAt));

        manager.start();
        manager.publish("ex.delay", "q.delay", "hello later".getBytes(StandardCharsets.UTF_8), 1_000);
        manager.publish("ex.actual", "rk.actual", "hello now".getBytes(StandardCharsets.UTF_8), 0);

        Thread.sleep(2_000);
        manager.close();
    }
}
