package demo;

import com.mwc.messaging.manager.MessagingManager;
import com.mwc.messaging.transport.Delivery;

import java.nio.file.Path;

/**
 * Simplest usage: YAML config + main method.
 *
 * Run: java -cp "lib/*" demo.BasicExample messaging.yml q.orders
 */
public class BasicExample {

    public static void main(String[] args) {
        // 1. load config from YAML and create the manager
        Path configPath = Path.of(args.length > 0 ? args[0] : "messaging.yml");
        String queue = args.length > 1 ? args[1] : "q.notifications.unread_messages.email.processing";
        var manager = MessagingManager.fromYaml(configPath);

        // 2. register a consumer; a handler that throws rejects the message without requeue
        manager.subscribe(queue, "basic-example", BasicExample::onDelivery);

        // 3. start (connect to RabbitMQ, declare topology, start consuming)
        manager.start();
        if (!manager.isConnected()) {
            System.out.println("RABBITMQ_URL not set or broker unreachable, running without messaging");
        }

        // 4. keep running, Ctrl+C to exit
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("Shutting down...");
            manager.close();
        }));

        System.out.println("Listening on " + queue + "... (Ctrl+C to stop)");

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void onDelivery(Delivery delivery) {
        System.out.printf("[%s] tag=%d exchange=%s key=%s redelivered=%s  %s%n",
                delivery.consumerTag(),
                delivery.deliveryTag(),
                delivery.exchange(),
                delivery.routingKey(),
                delivery.redelivered(),
                delivery.bodyAsString());
        if (delivery.body().length == 0) {
            throw new IllegalArgumentException("empty body");
        }
    }
}
