package com.p14n.brokers.local;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * In-process message router with direct exchange semantics.
 *
 * <p>
 * Queues are bound to an (exchange, routing key) pair. A published message is
 * copied to every bound queue, and each queue hands it to one of its consumers
 * in turn, so brokers consuming the same queue name share its messages. All
 * routing and delivery runs on a single thread: messages are delivered in the
 * order they were published.
 * </p>
 *
 * <p>
 * Messages routed to a queue without consumers are discarded.
 * </p>
 */
public class LocalExchange implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LocalExchange.class);

    private final ExecutorService loop;
    private final Map<String, LocalQueue> queues = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> bindings = new ConcurrentHashMap<>();
    private final AtomicLong tags = new AtomicLong();

    public LocalExchange() {
        this.loop = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("brokers-local-%d").setDaemon(true).build());
    }

    private static final class LocalQueue {
        private final String name;
        private final List<String> tags = new ArrayList<>();
        private final List<Consumer<LocalMessage>> handlers = new ArrayList<>();
        private int next;

        LocalQueue(String name) {
            this.name = name;
        }

        synchronized void add(String tag, Consumer<LocalMessage> handler) {
            tags.add(tag);
            handlers.add(handler);
        }

        synchronized boolean remove(String tag) {
            int i = tags.indexOf(tag);
            if (i < 0) {
                return false;
            }
            tags.remove(i);
            handlers.remove(i);
            return true;
        }

        synchronized Consumer<LocalMessage> nextHandler() {
            if (handlers.isEmpty()) {
                return null;
            }
            next = next % handlers.size();
            return handlers.get(next++);
        }
    }

    public void declareQueue(String queue) {
        queues.computeIfAbsent(queue, LocalQueue::new);
    }

    public void deleteQueue(String queue) {
        queues.remove(queue);
        bindings.values().forEach(bound -> bound.remove(queue));
    }

    public void bind(String queue, String exchange, String routingKey) {
        requireQueue(queue);
        bindings.computeIfAbsent(bindingKey(exchange, routingKey), k -> ConcurrentHashMap.newKeySet()).add(queue);
    }

    /**
     * @return the consumer tag
     */
    public String consume(String queue, Consumer<LocalMessage> handler) {
        String tag = "local-ctag-" + tags.incrementAndGet();
        requireQueue(queue).add(tag, handler);
        return tag;
    }

    /**
     * @return false if no consumer has this tag
     */
    public boolean cancel(String tag) {
        for (LocalQueue q : queues.values()) {
            if (q.remove(tag)) {
                return true;
            }
        }
        return false;
    }

    public void publish(String exchange, String routingKey, LocalMessage message) {
        submit(() -> {
            Set<String> bound = bindings.get(bindingKey(exchange, routingKey));
            if (bound == null || bound.isEmpty()) {
                logger.atDebug().addArgument(exchange).addArgument(routingKey)
                        .log("No queue bound to {}/{}, message dropped");
                return;
            }
            bound.forEach(queue -> deliver(queue, message));
        });
    }

    public void sendToQueue(String queue, LocalMessage message) {
        submit(() -> deliver(queue, message));
    }

    private void deliver(String queue, LocalMessage message) {
        LocalQueue q = queues.get(queue);
        Consumer<LocalMessage> handler = q == null ? null : q.nextHandler();
        if (handler == null) {
            logger.atDebug().addArgument(queue).log("No consumer on queue {}, message dropped");
            return;
        }
        try {
            handler.accept(message);
        } catch (RuntimeException e) {
            logger.atError().addArgument(q.name).setCause(e).log("Consumer on queue {} failed");
        }
    }

    private void submit(Runnable task) {
        try {
            loop.execute(task);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Exchange is closed", e);
        }
    }

    private LocalQueue requireQueue(String queue) {
        LocalQueue q = queues.get(queue);
        if (q == null) {
            throw new IllegalArgumentException("Unknown queue " + queue);
        }
        return q;
    }

    private static String bindingKey(String exchange, String routingKey) {
        return exchange + '\u0000' + routingKey;
    }

    @Override
    public void close() {
        loop.shutdownNow();
    }
}
