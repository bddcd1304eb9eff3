package com.p14n.brokers.local;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.p14n.brokers.broker.BrokerListener;
import com.p14n.brokers.broker.CallCancelledException;
import com.p14n.brokers.broker.CallOptions;
import com.p14n.brokers.broker.CallTimeoutException;
import com.p14n.brokers.broker.ConnectionLostException;
import com.p14n.brokers.broker.DispatchException;
import com.p14n.brokers.broker.Subscription;
import com.p14n.brokers.data.ConfigData;
import com.p14n.brokers.serialization.JsonSerializer;

import static org.junit.jupiter.api.Assertions.*;

import io.opentelemetry.api.OpenTelemetry;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class LocalBrokerTest {

    private LocalExchange exchange;
    private final List<LocalBroker<Object>> brokers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        exchange = new LocalExchange();
    }

    @AfterEach
    void tearDown() {
        brokers.forEach(LocalBroker::close);
        exchange.close();
    }

    private LocalBroker<Object> broker(String group, String subgroup, boolean rpc) {
        var broker = new LocalBroker<>(exchange, new ConfigData(group, subgroup, rpc), JsonSerializer.generic(),
                OpenTelemetry.noop());
        brokers.add(broker);
        return broker;
    }

    @Test
    void shouldDeliverInPublishOrder() throws InterruptedException {
        var broker = broker("g", null, false);
        int count = 50;
        var received = new CopyOnWriteArrayList<Object>();
        var done = new CountDownLatch(count);
        broker.subscribe("ev", d -> {
            received.add(d.data());
            done.countDown();
        }).join();

        var expected = new ArrayList<Object>();
        for (int i = 0; i < count; i++) {
            broker.publish("ev", i);
            expected.add(i);
        }

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertEquals(expected, received);
    }

    @Test
    void shouldOnlyDeliverSubscribedEvents() throws InterruptedException {
        var broker = broker("g", null, false);
        var a = new CopyOnWriteArrayList<Object>();
        var b = new CountDownLatch(1);
        broker.subscribe("a", d -> a.add(d.data())).join();
        broker.subscribe("b", d -> b.countDown()).join();

        broker.publish("b", "for b");

        assertTrue(b.await(1, TimeUnit.SECONDS));
        assertTrue(a.isEmpty());
    }

    @Test
    void shouldReturnQueueNamesOfSubscriptions() {
        var broker = broker("g", "sg", false);

        List<Subscription> subs = broker.subscribe(List.of("a", "b"), d -> {
        }).join();

        assertEquals("g:sg:a", subs.get(0).queue());
        assertEquals("g:sg:b", subs.get(1).queue());
    }

    @Test
    void shouldReportUnknownEventOnUnsubscribe() throws InterruptedException {
        var broker = broker("g", null, false);
        var received = new CopyOnWriteArrayList<Object>();
        broker.subscribe("a", d -> received.add(d.data())).join();

        Map<String, Boolean> result = broker.unsubscribe(List.of("a", "never")).join();

        assertEquals(Map.of("a", true, "never", false), result);

        var marker = new CountDownLatch(1);
        broker.subscribe("b", d -> marker.countDown()).join();
        broker.publish("a", "dropped");
        broker.publish("b", "marker");
        assertTrue(marker.await(1, TimeUnit.SECONDS));
        assertTrue(received.isEmpty());
    }

    @Test
    void shouldAnswerCalls() {
        var server = broker("g", null, true);
        var client = broker("g", "client", true);
        server.subscribe("ping", d -> d.response().reply("pong:" + d.data())).join();

        Object reply = client.call("ping", "hello", CallOptions.withTimeout(Duration.ofSeconds(2))).join();

        assertEquals("pong:hello", reply);
        assertEquals(0, client.pendingCalls());
        assertNotEquals(server.replyQueue(), client.replyQueue());
    }

    @Test
    void shouldTimeOutUnansweredCall() {
        var client = broker("g", null, true);

        CompletableFuture<Object> f = client.call("nobody", "hello", CallOptions.withTimeout(Duration.ofMillis(100)));

        assertInstanceOf(CallTimeoutException.class, assertThrows(CompletionException.class, f::join).getCause());
        assertEquals(0, client.pendingCalls());
    }

    @Test
    void shouldCancelCall() {
        var client = broker("g", null, true);
        var cancel = new CompletableFuture<Void>();

        CompletableFuture<Object> f = client.call("nobody", "hello",
                CallOptions.withTimeout(Duration.ofSeconds(5)).cancelledBy(cancel));
        cancel.complete(null);

        assertInstanceOf(CallCancelledException.class, assertThrows(CompletionException.class, f::join).getCause());
    }

    @Test
    void shouldRefuseCallsWithoutRpc() {
        var broker = broker("g", null, false);

        assertThrows(IllegalStateException.class, () -> broker.call("ev", "x"));
    }

    @Test
    void shouldShareQueueWithinGroupAndCopyAcrossSubgroups() throws InterruptedException {
        var first = broker("g", null, false);
        var second = broker("g", null, false);
        var audit = broker("g", "audit", false);
        int count = 10;
        var shared = new AtomicInteger();
        var sharedDone = new CountDownLatch(count);
        var auditDone = new CountDownLatch(count);
        first.subscribe("ev", d -> {
            shared.incrementAndGet();
            sharedDone.countDown();
        }).join();
        second.subscribe("ev", d -> {
            shared.incrementAndGet();
            sharedDone.countDown();
        }).join();
        audit.subscribe("ev", d -> auditDone.countDown()).join();

        for (int i = 0; i < count; i++) {
            first.publish("ev", i);
        }

        assertTrue(sharedDone.await(2, TimeUnit.SECONDS));
        assertTrue(auditDone.await(2, TimeUnit.SECONDS));
        assertEquals(count, shared.get());
    }

    @Test
    void shouldKeepConsumingAfterSubscriberFailure() throws InterruptedException {
        var broker = broker("g", null, false);
        var errors = new CopyOnWriteArrayList<Throwable>();
        var second = new CountDownLatch(1);
        broker.addListener(new BrokerListener() {
            @Override
            public void onError(Throwable error) {
                errors.add(error);
            }
        });
        broker.subscribe("ev", d -> {
            if ("bad".equals(d.data())) {
                throw new IllegalArgumentException("bad message");
            }
            second.countDown();
        }).join();

        broker.publish("ev", "bad");
        broker.publish("ev", "good");

        assertTrue(second.await(1, TimeUnit.SECONDS));
        assertEquals(1, errors.size());
        assertInstanceOf(DispatchException.class, errors.get(0));
        assertInstanceOf(IllegalArgumentException.class, errors.get(0).getCause());
    }

    @Test
    void shouldFailOutstandingCallsOnClose() {
        var client = broker("g", null, true);
        CompletableFuture<Object> f = client.call("nobody", "hello");

        client.close();

        assertInstanceOf(ConnectionLostException.class, assertThrows(CompletionException.class, f::join).getCause());
        assertThrows(IllegalStateException.class, () -> client.publish("ev", "x"));
    }
}
