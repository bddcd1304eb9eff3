package com.p14n.brokers.broker;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.p14n.brokers.serialization.JsonSerializer;
import com.p14n.brokers.serialization.SerializationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import io.opentelemetry.api.OpenTelemetry;

class BrokerSupportTest {

    private DefaultExecutor executor;
    private BrokerSupport<Object, Responder<Object>> support;
    private Responder<Object> responder;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        executor = new DefaultExecutor();
        support = new BrokerSupport<>(JsonSerializer.generic(), executor, OpenTelemetry.noop(), "test");
        responder = mock(Responder.class);
    }

    @AfterEach
    void tearDown() {
        support.close();
        executor.close();
    }

    private static byte[] json(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldRunSubscribersInRegistrationOrder() {
        var seen = new CopyOnWriteArrayList<String>();
        support.addSubscriber("ev", d -> seen.add("first:" + d.data()));
        support.addSubscriber("ev", d -> seen.add("second:" + d.data()));

        assertTrue(support.handleMessage("ev", json("\"x\""), responder, null));

        assertEquals(List.of("first:x", "second:x"), seen);
    }

    @Test
    void shouldReportFirstSubscriber() {
        assertTrue(support.addSubscriber("ev", d -> {
        }));
        assertFalse(support.addSubscriber("ev", d -> {
        }));
        assertTrue(support.hasSubscribers("ev"));
    }

    @Test
    void shouldKeepDispatchingAfterSubscriberFailure() {
        var seen = new CopyOnWriteArrayList<Object>();
        var errors = new CopyOnWriteArrayList<Throwable>();
        var boom = new RuntimeException("boom");
        support.addSubscriber("ev", new MessageSubscriber<>() {
            @Override
            public void onMessage(Delivery<Object, Responder<Object>> message) {
                throw boom;
            }

            @Override
            public void onError(Throwable error) {
                errors.add(error);
            }
        });
        support.addSubscriber("ev", d -> seen.add(d.data()));

        DispatchException e = assertThrows(DispatchException.class,
                () -> support.handleMessage("ev", json("1"), responder, null));

        assertEquals("ev", e.event());
        assertSame(boom, e.getCause());
        assertEquals(List.of(boom), errors);
        assertEquals(List.of(1), seen);
    }

    @Test
    void shouldAttachLaterFailuresAsSuppressed() {
        var second = new IllegalStateException("second");
        support.addSubscriber("ev", d -> {
            throw new RuntimeException("first");
        });
        support.addSubscriber("ev", d -> {
            throw second;
        });

        DispatchException e = assertThrows(DispatchException.class,
                () -> support.handleMessage("ev", json("1"), responder, null));

        assertEquals("first", e.getCause().getMessage());
        assertArrayEquals(new Throwable[] { second }, e.getSuppressed());
    }

    @Test
    void shouldRaiseDispatchErrorForUndecodableBody() {
        var seen = new CopyOnWriteArrayList<Object>();
        support.addSubscriber("ev", d -> seen.add(d.data()));

        DispatchException e = assertThrows(DispatchException.class,
                () -> support.handleMessage("ev", json("{not json"), responder, null));

        assertInstanceOf(SerializationException.class, e.getCause());
        assertTrue(seen.isEmpty());
    }

    @Test
    void shouldReportMessageWithoutSubscribers() {
        assertFalse(support.handleMessage("ev", json("1"), responder, null));

        support.addSubscriber("other", d -> {
        });
        support.addSubscriber("ev", d -> {
        });
        support.removeSubscribers("ev");
        assertFalse(support.handleMessage("ev", json("1"), responder, null));
    }

    @Test
    void shouldCompletePendingCallFromReply() {
        String id = support.newCorrelationId();
        CompletableFuture<Object> f = support.awaitResponse("ev", id, Duration.ofSeconds(1), null);

        assertFalse(support.handleReply("other", json("1")));
        assertTrue(support.handleReply(id, json("{\"ok\":true}")));

        assertEquals(java.util.Map.of("ok", true), f.join());
        assertEquals(0, support.pendingCalls());
    }

    @Test
    void shouldFailCallWhenReplyCannotBeDecoded() {
        String id = support.newCorrelationId();
        CompletableFuture<Object> f = support.awaitResponse("ev", id, null, null);

        support.handleReply(id, json("{broken"));

        assertInstanceOf(SerializationException.class, assertThrows(CompletionException.class, f::join).getCause());
    }

    @Test
    void shouldIsolateListenerFailures() {
        var errors = new CopyOnWriteArrayList<Throwable>();
        support.addListener(new BrokerListener() {
            @Override
            public void onError(Throwable error) {
                throw new RuntimeException("listener broke");
            }
        });
        support.addListener(new BrokerListener() {
            @Override
            public void onError(Throwable error) {
                errors.add(error);
            }
        });
        var fault = new BrokerException("fault");

        support.emitError(fault);

        assertEquals(List.of(fault), errors);
    }

    @Test
    void shouldFailPendingCallsOnClose() {
        CompletableFuture<Object> f = support.awaitResponse("ev", support.newCorrelationId(), null, null);

        support.close();

        assertInstanceOf(ConnectionLostException.class, assertThrows(CompletionException.class, f::join).getCause());
        assertThrows(IllegalStateException.class, support::ensureOpen);
        assertFalse(support.hasSubscribers("ev"));
    }
}
