package com.p14n.brokers.local;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import com.p14n.brokers.broker.Responder;

class LocalResponder<T> implements Responder<T> {

    private final LocalExchange exchange;
    private final LocalMessage request;
    private final Function<T, byte[]> serializer;
    private final AtomicBoolean replied = new AtomicBoolean(false);

    LocalResponder(LocalExchange exchange, LocalMessage request, Function<T, byte[]> serializer) {
        this.exchange = exchange;
        this.request = request;
        this.serializer = serializer;
    }

    @Override
    public void reply(T data) {
        if (!expectsReply()) {
            throw new IllegalStateException("Message on " + request.routingKey() + " expects no reply");
        }
        byte[] body = serializer.apply(data);
        if (!replied.compareAndSet(false, true)) {
            throw new IllegalStateException("Reply already sent");
        }
        exchange.sendToQueue(request.replyTo(),
                new LocalMessage(request.replyTo(), body, null, request.correlationId(), null));
    }

    @Override
    public boolean expectsReply() {
        return request.replyTo() != null;
    }
}
