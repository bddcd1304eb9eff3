package com.p14n.brokers.amqp;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import com.p14n.brokers.broker.BrokerException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;

class ChannelResponder<T> implements AmqpResponder<T> {

    private interface ChannelAction {
        void run() throws IOException;
    }

    private final Channel channel;
    private final long deliveryTag;
    private final AMQP.BasicProperties properties;
    private final Function<T, byte[]> serializer;
    private final AtomicBoolean settled;
    private final AtomicBoolean replied = new AtomicBoolean(false);

    ChannelResponder(Channel channel, long deliveryTag, AMQP.BasicProperties properties,
            Function<T, byte[]> serializer, boolean autoAck) {
        this.channel = channel;
        this.deliveryTag = deliveryTag;
        this.properties = properties;
        this.serializer = serializer;
        this.settled = new AtomicBoolean(autoAck);
    }

    @Override
    public void reply(T data) {
        if (!expectsReply()) {
            throw new IllegalStateException("Message " + deliveryTag + " has no reply-to queue");
        }
        byte[] body = serializer.apply(data);
        if (!replied.compareAndSet(false, true)) {
            throw new IllegalStateException("Reply to message " + deliveryTag + " already sent");
        }
        var replyProperties = new AMQP.BasicProperties.Builder()
                .correlationId(properties.getCorrelationId())
                .build();
        run("reply", () -> channel.basicPublish("", properties.getReplyTo(), replyProperties, body));
    }

    @Override
    public boolean expectsReply() {
        return properties != null && properties.getReplyTo() != null;
    }

    @Override
    public void ack() {
        settle("ack");
        run("ack", () -> channel.basicAck(deliveryTag, false));
    }

    @Override
    public void nack(boolean allUpTo, boolean requeue) {
        settle("nack");
        run("nack", () -> channel.basicNack(deliveryTag, allUpTo, requeue));
    }

    @Override
    public void reject(boolean requeue) {
        settle("reject");
        run("reject", () -> channel.basicReject(deliveryTag, requeue));
    }

    @Override
    public boolean isSettled() {
        return settled.get();
    }

    /**
     * @return false if the message had already been settled
     */
    boolean rejectIfUnsettled(boolean requeue) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        run("reject", () -> channel.basicReject(deliveryTag, requeue));
        return true;
    }

    private void settle(String operation) {
        if (!settled.compareAndSet(false, true)) {
            throw new IllegalStateException("Message " + deliveryTag + " already settled, cannot " + operation);
        }
    }

    private void run(String operation, ChannelAction action) {
        try {
            action.run();
        } catch (IOException e) {
            throw new BrokerException("Unable to " + operation + " message " + deliveryTag, e);
        }
    }
}
