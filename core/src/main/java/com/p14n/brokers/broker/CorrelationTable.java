package com.p14n.brokers.broker;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pending request/response calls keyed by correlation id.
 *
 * <p>
 * An entry lives from {@link #register} until the first of: its reply is
 * {@link #resolve resolved}, its timeout elapses, its cancellation signal
 * completes, the caller cancels the returned future, or {@link #failAll} is
 * invoked. A resolution for an id without an entry is ignored.
 * </p>
 *
 * @param <T> The reply type
 */
public class CorrelationTable<T> {
    private static final Logger logger = LoggerFactory.getLogger(CorrelationTable.class);

    private final Map<String, PendingCall<T>> pending = new ConcurrentHashMap<>();
    private final AsyncExecutor executor;

    public CorrelationTable(AsyncExecutor executor) {
        this.executor = executor;
    }

    private static final class PendingCall<T> {
        final String id;
        final Instant created;
        final CompletableFuture<T> future = new CompletableFuture<>();
        volatile ScheduledFuture<?> timer;

        PendingCall(String id) {
            this.id = id;
            this.created = Instant.now();
        }

        void cancelTimer() {
            ScheduledFuture<?> t = timer;
            if (t != null) {
                t.cancel(false);
            }
        }
    }

    /**
     * Adds a pending call.
     *
     * @param id           unique correlation id
     * @param timeout      reply window, or null to wait indefinitely
     * @param cancellation completing this stage abandons the call, may be null
     * @return the future completed by the reply or by the call's failure
     */
    public CompletableFuture<T> register(String id, Duration timeout, CompletionStage<?> cancellation) {
        var call = new PendingCall<T>(id);
        if (pending.putIfAbsent(id, call) != null) {
            throw new IllegalArgumentException("Correlation id already pending: " + id);
        }
        // any completion, including cancel() by the caller, discards the entry
        call.future.whenComplete((r, e) -> {
            pending.remove(id, call);
            call.cancelTimer();
        });
        if (timeout != null) {
            call.timer = executor.schedule(() -> expire(call, timeout), timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        if (cancellation != null) {
            cancellation.whenComplete((r, e) -> reject(id, new CallCancelledException(id)));
        }
        return call.future;
    }

    /**
     * Completes the call waiting on {@code id}.
     *
     * @return false if no call was waiting
     */
    public boolean resolve(String id, T value) {
        PendingCall<T> call = id == null ? null : pending.remove(id);
        if (call == null) {
            return false;
        }
        call.cancelTimer();
        return call.future.complete(value);
    }

    /**
     * Fails the call waiting on {@code id}.
     *
     * @return false if no call was waiting
     */
    public boolean reject(String id, Throwable error) {
        PendingCall<T> call = id == null ? null : pending.remove(id);
        if (call == null) {
            return false;
        }
        call.cancelTimer();
        return call.future.completeExceptionally(error);
    }

    /**
     * Fails every pending call with the same cause.
     *
     * @return the number of calls failed
     */
    public int failAll(Throwable cause) {
        int failed = 0;
        for (String id : new ArrayList<>(pending.keySet())) {
            if (reject(id, cause)) {
                failed++;
            }
        }
        return failed;
    }

    public boolean isPending(String id) {
        return pending.containsKey(id);
    }

    public int size() {
        return pending.size();
    }

    private void expire(PendingCall<T> call, Duration timeout) {
        if (pending.remove(call.id, call)) {
            logger.atDebug()
                    .addArgument(call.id)
                    .addArgument(() -> Duration.between(call.created, Instant.now()).toMillis())
                    .log("Call {} timed out after {}ms");
            call.future.completeExceptionally(new CallTimeoutException(call.id, timeout));
        }
    }
}
