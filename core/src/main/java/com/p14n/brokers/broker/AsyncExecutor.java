package com.p14n.brokers.broker;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Interface for asynchronous task execution used by brokers for topology work,
 * reconnect delays and call timeouts.
 */
public interface AsyncExecutor extends Executor, AutoCloseable {

    /**
     * Schedules a one-shot task.
     *
     * @param command The task to execute
     * @param delay   The time to delay execution
     * @param unit    The time unit of the delay parameter
     * @return A ScheduledFuture that can be used to cancel the task
     */
    ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit);

    /**
     * Shuts down the executor and returns a list of runnables that were not
     * executed.
     *
     * @return A list of runnables that were not executed
     */
    List<Runnable> shutdownNow();

    @Override
    void close();
}
