package com.p14n.brokers.broker;

import java.util.Objects;

/**
 * Derives the queue name used for an event. Processes that share group,
 * subgroup and event share the queue and therefore compete for its messages.
 */
public final class QueueNames {

    private QueueNames() {
    }

    /**
     * @param group    the broker group, never null
     * @param subgroup the optional subgroup, may be null or empty
     * @param event    the event name, never null
     * @return {@code group:subgroup:event}, or {@code group:event} without a
     *         subgroup
     */
    public static String of(String group, String subgroup, String event) {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(event, "event");
        if (subgroup == null || subgroup.isEmpty()) {
            return group + ":" + event;
        }
        return group + ":" + subgroup + ":" + event;
    }
}
