package com.p14n.brokers.amqp;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.PossibleAuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Classifies connection failures.
 *
 * <p>
 * Fatal failures are not retried: authentication failures and connections the
 * server closed with a reply code other than {@code 200 reply-success} or
 * {@code 320 connection-forced}. Everything else, such as I/O errors or missed
 * heartbeats, is treated as transient.
 * </p>
 */
public final class ConnectionFaults {

    private ConnectionFaults() {
    }

    public static boolean isFatal(Throwable error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof PossibleAuthenticationFailureException) {
                return true;
            }
            if (t instanceof ShutdownSignalException) {
                return isFatal((ShutdownSignalException) t);
            }
            t = t.getCause() == t ? null : t.getCause();
        }
        return false;
    }

    private static boolean isFatal(ShutdownSignalException signal) {
        if (!signal.isHardError()) {
            return false;
        }
        Method reason = signal.getReason();
        if (reason instanceof AMQP.Connection.Close) {
            int code = ((AMQP.Connection.Close) reason).getReplyCode();
            return code != AMQP.REPLY_SUCCESS && code != AMQP.CONNECTION_FORCED;
        }
        return false;
    }
}
