package com.p14n.brokers.broker;

/**
 * Receives the asynchronous notifications of a broker: faults that happen
 * outside the scope of any caller, and connection loss.
 */
public interface BrokerListener {

    /**
     * A non-fatal fault: dispatch, decoding, subscriber or connection level.
     *
     * @param error the fault
     */
    default void onError(Throwable error) {
    }

    /**
     * The connection to the backing system was lost or could not be opened.
     *
     * @param cause the causing error
     */
    default void onClose(Throwable cause) {
    }
}
