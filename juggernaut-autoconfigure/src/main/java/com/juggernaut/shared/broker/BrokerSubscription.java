package com.juggernaut.shared.broker;

import java.util.Optional;

import com.juggernaut.shared.exception.BrokerException;

/**
 * A live subscription to one or more broker channels, consumed by pulling.
 */
public interface BrokerSubscription extends AutoCloseable {

    /**
     * Blocks until the next message arrives.
     *
     * @return the message, or empty once the subscription has been closed
     * @throws BrokerException if the subscription failed or the waiting thread was interrupted
     */
    Optional<BrokerMessage> next();

    boolean isClosed();

    /**
     * Stops the subscription and releases its broker resources. Unblocks a consumer
     * waiting in {@link #next()}. Calling it more than once has no effect.
     */
    @Override
    void close();
}
