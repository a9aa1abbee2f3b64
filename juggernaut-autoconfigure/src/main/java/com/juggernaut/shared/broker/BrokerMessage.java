package com.juggernaut.shared.broker;

/**
 * A raw pub/sub message as received from the broker.
 */
public record BrokerMessage(
        String channel,
        byte[] body
) {}
