package com.juggernaut.shared.codec;

/**
 * A decoded inbound event: the event name taken from the channel suffix and its envelope.
 */
public record BusEvent(
        String event,
        EventEnvelope envelope
) {}
