package com.juggernaut.shared.client;

import com.juggernaut.shared.codec.EventEnvelope;

/**
 * Callback form of {@link JuggernautClient#subscribeListen()}.
 */
@FunctionalInterface
public interface EventHandler {
    void handle(String event, EventEnvelope envelope);
}
