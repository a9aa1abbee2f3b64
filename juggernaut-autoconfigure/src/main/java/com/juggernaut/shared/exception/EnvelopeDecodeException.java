package com.juggernaut.shared.exception;

import lombok.Getter;

/**
 * Raised when an inbound event envelope cannot be decoded.
 * Carries the raw channel name so the failing message can be traced in logs.
 */
@Getter
public class EnvelopeDecodeException extends JuggernautException {

    private final String channel;

    public EnvelopeDecodeException(String message, String channel) {
        super(message);
        this.channel = channel;
    }

    public EnvelopeDecodeException(String message, String channel, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }
}
