package com.juggernaut.shared.presence.core;

import java.util.Optional;

import com.juggernaut.shared.codec.EventEnvelope;

import lombok.Getter;

/**
 * Reads the user id from one field of the envelope's {@code meta} object,
 * {@code user_id} unless configured otherwise. Non-string ids are rendered with
 * {@link String#valueOf(Object)}.
 */
@Getter
public class MetaKeyUserIdResolver implements UserIdResolver {

    public static final String DEFAULT_USER_META_KEY = "user_id";

    private final String userMetaKey;

    public MetaKeyUserIdResolver() {
        this(DEFAULT_USER_META_KEY);
    }

    public MetaKeyUserIdResolver(String userMetaKey) {
        this.userMetaKey = userMetaKey;
    }

    @Override
    public Optional<String> resolve(EventEnvelope envelope) {
        if (envelope == null) {
            return Optional.empty();
        }
        return envelope.metaValue(userMetaKey).map(String::valueOf);
    }
}
