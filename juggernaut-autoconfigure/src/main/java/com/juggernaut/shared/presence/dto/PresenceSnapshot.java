package com.juggernaut.shared.presence.dto;

import java.util.Set;

public record PresenceSnapshot(
        String userId,
        boolean online,
        Set<String> connections
) {}
