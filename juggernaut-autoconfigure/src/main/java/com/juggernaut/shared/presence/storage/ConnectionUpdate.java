package com.juggernaut.shared.presence.storage;

/**
 * Result of an atomic change to a user's connection set.
 *
 * @param changed       whether the session id was actually added or removed
 * @param previousCount connection count observed right before the change
 * @param count         connection count right after the change
 */
public record ConnectionUpdate(
        boolean changed,
        long previousCount,
        long count
) {

    public static ConnectionUpdate added(boolean changed, long count) {
        return new ConnectionUpdate(changed, changed ? count - 1 : count, count);
    }

    public static ConnectionUpdate removed(boolean changed, long count) {
        return new ConnectionUpdate(changed, changed ? count + 1 : count, count);
    }

    /** 0 → 1 */
    public boolean cameOnline() {
        return changed && previousCount == 0 && count > 0;
    }

    /** 1 → 0 */
    public boolean wentOffline() {
        return changed && previousCount > 0 && count == 0;
    }
}
