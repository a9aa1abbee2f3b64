package com.juggernaut.shared.presence.storage;

import java.util.List;
import java.util.Set;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import lombok.Getter;

/**
 * Redis 기반 PresenceStore 구현체. 여러 Roster 프로세스가 같은 Redis 를 공유할 수 있다.
 *
 * 키 구조 (prefix 기본값 {@code juggernaut-roster:}):
 * <ul>
 *   <li>{@code <prefix>connections:<userId>} : 세션 id 집합</li>
 *   <li>{@code <prefix>online-users} : 온라인 사용자 id 집합</li>
 * </ul>
 */
public class RedisPresenceStore implements PresenceStore {

    public static final String DEFAULT_KEY_PREFIX = "juggernaut-roster:";

    private static final String CONNECTIONS = "connections:";
    private static final String ONLINE_USERS = "online-users";

    // set 변경, 크기 조회, online-users 갱신을 한 번에 수행해야 다른 프로세스와 경쟁하지 않는다
    // KEYS[1] = connections, KEYS[2] = online-users, ARGV[1] = sessionId, ARGV[2] = userId
    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> ADD_SCRIPT = RedisScript.of(
            "local changed = redis.call('SADD', KEYS[1], ARGV[1])\n"
                    + "local count = redis.call('SCARD', KEYS[1])\n"
                    + "if changed == 1 and count == 1 then redis.call('SADD', KEYS[2], ARGV[2]) end\n"
                    + "return {changed, count}",
            List.class);

    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> REMOVE_SCRIPT = RedisScript.of(
            "local changed = redis.call('SREM', KEYS[1], ARGV[1])\n"
                    + "local count = redis.call('SCARD', KEYS[1])\n"
                    + "if changed == 1 and count == 0 then redis.call('SREM', KEYS[2], ARGV[2]) end\n"
                    + "return {changed, count}",
            List.class);

    private final StringRedisTemplate redis;

    @Getter
    private final String keyPrefix;

    public RedisPresenceStore(StringRedisTemplate redis) {
        this(redis, DEFAULT_KEY_PREFIX);
    }

    public RedisPresenceStore(StringRedisTemplate redis, String keyPrefix) {
        this.redis = redis;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public ConnectionUpdate addConnection(String userId, String sessionId) {
        long[] result = runScript(ADD_SCRIPT, userId, sessionId);
        return ConnectionUpdate.added(result[0] == 1, result[1]);
    }

    @Override
    public ConnectionUpdate removeConnection(String userId, String sessionId) {
        long[] result = runScript(REMOVE_SCRIPT, userId, sessionId);
        return ConnectionUpdate.removed(result[0] == 1, result[1]);
    }

    @Override
    public long connectionCount(String userId) {
        Long size = redis.opsForSet().size(connectionsKey(userId));
        return size == null ? 0 : size;
    }

    @Override
    public Set<String> connections(String userId) {
        Set<String> members = redis.opsForSet().members(connectionsKey(userId));
        return members == null ? Set.of() : members;
    }

    @Override
    public void markOnline(String userId) {
        redis.opsForSet().add(onlineUsersKey(), userId);
    }

    @Override
    public void markOffline(String userId) {
        redis.opsForSet().remove(onlineUsersKey(), userId);
    }

    @Override
    public Set<String> onlineUsers() {
        Set<String> members = redis.opsForSet().members(onlineUsersKey());
        return members == null ? Set.of() : members;
    }

    public String connectionsKey(String userId) {
        return keyPrefix + CONNECTIONS + userId;
    }

    public String onlineUsersKey() {
        return keyPrefix + ONLINE_USERS;
    }

    @SuppressWarnings("rawtypes")
    private long[] runScript(RedisScript<List> script, String userId, String sessionId) {
        List reply = redis.execute(script, List.of(connectionsKey(userId), onlineUsersKey()), sessionId, userId);
        if (reply == null || reply.size() != 2) {
            throw new IllegalStateException("Unexpected reply from presence script for user " + userId + ": " + reply);
        }
        return new long[] {
                ((Number) reply.get(0)).longValue(),
                ((Number) reply.get(1)).longValue()
        };
    }
}
