package com.juggernaut.shared.presence.storage;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 인메모리 기반 PresenceStore 구현체.
 * 단일 인스턴스 환경에 적합합니다.
 */
public class InMemoryPresenceStore implements PresenceStore {

    // userId -> Set<sessionId>
    private final Map<String, Set<String>> connections = new ConcurrentHashMap<>();

    // compute 블록 안에서만 변경해서 같은 사용자의 연결 변경과 원자적으로 맞춘다

    private final Set<String> onlineUsers = ConcurrentHashMap.newKeySet();

    @Override
    public ConnectionUpdate addConnection(String userId, String sessionId) {
        long[] result = new long[2];
        connections.compute(userId, (k, sessions) -> {
            Set<String> target = sessions == null ? ConcurrentHashMap.newKeySet() : sessions;
            result[0] = target.add(sessionId) ? 1 : 0;
            result[1] = target.size();
            if (result[0] == 1 && result[1] == 1) {
                onlineUsers.add(userId);
            }
            return target;
        });
        return ConnectionUpdate.added(result[0] == 1, result[1]);
    }

    @Override
    public ConnectionUpdate removeConnection(String userId, String sessionId) {
        long[] result = new long[2];
        connections.computeIfPresent(userId, (k, sessions) -> {
            result[0] = sessions.remove(sessionId) ? 1 : 0;
            result[1] = sessions.size();
            if (result[0] == 1 && result[1] == 0) {
                onlineUsers.remove(userId);
            }
            return sessions.isEmpty() ? null : sessions;
        });
        return ConnectionUpdate.removed(result[0] == 1, result[1]);
    }

    @Override
    public long connectionCount(String userId) {
        Set<String> sessions = connections.get(userId);
        return sessions == null ? 0 : sessions.size();
    }

    @Override
    public Set<String> connections(String userId) {
        Set<String> sessions = connections.get(userId);
        return sessions == null ? Set.of() : Set.copyOf(sessions);
    }

    @Override
    public void markOnline(String userId) {
        onlineUsers.add(userId);
    }

    @Override
    public void markOffline(String userId) {
        onlineUsers.remove(userId);
    }

    @Override
    public Set<String> onlineUsers() {
        return Set.copyOf(onlineUsers);
    }

    /**
     * 모든 데이터 삭제 (테스트용)
     */
    public void clear() {
        connections.clear();
        onlineUsers.clear();
    }
}
