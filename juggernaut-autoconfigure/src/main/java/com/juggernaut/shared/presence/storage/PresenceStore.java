package com.juggernaut.shared.presence.storage;

import java.util.Set;

/**
 * 사용자별 연결(세션) 집합과 전체 온라인 사용자 집합을 보관하는 저장소.
 * 여러 프로세스의 Roster 가 동시에 사용하므로 add/remove 는 저장소 수준에서 원자적이어야 한다.
 */
public interface PresenceStore {

    /**
     * 세션을 추가한다. 첫 연결(0 → 1)이면 같은 원자적 연산 안에서 온라인 사용자 집합에도 추가한다.
     */
    ConnectionUpdate addConnection(String userId, String sessionId);

    /**
     * 세션을 제거한다. 마지막 연결(1 → 0)이면 같은 원자적 연산 안에서 온라인 사용자 집합에서도 뺀다.
     */
    ConnectionUpdate removeConnection(String userId, String sessionId);

    long connectionCount(String userId);
    Set<String> connections(String userId);

    /**
     * 온라인 사용자 집합만 직접 고친다 (운영 보정용). Roster 는 호출하지 않는다.
     */
    void markOnline(String userId);
    void markOffline(String userId);
    Set<String> onlineUsers();

    /**
     * 연결 수 기준의 온라인 여부. 온라인 사용자 집합과는 독립적으로 계산된다.
     */
    default boolean isOnline(String userId) {
        return connectionCount(userId) > 0;
    }
}
