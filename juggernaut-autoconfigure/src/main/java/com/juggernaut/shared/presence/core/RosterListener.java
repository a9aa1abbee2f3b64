package com.juggernaut.shared.presence.core;

/**
 * 사용자 접속 상태 전이를 통지받는 리스너.
 * 하나의 사용자가 여러 탭(연결)을 열어도 전이마다 한 번씩만 호출된다.
 */
public interface RosterListener {

    /** 첫 연결이 생겨 오프라인 → 온라인 */
    default void onSignedIn(String userId) {
    }

    /** 마지막 연결이 끊겨 온라인 → 오프라인 */
    default void onSignedOut(String userId) {
    }
}
