package com.juggernaut.shared.presence.core;

import java.util.Optional;

import com.juggernaut.shared.codec.EventEnvelope;

/**
 * 이벤트 봉투에서 논리 사용자 id 를 추출한다.
 * 사용자와 연결되지 않은(익명) 연결이면 empty 를 반환한다.
 */
@FunctionalInterface
public interface UserIdResolver {
    Optional<String> resolve(EventEnvelope envelope);
}
