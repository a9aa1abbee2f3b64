package com.juggernaut.shared.broker;

import java.util.Collection;

/**
 * 메시지 브로커 연결 추상화 인터페이스.
 * Redis 또는 InMemory 구현체를 교체할 수 있습니다.
 */
public interface MessageBroker {

    /**
     * 채널로 메시지 발행. 구독자의 수신 확인을 기다리지 않는다.
     */
    void publish(String channel, byte[] message);

    /**
     * 주어진 채널들을 구독하는 새 구독 생성.
     * 반환된 구독은 사용 후 반드시 {@link BrokerSubscription#close()} 해야 한다.
     */
    BrokerSubscription subscribe(Collection<String> channels);
}
