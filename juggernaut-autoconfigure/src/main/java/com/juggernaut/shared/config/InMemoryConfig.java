package com.juggernaut.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.juggernaut.shared.broker.InMemoryMessageBroker;
import com.juggernaut.shared.broker.MessageBroker;
import com.juggernaut.shared.presence.storage.InMemoryPresenceStore;
import com.juggernaut.shared.presence.storage.PresenceStore;

import lombok.extern.slf4j.Slf4j;

/**
 * InMemory 브로커/저장소 설정 (기본값).
 *
 * 사용법:
 * 1. 기본값: 아무것도 설정하지 않으면 인메모리 브로커와 저장소 사용
 * 2. Redis 사용: application.yml에 다음 추가:
 *    juggernaut:
 *      broker:
 *        type: redis
 *
 * 인메모리 구성은 단일 인스턴스 환경에 적합합니다.
 * 여러 Roster 프로세스가 상태를 공유해야 하면 Redis를 사용하세요.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(name = "juggernaut.broker.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryConfig {

    @Bean
    @ConditionalOnMissingBean(MessageBroker.class)
    public InMemoryMessageBroker inMemoryMessageBroker() {
        log.info("[Juggernaut] Using InMemory message broker");
        return new InMemoryMessageBroker();
    }

    @Bean
    @ConditionalOnMissingBean(PresenceStore.class)
    public InMemoryPresenceStore inMemoryPresenceStore() {
        log.info("[Juggernaut] Using InMemory presence store");
        return new InMemoryPresenceStore();
    }
}
