package com.juggernaut.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import com.juggernaut.shared.broker.MessageBroker;
import com.juggernaut.shared.broker.RedisMessageBroker;
import com.juggernaut.shared.presence.storage.PresenceStore;
import com.juggernaut.shared.presence.storage.RedisPresenceStore;
import com.juggernaut.shared.properties.JuggernautPresenceProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Redis 브로커/저장소 설정. {@code juggernaut.broker.type=redis} 일 때만 활성화된다.
 * RedisConnectionFactory 는 Spring Boot 가 만든 것을 우선 사용하고, 없으면 host/port 로 직접 만든다.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(name = "juggernaut.broker.type", havingValue = "redis")
public class RedisConfig {

    @Bean
    @ConditionalOnMissingBean(RedisConnectionFactory.class)
    public LettuceConnectionFactory redisConnectionFactory(
            @Value("${spring.data.redis.host:localhost}") String host,
            @Value("${spring.data.redis.port:6379}") int port
    ) {
        return new LettuceConnectionFactory(host, port);
    }

    @Bean
    @ConditionalOnMissingBean(MessageBroker.class)
    public RedisMessageBroker redisMessageBroker(RedisConnectionFactory connectionFactory) {
        log.info("[Juggernaut] Using Redis message broker");
        return new RedisMessageBroker(connectionFactory, bytesTemplate(connectionFactory));
    }

    @Bean
    @ConditionalOnMissingBean(PresenceStore.class)
    public RedisPresenceStore redisPresenceStore(RedisConnectionFactory connectionFactory,
                                                 JuggernautPresenceProperties props) {
        log.info("[Juggernaut] Using Redis presence store (prefix={})", props.getKeyPrefix());
        return new RedisPresenceStore(new StringRedisTemplate(connectionFactory), props.getKeyPrefix());
    }

    // 발행 봉투는 이미 JSON 으로 인코딩된 바이트이므로 값은 그대로 보낸다
    private static RedisTemplate<String, byte[]> bytesTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(RedisSerializer.byteArray());
        template.afterPropertiesSet();
        return template;
    }
}
