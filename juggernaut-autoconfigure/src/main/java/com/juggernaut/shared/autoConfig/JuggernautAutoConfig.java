package com.juggernaut.shared.autoConfig;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import com.juggernaut.shared.broker.MessageBroker;
import com.juggernaut.shared.client.JuggernautClient;
import com.juggernaut.shared.codec.EnvelopeCodec;
import com.juggernaut.shared.config.InMemoryConfig;
import com.juggernaut.shared.config.RedisConfig;
import com.juggernaut.shared.properties.JuggernautPresenceProperties;
import com.juggernaut.shared.properties.JuggernautProperties;

/**
 * juggernaut 클라이언트 자동 설정.
 * 브로커 구현체는 {@code juggernaut.broker.type} 에 따라 InMemory 또는 Redis 로 선택된다.
 */
@AutoConfiguration(after = RedisAutoConfiguration.class)
@EnableConfigurationProperties({JuggernautProperties.class, JuggernautPresenceProperties.class})
@Import({InMemoryConfig.class, RedisConfig.class})
public class JuggernautAutoConfig {

    @Bean
    @ConditionalOnMissingBean
    public EnvelopeCodec envelopeCodec() {
        return new EnvelopeCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public JuggernautClient juggernautClient(MessageBroker messageBroker,
                                             EnvelopeCodec envelopeCodec,
                                             JuggernautProperties props) {
        return new JuggernautClient(messageBroker, envelopeCodec, props.getKey());
    }
}
