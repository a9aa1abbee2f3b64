package com.juggernaut.shared.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ConfigurationProperties(prefix = "juggernaut")
public class JuggernautProperties {

    /**
     * 발행용 제어 채널 이름이자 이벤트 채널({@code <key>:subscribe} 등)의 prefix
     */
    private String key = "juggernaut";

    /**
     * Broker Settings
     */
    private Broker broker = new Broker();

    @Getter
    @Setter
    public static class Broker {
        /**
         * memory: 단일 프로세스용 인메모리 브로커/저장소 (기본값)
         * redis: Redis Pub/Sub + Redis set 저장소
         */
        private String type = "memory";
    }
}
