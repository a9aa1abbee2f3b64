package com.juggernaut.shared.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ConfigurationProperties(prefix = "juggernaut.presence")
public class JuggernautPresenceProperties {

    /**
     * presence(Roster) 기능 사용 여부
     */
    private boolean enabled = true; // 기본값 true

    /**
     * Redis 저장소 키 prefix
     */
    private String keyPrefix = "juggernaut-roster:";

    /**
     * 이벤트 meta 에서 사용자 id 를 읽을 필드 이름
     */
    private String userMetaKey = "user_id";

    /**
     * 애플리케이션 시작 시 Roster 를 백그라운드 스레드에서 실행할지 여부
     */
    private boolean runOnStartup = false;
}
