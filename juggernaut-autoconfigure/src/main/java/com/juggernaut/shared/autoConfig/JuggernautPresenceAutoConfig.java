package com.juggernaut.shared.autoConfig;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.juggernaut.shared.client.JuggernautClient;
import com.juggernaut.shared.controller.PresenceController;
import com.juggernaut.shared.presence.core.MetaKeyUserIdResolver;
import com.juggernaut.shared.presence.core.PresenceEventPublisher;
import com.juggernaut.shared.presence.core.Roster;
import com.juggernaut.shared.presence.core.RosterListener;
import com.juggernaut.shared.presence.core.RosterRunner;
import com.juggernaut.shared.presence.core.UserIdResolver;
import com.juggernaut.shared.presence.storage.PresenceStore;
import com.juggernaut.shared.properties.JuggernautPresenceProperties;

/**
 * Roster(접속 사용자 관리) 자동 설정.
 * {@code juggernaut.presence.enabled=false} 로 끌 수 있다.
 */
@AutoConfiguration(after = JuggernautAutoConfig.class)
@ConditionalOnProperty(prefix = "juggernaut.presence", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JuggernautPresenceAutoConfig {

    @Bean
    @ConditionalOnMissingBean
    public UserIdResolver userIdResolver(JuggernautPresenceProperties props) {
        return new MetaKeyUserIdResolver(props.getUserMetaKey());
    }

    @Bean
    @ConditionalOnMissingBean
    public PresenceEventPublisher presenceEventPublisher(ApplicationEventPublisher publisher) {
        return new PresenceEventPublisher(publisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public Roster roster(JuggernautClient juggernautClient,
                         PresenceStore presenceStore,
                         UserIdResolver userIdResolver,
                         ObjectProvider<RosterListener> listeners) {
        return new Roster(juggernautClient, presenceStore, userIdResolver, listeners.orderedStream().toList());
    }

    // run-on-startup=true 일 때만 컨텍스트와 함께 Roster 를 실행
    @Bean
    @ConditionalOnProperty(prefix = "juggernaut.presence", name = "run-on-startup", havingValue = "true")
    public RosterRunner rosterRunner(Roster roster) {
        return new RosterRunner(roster);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(name = "org.springframework.web.bind.annotation.RestController")
    static class PresenceWebConfig {

        @Bean
        @ConditionalOnMissingBean
        public PresenceController presenceController(Roster roster) {
            return new PresenceController(roster);
        }
    }
}
