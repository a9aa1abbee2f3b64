package com.juggernaut.shared.presence.core;

import org.springframework.context.ApplicationEventPublisher;

import com.juggernaut.shared.presence.event.UserSignedInEvent;
import com.juggernaut.shared.presence.event.UserSignedOutEvent;

import lombok.RequiredArgsConstructor;

/**
 * Roster 전이를 Spring 애플리케이션 이벤트로 다시 발행한다.
 * 앱에서는 {@code @EventListener} 로 {@link UserSignedInEvent} / {@link UserSignedOutEvent} 를 받으면 된다.
 */
@RequiredArgsConstructor
public class PresenceEventPublisher implements RosterListener {

    private final ApplicationEventPublisher publisher;

    @Override
    public void onSignedIn(String userId) {
        publisher.publishEvent(new UserSignedInEvent(this, userId));
    }

    @Override
    public void onSignedOut(String userId) {
        publisher.publishEvent(new UserSignedOutEvent(this, userId));
    }
}
