package com.juggernaut.shared.presence.event;

import org.springframework.context.ApplicationEvent;

import lombok.Getter;

@Getter
public class UserSignedOutEvent extends ApplicationEvent {
    private final String userId;

    public UserSignedOutEvent(Object source, String userId) {
        super(source);
        this.userId = userId;
    }
}
