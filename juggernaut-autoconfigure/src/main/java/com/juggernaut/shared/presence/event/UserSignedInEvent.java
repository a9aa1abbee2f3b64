package com.juggernaut.shared.presence.event;

import org.springframework.context.ApplicationEvent;

import lombok.Getter;

@Getter
public class UserSignedInEvent extends ApplicationEvent {
    private final String userId;

    public UserSignedInEvent(Object source, String userId) {
        super(source);
        this.userId = userId;
    }
}
