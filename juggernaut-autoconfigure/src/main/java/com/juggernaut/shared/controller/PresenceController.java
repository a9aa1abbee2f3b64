package com.juggernaut.shared.controller;

import java.util.Set;
import java.util.TreeSet;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.juggernaut.shared.presence.core.Roster;
import com.juggernaut.shared.presence.dto.PresenceSnapshot;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/presence")
@RequiredArgsConstructor
public class PresenceController {

    private final Roster roster;

    @GetMapping
    public Set<String> getOnlineUsers() {
        return new TreeSet<>(roster.getOnlineUsers());
    }

    @GetMapping("/{userId}")
    public PresenceSnapshot getPresence(@PathVariable("userId") String userId) {
        return roster.getPresence(userId);
    }
}
