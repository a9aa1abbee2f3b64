package com.juggernaut.shared.controller;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.juggernaut.shared.broker.InMemoryMessageBroker;
import com.juggernaut.shared.client.JuggernautClient;
import com.juggernaut.shared.codec.EventEnvelope;
import com.juggernaut.shared.presence.core.Roster;
import com.juggernaut.shared.presence.storage.InMemoryPresenceStore;

class PresenceControllerTest {

    private Roster roster;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        roster = new Roster(new JuggernautClient(new InMemoryMessageBroker()), new InMemoryPresenceStore());
        mockMvc = MockMvcBuilders.standaloneSetup(new PresenceController(roster)).build();
    }

    @Test
    void listsOnlineUsersSorted() throws Exception {
        subscribe("bob", "s1");
        subscribe("alice", "s2");

        mockMvc.perform(get("/presence"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("alice"))
                .andExpect(jsonPath("$[1]").value("bob"));
    }

    @Test
    void showsConnectionsOfOnlineUser() throws Exception {
        subscribe("alice", "s1");
        subscribe("alice", "s2");

        mockMvc.perform(get("/presence/alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value("alice"))
                .andExpect(jsonPath("$.online").value(true))
                .andExpect(jsonPath("$.connections", containsInAnyOrder("s1", "s2")));
    }

    @Test
    void unknownUserIsOffline() throws Exception {
        mockMvc.perform(get("/presence/ghost"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.online").value(false))
                .andExpect(jsonPath("$.connections").isEmpty());
    }

    private void subscribe(String userId, String sessionId) {
        roster.handleEvent("subscribe", EventEnvelope.builder()
                .sessionId(sessionId)
                .meta(Map.of("user_id", userId))
                .build());
    }
}
