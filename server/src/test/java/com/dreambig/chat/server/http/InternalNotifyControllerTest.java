package com.dreambig.chat.server.http;

import com.dreambig.chat.server.model.UserProfile;
import com.dreambig.chat.server.ws.ConnectionManager;
import com.dreambig.chat.server.ws.RecordingTransport;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class InternalNotifyControllerTest {

    private static final String TOKEN = "internal-secret";
    private static final String BOOKING_UPDATE =
            "{\"message\":{\"type\":\"booking_update\",\"booking_id\":9,\"status\":\"confirmed\"}}";

    private ConnectionManager connections;
    private RecordingTransport tenant;
    private RecordingTransport agent;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        connections = new ConnectionManager(Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
        tenant = new RecordingTransport("tenant");
        agent = new RecordingTransport("agent");
        connections.connect(tenant, new UserProfile(1, "Tenant", "t@example.com", "user"));
        connections.connect(agent, new UserProfile(2, "Agent", "a@example.com", "agent"));
        connections.joinRoom("booking_9", 1);
        connections.joinRoom("booking_9", 2);
        tenant.clear();
        agent.clear();

        mvc = MockMvcBuilders.standaloneSetup(new InternalNotifyController(connections, TOKEN)).build();
    }

    @Test
    void broadcastReachesRoomMembers() throws Exception {
        mvc.perform(post("/internal/rooms/booking_9/broadcast")
                        .header("Authorization", "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOKING_UPDATE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.room_id").value("booking_9"))
                .andExpect(jsonPath("$.delivered").value(2));

        List<JsonNode> got = tenant.received("booking_update");
        assertEquals(1, got.size());
        assertEquals("confirmed", got.get(0).get("status").asText());
        assertEquals(1, agent.received("booking_update").size());
    }

    @Test
    void broadcastCanExcludeOneUser() throws Exception {
        mvc.perform(post("/internal/rooms/booking_9/broadcast")
                        .header("Authorization", "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":{\"type\":\"booking_update\"},\"exclude_user_id\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.delivered").value(1));

        assertEquals(1, tenant.received("booking_update").size());
        assertTrue(agent.received().isEmpty());
    }

    @Test
    void notifyUserDeliversToOneSession() throws Exception {
        mvc.perform(post("/internal/users/1/notify")
                        .header("Authorization", "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOKING_UPDATE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id").value(1))
                .andExpect(jsonPath("$.delivered").value(true));

        assertEquals(1, tenant.received("booking_update").size());
        assertTrue(agent.received().isEmpty());
    }

    @Test
    void notifyOfflineUserReportsNotDelivered() throws Exception {
        mvc.perform(post("/internal/users/42/notify")
                        .header("Authorization", "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOKING_UPDATE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.delivered").value(false));
    }

    @Test
    void wrongOrMissingTokenIsUnauthorized() throws Exception {
        mvc.perform(post("/internal/rooms/booking_9/broadcast")
                        .header("Authorization", "Bearer nope")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOKING_UPDATE))
                .andExpect(status().isUnauthorized());
        mvc.perform(post("/internal/users/1/notify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOKING_UPDATE))
                .andExpect(status().isUnauthorized());

        assertTrue(tenant.received().isEmpty());
    }

    @Test
    void placeholderOrBlankSecretIsRefusedAtStartup() {
        assertThrows(IllegalStateException.class, () -> new InternalNotifyController(connections, "CHANGE_ME"));
        assertThrows(IllegalStateException.class, () -> new InternalNotifyController(connections, " "));
        assertThrows(IllegalStateException.class, () -> new InternalNotifyController(connections, null));
    }

    @Test
    void envelopeWithoutTypeIsBadRequest() throws Exception {
        mvc.perform(post("/internal/rooms/booking_9/broadcast")
                        .header("Authorization", "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":{\"status\":\"confirmed\"}}"))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/internal/users/1/notify")
                        .header("Authorization", "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        assertTrue(tenant.received().isEmpty());
    }
}
