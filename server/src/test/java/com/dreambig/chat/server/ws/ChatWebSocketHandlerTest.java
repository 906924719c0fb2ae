package com.dreambig.chat.server.ws;

import com.dreambig.chat.server.auth.TokenAuthenticator;
import com.dreambig.chat.server.model.UserProfile;
import com.dreambig.chat.server.store.InMemoryMessageStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatWebSocketHandlerTest {

    private static final UserProfile ALICE = new UserProfile(1, "Alice", "alice@example.com", "user");

    private ConnectionManager connections;
    private TokenAuthenticator authenticator;
    private ChatWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        connections = new ConnectionManager(clock);
        ProtocolDispatcher dispatcher = new ProtocolDispatcher(
                connections, new InMemoryMessageStore(clock), clock, 50, 200, false);
        authenticator = mock(TokenAuthenticator.class);
        when(authenticator.authenticate(anyString())).thenReturn(Optional.empty());
        when(authenticator.authenticate("good-token")).thenReturn(Optional.of(ALICE));

        handler = new ChatWebSocketHandler(connections, dispatcher, authenticator,
                "/api/v1/chat/ws/{token}", 1000, 64 * 1024);
    }

    private static WebSocketSession session(String path) {
        WebSocketSession s = mock(WebSocketSession.class);
        Map<String, Object> attributes = new HashMap<>();
        when(s.getId()).thenReturn("ws-1");
        when(s.getUri()).thenReturn(URI.create("ws://localhost:8080" + path));
        when(s.getAttributes()).thenReturn(attributes);
        when(s.isOpen()).thenReturn(true);
        return s;
    }

    @Test
    void validTokenRegistersSession() {
        WebSocketSession ws = session("/api/v1/chat/ws/good-token");

        handler.afterConnectionEstablished(ws);

        assertTrue(connections.isOnline(1));
        assertInstanceOf(ChatSession.class, ws.getAttributes().get(ChatWebSocketHandler.SESSION_ATTR));
    }

    @Test
    void invalidTokenIsClosedWithPolicyViolation() throws Exception {
        WebSocketSession ws = session("/api/v1/chat/ws/bogus");

        handler.afterConnectionEstablished(ws);

        verify(ws).close(CloseStatus.POLICY_VIOLATION);
        assertFalse(connections.isOnline(1));
        assertTrue(connections.listOnline().isEmpty());
    }

    @Test
    void missingTokenIsClosedWithPolicyViolation() throws Exception {
        WebSocketSession ws = session("/api/v1/chat/ws/");

        handler.afterConnectionEstablished(ws);

        verify(ws).close(CloseStatus.POLICY_VIOLATION);
        verify(authenticator, never()).authenticate(any());
    }

    @Test
    void malformedFrameClosesWithBadDataAndReleases() throws Exception {
        WebSocketSession ws = session("/api/v1/chat/ws/good-token");
        handler.afterConnectionEstablished(ws);

        handler.handleTextMessage(ws, new TextMessage("{not json"));

        verify(ws).close(CloseStatus.BAD_DATA);
        assertFalse(connections.isOnline(1));
    }

    @Test
    void validFrameKeepsConnectionOpen() throws Exception {
        WebSocketSession ws = session("/api/v1/chat/ws/good-token");
        handler.afterConnectionEstablished(ws);

        handler.handleTextMessage(ws, new TextMessage("{\"type\":\"join_room\",\"room_id\":\"property_42\"}"));

        verify(ws, never()).close(any(CloseStatus.class));
        assertTrue(connections.isMember("property_42", 1));
    }

    @Test
    void closeReleasesSessionAndRooms() {
        WebSocketSession ws = session("/api/v1/chat/ws/good-token");
        handler.afterConnectionEstablished(ws);
        connections.joinRoom("property_42", 1);

        handler.afterConnectionClosed(ws, CloseStatus.NORMAL);

        assertFalse(connections.isOnline(1));
        assertEquals(0, connections.roomCount());
    }

    @Test
    void closeOfUnregisteredSessionIsIgnored() {
        WebSocketSession ws = session("/api/v1/chat/ws/bogus");

        handler.afterConnectionClosed(ws, CloseStatus.POLICY_VIOLATION);

        assertTrue(connections.listOnline().isEmpty());
    }

    @Test
    void transportErrorClosesWithServerError() throws Exception {
        WebSocketSession ws = session("/api/v1/chat/ws/good-token");
        handler.afterConnectionEstablished(ws);

        handler.handleTransportError(ws, new java.io.IOException("reset by peer"));

        verify(ws).close(CloseStatus.SERVER_ERROR);
    }

    @Test
    void extractTokenReadsLastPathSegment() {
        assertEquals("abc123", handler.extractToken(URI.create("ws://h/api/v1/chat/ws/abc123")));
        assertEquals("abc123", handler.extractToken(URI.create("ws://h/api/v1/chat/ws/abc123?x=1")));
        assertNull(handler.extractToken(URI.create("ws://h/api/v1/chat/ws/")));
        assertNull(handler.extractToken(URI.create("ws://h/other/abc123")));
        assertNull(handler.extractToken(null));
    }
}
