package com.dreambig.chat.server.ws;

import com.dreambig.chat.server.auth.TokenAuthenticator;
import com.dreambig.chat.server.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriTemplate;

import java.io.IOException;
import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * WebSocket entry point:
 * - open: resolve the token from {@code .../ws/{token}}, reject with 1008 or register the session
 * - text frame: hand to {@link ProtocolDispatcher}; a malformed frame closes the connection
 * - close / transport error: release the session (rooms, presence)
 */
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    static final String SESSION_ATTR = "chat.session";

    private final ConnectionManager connections;
    private final ProtocolDispatcher dispatcher;
    private final TokenAuthenticator authenticator;
    private final UriTemplate template;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public ChatWebSocketHandler(ConnectionManager connections,
                                ProtocolDispatcher dispatcher,
                                TokenAuthenticator authenticator,
                                @Value("${chat.ws.path:/api/v1/chat/ws/{token}}") String path,
                                @Value("${chat.send.time-limit-ms:10000}") int sendTimeLimitMs,
                                @Value("${chat.send.buffer-size-limit:524288}") int bufferSizeLimit) {
        this.connections = connections;
        this.dispatcher = dispatcher;
        this.authenticator = authenticator;
        this.template = new UriTemplate(path);
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String token = extractToken(session.getUri());
        Optional<UserProfile> user = token == null ? Optional.empty() : authenticator.authenticate(token);
        if (user.isEmpty()) {
            log.warn("[REJECT] session={} remote={} invalid token", session.getId(), session.getRemoteAddress());
            close(session, CloseStatus.POLICY_VIOLATION);
            return;
        }

        ChatSession chat = connections.connect(
                new WebSocketTransport(session, sendTimeLimitMs, bufferSizeLimit), user.get());
        session.getAttributes().put(SESSION_ATTR, chat);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ChatSession chat = chatSession(session);
        if (chat == null) return;

        if (dispatcher.dispatch(chat, message.getPayload()) == ProtocolDispatcher.Outcome.TERMINATE) {
            close(session, CloseStatus.BAD_DATA);
            connections.release(chat);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ChatSession chat = chatSession(session);
        log.warn("[WARN] transport error session={} user={} {}", session.getId(),
                chat == null ? "?" : chat.userId(), exception.getMessage());
        close(session, CloseStatus.SERVER_ERROR);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ChatSession chat = chatSession(session);
        if (chat == null) return;
        connections.release(chat);
        log.info("[CLOSE] user={} session={} code={}", chat.userId(), session.getId(), status.getCode());
    }

    String extractToken(URI uri) {
        if (uri == null) return null;
        Map<String, String> vars = template.match(uri.getPath());
        String token = vars.get("token");
        return token == null || token.isBlank() ? null : token;
    }

    private static ChatSession chatSession(WebSocketSession session) {
        return (ChatSession) session.getAttributes().get(SESSION_ATTR);
    }

    private static void close(WebSocketSession session, CloseStatus status) {
        if (!session.isOpen()) return;
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("[WARN] close failed session={} {}", session.getId(), e.getMessage());
        }
    }
}
