package com.dreambig.chat.server.ws;

import com.dreambig.chat.server.model.ChatMessage;
import com.dreambig.chat.server.model.MessageType;
import com.dreambig.chat.server.model.UserProfile;
import com.dreambig.chat.server.protocol.ChatHistoryRequest;
import com.dreambig.chat.server.protocol.ChatMessageRequest;
import com.dreambig.chat.server.protocol.EnvelopeDecoder;
import com.dreambig.chat.server.protocol.InboundEnvelope;
import com.dreambig.chat.server.protocol.InboundHandler;
import com.dreambig.chat.server.protocol.JoinRoomRequest;
import com.dreambig.chat.server.protocol.LeaveRoomRequest;
import com.dreambig.chat.server.protocol.MalformedFrameException;
import com.dreambig.chat.server.protocol.OnlineUsersRequest;
import com.dreambig.chat.server.protocol.OutboundMessages;
import com.dreambig.chat.server.protocol.TypingRequest;
import com.dreambig.chat.server.store.MessageStore;
import com.dreambig.chat.server.store.MessageStoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Routes decoded client frames to their handlers.
 *
 * Errors inside one handler are logged and never end the connection; only a frame that
 * is not a JSON object does ({@link Outcome#TERMINATE}).
 */
@Component
public class ProtocolDispatcher implements InboundHandler<ChatSession> {
    private static final Logger log = LoggerFactory.getLogger(ProtocolDispatcher.class);

    public enum Outcome { CONTINUE, TERMINATE }

    private final EnvelopeDecoder decoder = new EnvelopeDecoder(new ObjectMapper());
    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private final ConnectionManager connections;
    private final MessageStore store;
    private final Clock clock;
    private final int defaultHistoryLimit;
    private final int maxHistoryLimit;
    private final boolean enforceMembership;

    public ProtocolDispatcher(ConnectionManager connections,
                              MessageStore store,
                              Clock clock,
                              @Value("${chat.history.default-limit:50}") int defaultHistoryLimit,
                              @Value("${chat.history.max-limit:200}") int maxHistoryLimit,
                              @Value("${chat.rooms.enforce-membership:false}") boolean enforceMembership) {
        this.connections = connections;
        this.store = store;
        this.clock = clock;
        this.defaultHistoryLimit = defaultHistoryLimit;
        this.maxHistoryLimit = maxHistoryLimit;
        this.enforceMembership = enforceMembership;
    }

    public Outcome dispatch(ChatSession sender, String frame) {
        if (!sender.isOpen()) {
            log.debug("dropping frame for user={} in state {}", sender.userId(), sender.state());
            return Outcome.CONTINUE;
        }

        Optional<InboundEnvelope> decoded;
        try {
            decoded = decoder.decode(frame);
        } catch (MalformedFrameException e) {
            log.warn("[WARN] user={} {}", sender.userId(), e.getMessage());
            return Outcome.TERMINATE;
        }
        if (decoded.isEmpty()) return Outcome.CONTINUE;

        InboundEnvelope envelope = decoded.get();
        Set<ConstraintViolation<InboundEnvelope>> violations = validator.validate(envelope);
        if (!violations.isEmpty()) {
            log.warn("[WARN] validation failed type={} user={}: {}",
                    envelope.type().wire(), sender.userId(), describe(violations));
            return Outcome.CONTINUE;
        }

        try {
            envelope.dispatchTo(this, sender);
        } catch (RuntimeException e) {
            log.error("[ERROR] handler failed type={} user={}", envelope.type().wire(), sender.userId(), e);
        }
        return Outcome.CONTINUE;
    }

    // -- handlers --

    @Override
    public void onChatMessage(ChatSession sender, ChatMessageRequest request) {
        String roomId = request.roomId();
        String content = request.content() == null ? "" : request.content().trim();
        if (content.isEmpty() || roomId == null || roomId.isBlank()) return;

        MessageType type = MessageType.fromWire(request.messageType());
        if (type == null) return;

        if (enforceMembership && !connections.isMember(roomId, sender.userId())) {
            log.warn("[WARN] user={} is not a member of room={}", sender.userId(), roomId);
            connections.sendToUser(sender.userId(),
                    OutboundMessages.error("not_a_member", "join the room before sending", roomId, clock.instant()));
            return;
        }

        ChatMessage saved;
        try {
            saved = store.createMessage(roomId, sender.userId(), content, type);
        } catch (MessageStoreException e) {
            log.error("[ERROR] persist failed room={} user={}", roomId, sender.userId(), e);
            connections.sendToUser(sender.userId(),
                    OutboundMessages.error("message_not_saved", "message could not be saved", roomId, clock.instant()));
            return;
        }

        int delivered = connections.broadcastToRoom(roomId,
                OutboundMessages.chatMessage(saved, sender.displayName()), sender.userId());
        connections.sendToUser(sender.userId(), OutboundMessages.messageSent(saved));
        log.info("[MESSAGE] room={} user={} id={} delivered={}", roomId, sender.userId(), saved.id(), delivered);
    }

    @Override
    public void onJoinRoom(ChatSession sender, JoinRoomRequest request) {
        connections.joinRoom(request.roomId(), sender.userId());
    }

    @Override
    public void onLeaveRoom(ChatSession sender, LeaveRoomRequest request) {
        connections.leaveRoom(request.roomId(), sender.userId());
    }

    @Override
    public void onTyping(ChatSession sender, TypingRequest request) {
        connections.broadcastToRoom(request.roomId(),
                OutboundMessages.typing(request.roomId(), sender.userId(), request.typing(), clock.instant()),
                sender.userId());
    }

    @Override
    public void onOnlineUsers(ChatSession sender, OnlineUsersRequest request) {
        connections.sendToUser(sender.userId(),
                OutboundMessages.onlineUsers(connections.listOnline(), clock.instant()));
    }

    @Override
    public void onChatHistory(ChatSession sender, ChatHistoryRequest request) {
        String roomId = request.roomId();
        int limit = request.limit() == null
                ? defaultHistoryLimit
                : Math.max(1, Math.min(request.limit(), maxHistoryLimit));
        int offset = request.offset() == null ? 0 : Math.max(0, request.offset());

        List<ChatMessage> page;
        try {
            page = store.findMessages(roomId, limit, offset);
        } catch (MessageStoreException e) {
            log.error("[ERROR] history failed room={} user={}", roomId, sender.userId(), e);
            page = List.of();
        }

        // store order is most recent first
        List<ChatMessage> chronological = new ArrayList<>(page);
        Collections.reverse(chronological);

        connections.sendToUser(sender.userId(), OutboundMessages.chatHistory(
                roomId, chronological, senderNames(page), page.size() == limit, clock.instant()));
    }

    // -- helpers --

    private Map<Long, String> senderNames(List<ChatMessage> messages) {
        Map<Long, String> names = new HashMap<>();
        for (ChatMessage m : messages) {
            if (names.containsKey(m.senderId())) continue;
            String name;
            try {
                name = store.findUser(m.senderId()).map(UserProfile::displayName).orElse("Unknown");
            } catch (MessageStoreException e) {
                log.warn("[WARN] sender lookup failed user={} {}", m.senderId(), e.getMessage());
                name = "Unknown";
            }
            names.put(m.senderId(), name);
        }
        return names;
    }

    private static String describe(Set<? extends ConstraintViolation<?>> violations) {
        List<String> parts = new ArrayList<>(violations.size());
        for (ConstraintViolation<?> v : violations) {
            parts.add(v.getPropertyPath() + " " + v.getMessage());
        }
        Collections.sort(parts);
        return String.join(", ", parts);
    }
}
