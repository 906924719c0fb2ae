package com.dreambig.chat.server.protocol;

import com.dreambig.chat.server.model.ChatMessage;
import com.dreambig.chat.server.model.SessionSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Builders for every outbound envelope. Field names are snake_case on the wire,
 * timestamps are ISO-8601 instants.
 */
public final class OutboundMessages {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private OutboundMessages() {}

    public static OutboundEnvelope chatMessage(ChatMessage m, String senderName) {
        ObjectNode n = envelope("chat_message");
        n.put("message_id", m.id());
        n.put("room_id", m.roomId());
        n.put("sender_id", m.senderId());
        n.put("sender_name", senderName);
        n.put("content", m.content());
        n.put("message_type", m.messageType().wire());
        n.put("timestamp", m.timestamp().toString());
        return write(n);
    }

    public static OutboundEnvelope messageSent(ChatMessage m) {
        ObjectNode n = envelope("message_sent");
        n.put("message_id", m.id());
        n.put("timestamp", m.timestamp().toString());
        return write(n);
    }

    public static OutboundEnvelope userJoined(String roomId, long userId, Instant now) {
        return roomEvent("user_joined", roomId, userId, now);
    }

    public static OutboundEnvelope userLeft(String roomId, long userId, Instant now) {
        return roomEvent("user_left", roomId, userId, now);
    }

    public static OutboundEnvelope typing(String roomId, long userId, boolean typing, Instant now) {
        ObjectNode n = envelope("typing");
        n.put("room_id", roomId);
        n.put("user_id", userId);
        n.put("is_typing", typing);
        n.put("timestamp", now.toString());
        return write(n);
    }

    public static OutboundEnvelope onlineUsers(List<SessionSummary> users, Instant now) {
        ObjectNode n = envelope("online_users");
        n.set("users", MAPPER.valueToTree(users));
        n.put("timestamp", now.toString());
        return write(n);
    }

    /**
     * @param messages chronological order
     * @param senderNames display name per sender id
     */
    public static OutboundEnvelope chatHistory(String roomId, List<ChatMessage> messages,
                                               Map<Long, String> senderNames, boolean hasMore, Instant now) {
        ObjectNode n = envelope("chat_history");
        n.put("room_id", roomId);
        ArrayNode arr = n.putArray("messages");
        for (ChatMessage m : messages) {
            ObjectNode e = arr.addObject();
            e.put("message_id", m.id());
            e.put("sender_id", m.senderId());
            e.put("sender_name", senderNames.getOrDefault(m.senderId(), "Unknown"));
            e.put("content", m.content());
            e.put("message_type", m.messageType().wire());
            e.put("file_url", m.fileUrl());
            e.put("timestamp", m.timestamp().toString());
        }
        n.put("has_more", hasMore);
        n.put("timestamp", now.toString());
        return write(n);
    }

    /**
     * @param seq increases with every presence change; a higher value supersedes a lower one
     */
    public static OutboundEnvelope userStatus(long userId, String status, long seq, Instant now) {
        ObjectNode n = envelope("user_status");
        n.put("user_id", userId);
        n.put("status", status);
        n.put("seq", seq);
        n.put("timestamp", now.toString());
        return write(n);
    }

    public static OutboundEnvelope error(String code, String message, String roomId, Instant now) {
        ObjectNode n = envelope("error");
        n.put("code", code);
        n.put("message", message);
        if (roomId != null) n.put("room_id", roomId);
        n.put("timestamp", now.toString());
        return write(n);
    }

    /**
     * Wraps an envelope produced elsewhere (e.g. the CRUD layer). The node must carry a textual {@code type}.
     */
    public static OutboundEnvelope passThrough(JsonNode node) {
        JsonNode type = node != null && node.isObject() ? node.get("type") : null;
        if (type == null || !type.isTextual() || type.asText().isBlank()) {
            throw new IllegalArgumentException("envelope needs a string 'type'");
        }
        return write((ObjectNode) node);
    }

    // -- helpers --

    private static OutboundEnvelope roomEvent(String type, String roomId, long userId, Instant now) {
        ObjectNode n = envelope(type);
        n.put("room_id", roomId);
        n.put("user_id", userId);
        n.put("timestamp", now.toString());
        return write(n);
    }

    private static ObjectNode envelope(String type) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("type", type);
        return n;
    }

    private static OutboundEnvelope write(ObjectNode n) {
        try {
            return new OutboundEnvelope(n.get("type").asText(), MAPPER.writeValueAsString(n));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("serialize failed", e);
        }
    }
}
