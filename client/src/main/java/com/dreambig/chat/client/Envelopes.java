package com.dreambig.chat.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Client-side builders for the frames the smoke client sends.
 */
public final class Envelopes {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Envelopes() {}

    public static String joinRoom(String roomId) {
        ObjectNode n = envelope("join_room");
        n.put("room_id", roomId);
        return write(n);
    }

    public static String chatMessage(String roomId, String content) {
        ObjectNode n = envelope("chat_message");
        n.put("room_id", roomId);
        n.put("content", content);
        n.put("message_type", "text");
        return write(n);
    }

    public static String chatHistory(String roomId, int limit) {
        ObjectNode n = envelope("get_chat_history");
        n.put("room_id", roomId);
        n.put("limit", limit);
        return write(n);
    }

    public static String leaveRoom(String roomId) {
        ObjectNode n = envelope("leave_room");
        n.put("room_id", roomId);
        return write(n);
    }

    /** Type of an inbound frame, or "?" if it is not an envelope. */
    public static String typeOf(String json) {
        try {
            JsonNode node = MAPPER.readTree(json);
            return node == null ? "?" : node.path("type").asText("?");
        } catch (JsonProcessingException e) {
            return "?";
        }
    }

    private static ObjectNode envelope(String type) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("type", type);
        return n;
    }

    private static String write(ObjectNode n) {
        try {
            return MAPPER.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
