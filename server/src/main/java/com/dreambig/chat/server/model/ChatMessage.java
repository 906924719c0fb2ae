package com.dreambig.chat.server.model;

import java.time.Instant;

/**
 * A persisted chat message as returned by the message store.
 */
public record ChatMessage(
        long id,
        String roomId,
        long senderId,
        String content,
        MessageType messageType,
        String fileUrl,
        Instant timestamp
) {
}
