package com.dreambig.chat.server.store;

import com.dreambig.chat.server.model.ChatMessage;
import com.dreambig.chat.server.model.MessageType;
import com.dreambig.chat.server.model.UserProfile;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for chat messages. All methods may throw {@link MessageStoreException}.
 */
public interface MessageStore {

    /**
     * Persists a message; the store assigns its id and timestamp.
     */
    ChatMessage createMessage(String roomId, long senderId, String content, MessageType messageType);

    /**
     * @return at most {@code limit} messages of the room, most recent first, skipping {@code offset}
     */
    List<ChatMessage> findMessages(String roomId, int limit, int offset);

    Optional<UserProfile> findUser(long userId);
}
