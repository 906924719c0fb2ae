package com.dreambig.chat.server.store;

import com.dreambig.chat.server.model.ChatMessage;
import com.dreambig.chat.server.model.MessageType;
import com.dreambig.chat.server.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link MessageStore} over the {@code chat_messages} and {@code users} tables.
 */
@Repository
public class JdbcMessageStore implements MessageStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcMessageStore.class);

    private static final String INSERT_MESSAGE =
            "INSERT INTO chat_messages (room_id, sender_id, content, message_type, sent_at) " +
                    "VALUES (?, ?, ?, ?, ?)";

    private static final String SELECT_MESSAGES =
            "SELECT id, room_id, sender_id, content, message_type, file_url, sent_at " +
                    "FROM chat_messages " +
                    "WHERE room_id = ? AND is_deleted = FALSE " +
                    "ORDER BY sent_at DESC, id DESC " +
                    "LIMIT ? OFFSET ?";

    private static final String SELECT_USER =
            "SELECT id, name, email, role FROM users WHERE id = ?";

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcMessageStore(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public ChatMessage createMessage(String roomId, long senderId, String content, MessageType messageType) {
        // microsecond precision so the returned timestamp matches what a later read sees
        Instant sentAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_MESSAGE, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, roomId);
            ps.setLong(2, senderId);
            ps.setString(3, content);
            ps.setString(4, messageType.wire());
            ps.setTimestamp(5, Timestamp.from(sentAt));
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("no generated key for chat message");
                }
                long id = keys.getLong(1);
                log.debug("[DB] inserted message id={} room={} sender={}", id, roomId, senderId);
                return new ChatMessage(id, roomId, senderId, content, messageType, null, sentAt);
            }
        } catch (SQLException e) {
            throw new MessageStoreException("insert message failed room=" + roomId, e);
        }
    }

    @Override
    public List<ChatMessage> findMessages(String roomId, int limit, int offset) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_MESSAGES)) {
            ps.setString(1, roomId);
            ps.setInt(2, limit);
            ps.setInt(3, offset);

            List<ChatMessage> out = new ArrayList<>(limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ChatMessage(
                            rs.getLong("id"),
                            rs.getString("room_id"),
                            rs.getLong("sender_id"),
                            rs.getString("content"),
                            parseType(rs.getString("message_type")),
                            rs.getString("file_url"),
                            rs.getTimestamp("sent_at").toInstant()));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new MessageStoreException("load messages failed room=" + roomId, e);
        }
    }

    @Override
    public Optional<UserProfile> findUser(long userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_USER)) {
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new UserProfile(
                        rs.getLong("id"), rs.getString("name"), rs.getString("email"), rs.getString("role")));
            }
        } catch (SQLException e) {
            throw new MessageStoreException("load user failed id=" + userId, e);
        }
    }

    private static MessageType parseType(String value) {
        MessageType t = MessageType.fromWire(value);
        if (t == null) {
            log.warn("[WARN] unknown message_type '{}' in store, reading as text", value);
            return MessageType.TEXT;
        }
        return t;
    }
}
