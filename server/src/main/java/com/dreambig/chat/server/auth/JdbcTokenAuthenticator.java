package com.dreambig.chat.server.auth;

import com.dreambig.chat.server.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Optional;

/**
 * Looks tokens up in {@code auth_tokens}, issued by the platform's login flow.
 */
@Component
public class JdbcTokenAuthenticator implements TokenAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(JdbcTokenAuthenticator.class);

    private static final String SELECT_TOKEN =
            "SELECT u.id, u.name, u.email, u.role, t.expires_at " +
                    "FROM auth_tokens t JOIN users u ON u.id = t.user_id " +
                    "WHERE t.token = ?";

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcTokenAuthenticator(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public Optional<UserProfile> authenticate(String token) {
        if (token == null || token.isBlank()) return Optional.empty();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_TOKEN)) {
            ps.setString(1, token);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();

                Timestamp expiresAt = rs.getTimestamp("expires_at");
                if (expiresAt != null && !expiresAt.toInstant().isAfter(clock.instant())) {
                    log.info("[AUTH] expired token for user={}", rs.getLong("id"));
                    return Optional.empty();
                }
                return Optional.of(new UserProfile(
                        rs.getLong("id"), rs.getString("name"), rs.getString("email"), rs.getString("role")));
            }
        } catch (SQLException e) {
            // treated as a rejection; the caller closes the connection
            log.error("[ERROR] token lookup failed", e);
            return Optional.empty();
        }
    }
}
