package com.dreambig.chat.server.http;

import com.dreambig.chat.server.auth.TokenAuthenticator;
import com.dreambig.chat.server.model.SessionSummary;
import com.dreambig.chat.server.ws.ConnectionManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view of live presence for signed-in users.
 */
@RestController
@RequestMapping("/api/v1/chat")
public class PresenceController {

    private static final String BEARER = "Bearer ";

    private final ConnectionManager connections;
    private final TokenAuthenticator authenticator;

    public PresenceController(ConnectionManager connections, TokenAuthenticator authenticator) {
        this.connections = connections;
        this.authenticator = authenticator;
    }

    @GetMapping("/online-users")
    public ResponseEntity<Map<String, Object>> onlineUsers(
            @RequestHeader(value = "Authorization", required = false) String auth) {
        if (!signedIn(auth)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        List<SessionSummary> users = connections.listOnline();
        return ResponseEntity.ok(Map.of("online_users", users, "count", users.size()));
    }

    @GetMapping("/rooms/{roomId}/members")
    public ResponseEntity<Map<String, Object>> roomMembers(
            @RequestHeader(value = "Authorization", required = false) String auth,
            @PathVariable String roomId) {
        if (!signedIn(auth)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        Set<Long> members = connections.roomMembers(roomId);
        return ResponseEntity.ok(Map.of("room_id", roomId, "members", members));
    }

    private boolean signedIn(String auth) {
        if (auth == null || !auth.startsWith(BEARER)) return false;
        return authenticator.authenticate(auth.substring(BEARER.length()).trim()).isPresent();
    }
}
