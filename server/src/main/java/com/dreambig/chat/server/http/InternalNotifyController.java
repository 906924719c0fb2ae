package com.dreambig.chat.server.http;

import com.dreambig.chat.server.protocol.OutboundEnvelope;
import com.dreambig.chat.server.protocol.OutboundMessages;
import com.dreambig.chat.server.ws.ChatNotifier;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Set;

/**
 * Push endpoints for the booking/property/investment services, e.g. a booking status change
 * delivered to the tenant. Guarded by the shared internal token.
 */
@RestController
@RequestMapping("/internal")
public class InternalNotifyController {
    private static final Logger log = LoggerFactory.getLogger(InternalNotifyController.class);

    private static final Set<String> PLACEHOLDER_TOKENS = Set.of("CHANGE_ME", "changeme");

    private final ChatNotifier notifier;
    private final String token;

    public InternalNotifyController(ChatNotifier notifier, @Value("${internal.token}") String token) {
        if (token == null || token.isBlank() || PLACEHOLDER_TOKENS.contains(token.trim())) {
            throw new IllegalStateException("internal.token must be set to a real secret (INTERNAL_TOKEN)");
        }
        this.notifier = notifier;
        this.token = token;
    }

    @PostMapping("/rooms/{roomId}/broadcast")
    public ResponseEntity<Map<String, Object>> broadcast(
            @RequestHeader(value = "Authorization", required = false) String auth,
            @PathVariable String roomId,
            @RequestBody NotifyRequest req) {

        if (!authorized(auth)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        OutboundEnvelope envelope;
        try {
            envelope = OutboundMessages.passThrough(req.message());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        int delivered = notifier.broadcastToRoom(roomId, envelope, req.excludeUserId());
        log.info("[NOTIFY] room={} type={} delivered={}", roomId, envelope.type(), delivered);
        return ResponseEntity.ok(Map.of("room_id", roomId, "delivered", delivered));
    }

    @PostMapping("/users/{userId}/notify")
    public ResponseEntity<Map<String, Object>> notifyUser(
            @RequestHeader(value = "Authorization", required = false) String auth,
            @PathVariable long userId,
            @RequestBody NotifyRequest req) {

        if (!authorized(auth)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        OutboundEnvelope envelope;
        try {
            envelope = OutboundMessages.passThrough(req.message());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        boolean delivered = notifier.sendToUser(userId, envelope);
        log.info("[NOTIFY] user={} type={} delivered={}", userId, envelope.type(), delivered);
        return ResponseEntity.ok(Map.of("user_id", userId, "delivered", delivered));
    }

    private boolean authorized(String auth) {
        return auth != null && auth.equals("Bearer " + token);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NotifyRequest(
            @JsonProperty("message") JsonNode message,
            @JsonProperty("exclude_user_id") Long excludeUserId
    ) {
    }
}
