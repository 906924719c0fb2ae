package com.dreambig.chat.server.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only view of one live session, as listed in {@code online_users}.
 * {@code connectedAt} is an ISO-8601 instant.
 */
public record SessionSummary(
        @JsonProperty("user_id") long userId,
        @JsonProperty("name") String name,
        @JsonProperty("email") String email,
        @JsonProperty("role") String role,
        @JsonProperty("connected_at") String connectedAt,
        @JsonProperty("status") String status
) {
}
