package com.dreambig.chat.server.model;

public record UserProfile(long id, String name, String email, String role) {

    public String displayName() {
        return name == null || name.isBlank() ? "Unknown" : name;
    }
}
