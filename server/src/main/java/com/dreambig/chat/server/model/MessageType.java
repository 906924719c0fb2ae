package com.dreambig.chat.server.model;

import java.util.Locale;

public enum MessageType {
    TEXT, IMAGE, FILE, SYSTEM;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the matching type, {@code TEXT} for null, or null when the value is unknown
     */
    public static MessageType fromWire(String value) {
        if (value == null) return TEXT;
        for (MessageType t : values()) {
            if (t.wire().equalsIgnoreCase(value.trim())) return t;
        }
        return null;
    }
}
