package com.dreambig.chat.server.model;

import java.util.Locale;

public enum SessionStatus {
    ONLINE, OFFLINE;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
