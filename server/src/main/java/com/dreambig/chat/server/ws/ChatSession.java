package com.dreambig.chat.server.ws;

import com.dreambig.chat.server.model.SessionStatus;
import com.dreambig.chat.server.model.SessionSummary;
import com.dreambig.chat.server.model.UserProfile;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live connection of one authenticated user.
 *
 * Identity fields are immutable; {@code state} and {@code status} are written by the
 * connection manager and read from any thread.
 */
public final class ChatSession {

    private final long userId;
    private final String displayName;
    private final String email;
    private final String role;
    private final Instant connectedAt;
    private final ChatTransport transport;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private volatile SessionStatus status = SessionStatus.ONLINE;

    public ChatSession(UserProfile profile, ChatTransport transport, Instant connectedAt) {
        this.userId = profile.id();
        this.displayName = profile.displayName();
        this.email = profile.email() == null ? "" : profile.email();
        this.role = profile.role() == null ? "user" : profile.role();
        this.connectedAt = connectedAt;
        this.transport = transport;
    }

    public long userId() { return userId; }

    public String displayName() { return displayName; }

    public String role() { return role; }

    public Instant connectedAt() { return connectedAt; }

    public ChatTransport transport() { return transport; }

    public ConnectionState state() { return state.get(); }

    public SessionStatus status() { return status; }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN;
    }

    void open() {
        state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN);
    }

    /**
     * @return true if this call moved the session out of CONNECTING/OPEN
     */
    boolean beginClosing() {
        while (true) {
            ConnectionState s = state.get();
            if (s == ConnectionState.CLOSING || s == ConnectionState.CLOSED) return false;
            if (state.compareAndSet(s, ConnectionState.CLOSING)) return true;
        }
    }

    void finishClosing() {
        state.set(ConnectionState.CLOSED);
        status = SessionStatus.OFFLINE;
    }

    public SessionSummary summary() {
        return new SessionSummary(userId, displayName, email, role, connectedAt.toString(), status.wire());
    }

    @Override
    public String toString() {
        return "ChatSession{user=" + userId + ", transport=" + transport.id() + ", state=" + state.get() + "}";
    }
}
