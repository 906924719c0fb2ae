package com.dreambig.chat.server.ws;

import com.dreambig.chat.server.model.SessionStatus;
import com.dreambig.chat.server.model.SessionSummary;
import com.dreambig.chat.server.model.UserProfile;
import com.dreambig.chat.server.protocol.OutboundEnvelope;
import com.dreambig.chat.server.protocol.OutboundMessages;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Owns who is online and who is in which room.
 *
 * The session registry (user -> session) and the room index (room -> member users) are
 * guarded by one lock so that a disconnect removes a user from both at once. Broadcasts
 * take a snapshot of their recipients under the lock and write outside it; a recipient
 * whose write fails is evicted without interrupting the rest of the fan-out.
 *
 * Presence changes carry a {@code seq} taken under the lock, so a client can drop a
 * {@code user_status} older than one it has already seen for the same user.
 */
@Component
public class ConnectionManager implements ChatNotifier {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    /** Sent to the older connection when the same user connects again. */
    public static final CloseStatus SESSION_REPLACED = new CloseStatus(4000, "session replaced");

    private final Object lock = new Object();
    private final Map<Long, ChatSession> sessions = new HashMap<>();
    private final Map<String, Set<Long>> rooms = new HashMap<>();
    private long presenceSeq;

    private final Clock clock;

    public ConnectionManager(Clock clock) {
        this.clock = clock;
    }

    // -- lifecycle --

    /**
     * Registers a live connection for {@code profile}. An existing session of the same user is
     * replaced and its transport closed; the user's room memberships carry over.
     */
    public ChatSession connect(ChatTransport transport, UserProfile profile) {
        ChatSession session = new ChatSession(profile, transport, clock.instant());
        ChatSession previous;
        List<ChatSession> audience;
        long seq;
        synchronized (lock) {
            previous = sessions.put(session.userId(), session);
            session.open();
            audience = othersLocked(session.userId());
            seq = ++presenceSeq;
        }

        if (previous != null) {
            previous.beginClosing();
            previous.finishClosing();
            previous.transport().close(SESSION_REPLACED);
            log.info("[CONNECT] user={} replaced transport={}", session.userId(), previous.transport().id());
        }
        log.info("[CONNECT] user={} name={} transport={} online={}",
                session.userId(), session.displayName(), transport.id(), audience.size() + 1);

        evict(deliver(audience, OutboundMessages.userStatus(
                        session.userId(), SessionStatus.ONLINE.wire(), seq, clock.instant())),
                CloseStatus.SESSION_NOT_RELIABLE);
        return session;
    }

    /**
     * Removes the user's session and all of its room memberships, then announces the user offline.
     * No-op when the user is not connected.
     */
    public void disconnect(long userId) {
        ChatSession session;
        synchronized (lock) {
            session = sessions.get(userId);
        }
        if (session != null) {
            evict(List.of(session), CloseStatus.NORMAL);
        }
    }

    /**
     * Connection-closed path: cleans up only if {@code session} is still the registered one, so a
     * replaced connection closing late cannot evict its successor.
     */
    public void release(ChatSession session) {
        evict(List.of(session), CloseStatus.NORMAL);
    }

    @PreDestroy
    public void shutdown() {
        List<ChatSession> all;
        synchronized (lock) {
            all = new ArrayList<>(sessions.values());
            sessions.clear();
            rooms.clear();
        }
        for (ChatSession s : all) {
            s.beginClosing();
            s.finishClosing();
            s.transport().close(CloseStatus.GOING_AWAY);
        }
        log.info("[SHUTDOWN] closed {} connections", all.size());
    }

    // -- rooms --

    /**
     * @return false when the user is already a member or has no live session
     */
    public boolean joinRoom(String roomId, long userId) {
        List<ChatSession> audience;
        int size;
        synchronized (lock) {
            if (!sessions.containsKey(userId)) {
                log.warn("[WARN] join room={} by offline user={}", roomId, userId);
                return false;
            }
            Set<Long> members = rooms.computeIfAbsent(roomId, k -> new LinkedHashSet<>());
            if (!members.add(userId)) return false;
            audience = membersLocked(members, userId);
            size = members.size();
        }
        log.info("[JOIN] room={} user={} total={}", roomId, userId, size);
        evict(deliver(audience, OutboundMessages.userJoined(roomId, userId, clock.instant())),
                CloseStatus.SESSION_NOT_RELIABLE);
        return true;
    }

    /**
     * @return false when the user was not a member
     */
    public boolean leaveRoom(String roomId, long userId) {
        List<ChatSession> audience;
        int remaining;
        synchronized (lock) {
            Set<Long> members = rooms.get(roomId);
            if (members == null || !members.remove(userId)) return false;
            if (members.isEmpty()) rooms.remove(roomId);
            audience = membersLocked(members, null);
            remaining = members.size();
        }
        log.info("[LEAVE] room={} user={} remaining={}", roomId, userId, remaining);
        evict(deliver(audience, OutboundMessages.userLeft(roomId, userId, clock.instant())),
                CloseStatus.SESSION_NOT_RELIABLE);
        return true;
    }

    // -- delivery --

    @Override
    public boolean sendToUser(long userId, OutboundEnvelope envelope) {
        ChatSession session;
        synchronized (lock) {
            session = sessions.get(userId);
        }
        if (session == null) return false;
        if (write(session, envelope)) return true;
        evict(List.of(session), CloseStatus.SESSION_NOT_RELIABLE);
        return false;
    }

    public int broadcastToRoom(String roomId, OutboundEnvelope envelope) {
        return broadcastToRoom(roomId, envelope, null);
    }

    @Override
    public int broadcastToRoom(String roomId, OutboundEnvelope envelope, Long excludeUserId) {
        List<ChatSession> targets;
        synchronized (lock) {
            Set<Long> members = rooms.get(roomId);
            if (members == null) return 0;
            targets = membersLocked(members, excludeUserId);
        }
        List<ChatSession> failed = deliver(targets, envelope);
        int delivered = targets.size() - failed.size();
        if (log.isDebugEnabled()) {
            log.debug("[BROADCAST] room={} type={} delivered={} failed={}",
                    roomId, envelope.type(), delivered, failed.size());
        }
        evict(failed, CloseStatus.SESSION_NOT_RELIABLE);
        return delivered;
    }

    // -- queries --

    public List<SessionSummary> listOnline() {
        synchronized (lock) {
            List<SessionSummary> out = new ArrayList<>(sessions.size());
            for (ChatSession s : sessions.values()) out.add(s.summary());
            return out;
        }
    }

    public boolean isOnline(long userId) {
        synchronized (lock) {
            return sessions.containsKey(userId);
        }
    }

    /** Empty when the room does not exist. */
    public Set<Long> roomMembers(String roomId) {
        synchronized (lock) {
            Set<Long> members = rooms.get(roomId);
            return members == null ? Set.of() : new TreeSet<>(members);
        }
    }

    public Set<String> roomsOf(long userId) {
        synchronized (lock) {
            Set<String> out = new TreeSet<>();
            for (Map.Entry<String, Set<Long>> e : rooms.entrySet()) {
                if (e.getValue().contains(userId)) out.add(e.getKey());
            }
            return out;
        }
    }

    public boolean isMember(String roomId, long userId) {
        synchronized (lock) {
            Set<Long> members = rooms.get(roomId);
            return members != null && members.contains(userId);
        }
    }

    public int roomCount() {
        synchronized (lock) {
            return rooms.size();
        }
    }

    // -- internals --

    /**
     * Writes to each target; returns the ones whose write failed.
     */
    private List<ChatSession> deliver(Collection<ChatSession> targets, OutboundEnvelope envelope) {
        List<ChatSession> failed = new ArrayList<>();
        for (ChatSession s : targets) {
            if (!write(s, envelope)) failed.add(s);
        }
        return failed;
    }

    /**
     * Like {@link #deliver}, but stops as soon as {@code userId} is registered again: the
     * reconnect has already announced the user online to everyone left in the list.
     */
    private List<ChatSession> deliverWhileOffline(List<ChatSession> targets, long userId, OutboundEnvelope offline) {
        List<ChatSession> failed = new ArrayList<>();
        for (ChatSession s : targets) {
            synchronized (lock) {
                if (sessions.containsKey(userId)) {
                    log.debug("user={} reconnected, offline notice withdrawn", userId);
                    break;
                }
            }
            if (!write(s, offline)) failed.add(s);
        }
        return failed;
    }

    private boolean write(ChatSession session, OutboundEnvelope envelope) {
        try {
            session.transport().send(envelope.json());
            return true;
        } catch (IOException e) {
            log.warn("[WARN] send fail user={} type={} {}", session.userId(), envelope.type(), e.getMessage());
            return false;
        }
    }

    /**
     * Removes each session (if still registered) from the registry and every room, closes its
     * transport and announces it offline. Sessions that fail to receive the announcement are
     * queued and evicted in turn.
     */
    private void evict(Collection<ChatSession> dead, CloseStatus closeStatus) {
        if (dead.isEmpty()) return;
        Deque<ChatSession> pending = new ArrayDeque<>(dead);
        while (!pending.isEmpty()) {
            ChatSession session = pending.poll();
            session.beginClosing();

            List<String> leftRooms;
            List<ChatSession> audience;
            long seq = 0;
            synchronized (lock) {
                if (sessions.get(session.userId()) != session) {
                    // already evicted, or replaced by a newer connection
                    leftRooms = null;
                    audience = List.of();
                } else {
                    sessions.remove(session.userId());
                    leftRooms = removeFromRoomsLocked(session.userId());
                    audience = new ArrayList<>(sessions.values());
                    seq = ++presenceSeq;
                }
            }

            session.finishClosing();
            session.transport().close(closeStatus);
            if (leftRooms == null) continue;

            log.info("[DISCONNECT] user={} rooms={} online={}", session.userId(), leftRooms, audience.size());
            OutboundEnvelope offline = OutboundMessages.userStatus(
                    session.userId(), SessionStatus.OFFLINE.wire(), seq, clock.instant());
            pending.addAll(deliverWhileOffline(audience, session.userId(), offline));
        }
    }

    private List<String> removeFromRoomsLocked(long userId) {
        List<String> left = new ArrayList<>();
        Iterator<Map.Entry<String, Set<Long>>> it = rooms.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Set<Long>> e = it.next();
            if (e.getValue().remove(userId)) {
                left.add(e.getKey());
                if (e.getValue().isEmpty()) it.remove();
            }
        }
        return left;
    }

    private List<ChatSession> othersLocked(long userId) {
        List<ChatSession> out = new ArrayList<>(sessions.size());
        for (ChatSession s : sessions.values()) {
            if (s.userId() != userId) out.add(s);
        }
        return out;
    }

    private List<ChatSession> membersLocked(Set<Long> members, Long excludeUserId) {
        List<ChatSession> out = new ArrayList<>(members.size());
        for (Long id : members) {
            if (id.equals(excludeUserId)) continue;
            ChatSession s = sessions.get(id);
            if (s != null) out.add(s);
        }
        return out;
    }
}
