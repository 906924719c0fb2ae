package com.dreambig.chat.server.protocol;

public enum InboundType {
    CHAT_MESSAGE("chat_message", ChatMessageRequest.class),
    JOIN_ROOM("join_room", JoinRoomRequest.class),
    LEAVE_ROOM("leave_room", LeaveRoomRequest.class),
    TYPING("typing", TypingRequest.class),
    GET_ONLINE_USERS("get_online_users", OnlineUsersRequest.class),
    GET_CHAT_HISTORY("get_chat_history", ChatHistoryRequest.class);

    private final String wire;
    private final Class<? extends InboundEnvelope> payloadType;

    InboundType(String wire, Class<? extends InboundEnvelope> payloadType) {
        this.wire = wire;
        this.payloadType = payloadType;
    }

    public String wire() { return wire; }

    public Class<? extends InboundEnvelope> payloadType() { return payloadType; }

    public static InboundType fromWire(String value) {
        for (InboundType t : values()) {
            if (t.wire.equals(value)) return t;
        }
        return null;
    }
}
