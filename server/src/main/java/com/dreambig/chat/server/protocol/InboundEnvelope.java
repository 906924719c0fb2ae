package com.dreambig.chat.server.protocol;

/**
 * A decoded client frame. The set of verbs is closed: every implementation routes itself
 * to exactly one {@link InboundHandler} method.
 */
public sealed interface InboundEnvelope
        permits ChatMessageRequest, JoinRoomRequest, LeaveRoomRequest,
                TypingRequest, OnlineUsersRequest, ChatHistoryRequest {

    InboundType type();

    <C> void dispatchTo(InboundHandler<C> handler, C context);
}
