package com.dreambig.chat.server.protocol;

/**
 * One callback per inbound verb.
 *
 * @param <C> per-call context, typically the sending session
 */
public interface InboundHandler<C> {

    void onChatMessage(C context, ChatMessageRequest request);

    void onJoinRoom(C context, JoinRoomRequest request);

    void onLeaveRoom(C context, LeaveRoomRequest request);

    void onTyping(C context, TypingRequest request);

    void onOnlineUsers(C context, OnlineUsersRequest request);

    void onChatHistory(C context, ChatHistoryRequest request);
}
