package com.dreambig.chat.server.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OnlineUsersRequest() implements InboundEnvelope {

    @Override
    public InboundType type() { return InboundType.GET_ONLINE_USERS; }

    @Override
    public <C> void dispatchTo(InboundHandler<C> handler, C context) {
        handler.onOnlineUsers(context, this);
    }
}
