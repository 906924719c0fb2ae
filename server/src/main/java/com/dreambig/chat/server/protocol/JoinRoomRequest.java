package com.dreambig.chat.server.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JoinRoomRequest(
        @JsonProperty("room_id") @NotBlank @Size(max = 255) String roomId
) implements InboundEnvelope {

    @Override
    public InboundType type() { return InboundType.JOIN_ROOM; }

    @Override
    public <C> void dispatchTo(InboundHandler<C> handler, C context) {
        handler.onJoinRoom(context, this);
    }
}
