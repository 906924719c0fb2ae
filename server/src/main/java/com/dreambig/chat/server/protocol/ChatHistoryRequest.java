package com.dreambig.chat.server.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * {@code limit} and {@code offset} are optional; the dispatcher applies defaults and bounds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatHistoryRequest(
        @JsonProperty("room_id") @NotBlank @Size(max = 255) String roomId,
        @JsonProperty("limit") Integer limit,
        @JsonProperty("offset") Integer offset
) implements InboundEnvelope {

    @Override
    public InboundType type() { return InboundType.GET_CHAT_HISTORY; }

    @Override
    public <C> void dispatchTo(InboundHandler<C> handler, C context) {
        handler.onChatHistory(context, this);
    }
}
