package com.dreambig.chat.server.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessageRequest(
        @JsonProperty("room_id") @NotBlank @Size(max = 255) String roomId,
        @JsonProperty("content") @NotBlank @Size(max = 4000) String content,
        @JsonProperty("message_type") @Pattern(regexp = "(?i)text|image|file|system") String messageType
) implements InboundEnvelope {

    @Override
    public InboundType type() { return InboundType.CHAT_MESSAGE; }

    @Override
    public <C> void dispatchTo(InboundHandler<C> handler, C context) {
        handler.onChatMessage(context, this);
    }
}
