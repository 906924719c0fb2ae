package com.dreambig.chat.server.protocol;

/**
 * A server-to-client frame, serialized once and shared by every recipient of a fan-out.
 */
public record OutboundEnvelope(String type, String json) {

    @Override
    public String toString() {
        return type;
    }
}
