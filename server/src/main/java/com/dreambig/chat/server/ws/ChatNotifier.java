package com.dreambig.chat.server.ws;

import com.dreambig.chat.server.protocol.OutboundEnvelope;

/**
 * Push capability handed to code outside the chat core (booking, investment and property
 * services). Holders can deliver envelopes but never see sessions or room membership.
 */
public interface ChatNotifier {

    /**
     * @return true if the user had a live connection and the write succeeded
     */
    boolean sendToUser(long userId, OutboundEnvelope envelope);

    /**
     * @param excludeUserId member to skip, or null
     * @return number of members the envelope was written to
     */
    int broadcastToRoom(String roomId, OutboundEnvelope envelope, Long excludeUserId);
}
