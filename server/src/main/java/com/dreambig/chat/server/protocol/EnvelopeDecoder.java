package com.dreambig.chat.server.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns one text frame into a typed {@link InboundEnvelope}.
 *
 * <ul>
 *   <li>not JSON, or not a JSON object: {@link MalformedFrameException}</li>
 *   <li>unknown or missing {@code type}: empty, logged</li>
 *   <li>known type whose fields do not bind (e.g. {@code "limit":"abc"}): empty, logged</li>
 * </ul>
 */
public final class EnvelopeDecoder {
    private static final Logger log = LoggerFactory.getLogger(EnvelopeDecoder.class);

    private final ObjectMapper mapper;

    public EnvelopeDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Optional<InboundEnvelope> decode(String frame) throws MalformedFrameException {
        JsonNode node;
        try {
            node = mapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("invalid json: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedFrameException("frame is not a json object");
        }

        String wire = node.path("type").asText("");
        InboundType type = InboundType.fromWire(wire);
        if (type == null) {
            log.warn("[WARN] unknown message type '{}'", wire);
            return Optional.empty();
        }

        try {
            return Optional.of(mapper.treeToValue(node, type.payloadType()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[WARN] cannot bind {} payload: {}", wire, e.getMessage());
            return Optional.empty();
        }
    }
}
