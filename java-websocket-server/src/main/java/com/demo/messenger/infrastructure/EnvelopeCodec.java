package com.demo.messenger.infrastructure;

import com.demo.messenger.domain.ChatEnvelope;
import com.demo.messenger.domain.EnvelopeType;
import com.demo.messenger.domain.InboundEnvelope;
import com.demo.messenger.domain.InboundMessage;
import com.demo.messenger.domain.TypingEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * JSON codec for {@code {"type", "payload"}} envelopes.
 */
@Component
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ChatEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            // payloads are plain DTOs, so this only happens on a programming error
            throw new IllegalStateException("Failed to serialize " + envelope.getType() + " envelope", e);
        }
    }

    public InboundEnvelope decode(String frame) throws MalformedEnvelopeException {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Frame is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEnvelopeException("Frame is not a JSON object");
        }

        String wireType = root.path("type").asText(null);
        EnvelopeType type = EnvelopeType.fromWireName(wireType)
                .orElseThrow(() -> new MalformedEnvelopeException("Unknown envelope type: " + wireType));
        if (!type.isInbound()) {
            throw new MalformedEnvelopeException("Envelope type is server-to-client only: " + wireType);
        }

        JsonNode payload = root.get("payload");
        if (payload == null || !payload.isObject()) {
            throw new MalformedEnvelopeException("Missing or non-object payload for " + wireType);
        }

        switch (type) {
            case MESSAGE:
                return InboundEnvelope.message(readPayload(payload, InboundMessage.class, wireType));
            case TYPING:
                return InboundEnvelope.typing(readPayload(payload, TypingEvent.class, wireType));
            case STATUS:
            case ACK:
            default:
                throw new MalformedEnvelopeException("Unsupported envelope type: " + wireType);
        }
    }

    private <T> T readPayload(JsonNode payload, Class<T> payloadType, String wireType)
            throws MalformedEnvelopeException {
        try {
            return objectMapper.treeToValue(payload, payloadType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedEnvelopeException("Invalid " + wireType + " payload", e);
        }
    }
}
