package com.abbacchio.centrifugo.protocol;

import com.abbacchio.centrifugo.protocol.ProtocolTypes.ChannelParams;
import com.abbacchio.centrifugo.protocol.ProtocolTypes.ConnectParams;
import com.abbacchio.centrifugo.protocol.ProtocolTypes.PushFrame;
import com.abbacchio.centrifugo.protocol.ProtocolTypes.ReplyFrame;
import com.abbacchio.centrifugo.protocol.ProtocolTypes.RequestFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Encodes outbound requests and classifies inbound text frames.
 *
 * <p>
 * Decoding never throws: a frame that is not a JSON object, or whose fields
 * cannot be bound, comes back as {@link InboundFrame.Ignored}.
 */
@Slf4j
public class FrameCodec {

    private final ObjectMapper mapper;

    public FrameCodec() {
        this(new ObjectMapper());
    }

    public FrameCodec(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                // Request ids are unsigned integers; 1.9 must not pass as the connect reply
                .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
    }

    // ==================== Encoding ====================

    public String encodeConnect(long id, String token) {
        return encode(new RequestFrame(id, ProtocolTypes.METHOD_CONNECT, new ConnectParams(token)));
    }

    public String encodeSubscribe(long id, String channel) {
        return encode(new RequestFrame(id, ProtocolTypes.METHOD_SUBSCRIBE, new ChannelParams(channel)));
    }

    public String encodeUnsubscribe(long id, String channel) {
        return encode(new RequestFrame(id, ProtocolTypes.METHOD_UNSUBSCRIBE, new ChannelParams(channel)));
    }

    private String encode(RequestFrame frame) {
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + frame.getMethod() + " request", e);
        }
    }

    // ==================== Decoding ====================

    /**
     * Classify a text frame. Frames carrying {@code id}, {@code result} or
     * {@code error} are replies; frames carrying {@code channel} or {@code pub}
     * are pushes; everything else is ignored.
     */
    public InboundFrame decode(String text) {
        if (text == null || text.isBlank()) {
            return new InboundFrame.Ignored("empty frame");
        }
        JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Dropping unparseable frame: {}", e.getOriginalMessage());
            return new InboundFrame.Ignored("invalid json");
        }
        if (node == null || !node.isObject()) {
            return new InboundFrame.Ignored("not an object");
        }

        if (isPresent(node, "id") || isPresent(node, "result") || isPresent(node, "error")) {
            return decodeReply(node);
        }
        if (isPresent(node, "channel") || isPresent(node, "pub")) {
            return decodePush(node);
        }
        return new InboundFrame.Ignored("unknown shape");
    }

    private InboundFrame decodeReply(JsonNode node) {
        try {
            ReplyFrame reply = mapper.treeToValue(node, ReplyFrame.class);
            return new InboundFrame.Reply(reply.getId(), reply.getResult(), reply.getError());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Dropping malformed reply: {}", e.getMessage());
            return new InboundFrame.Ignored("malformed reply");
        }
    }

    private InboundFrame decodePush(JsonNode node) {
        try {
            PushFrame push = mapper.treeToValue(node, PushFrame.class);
            JsonNode data = null;
            if (push.getPub() != null && node.get("pub").has("data")) {
                data = node.get("pub").get("data");
            }
            return new InboundFrame.Push(push.getChannel(), data);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Dropping malformed push: {}", e.getMessage());
            return new InboundFrame.Ignored("malformed push");
        }
    }

    private static boolean isPresent(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull();
    }
}
