package com.abbacchio.centrifugo.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Centrifugo JSON protocol frames.
 *
 * <p>
 * Outbound requests are {@code {id, method, params}}. Inbound frames are either
 * a reply {@code {id?, result?, error?}} correlated by id, or an unsolicited
 * push {@code {channel, pub: {data}}}.
 */
public final class ProtocolTypes {

    private ProtocolTypes() {
    }

    public static final String METHOD_CONNECT = "connect";
    public static final String METHOD_SUBSCRIBE = "subscribe";
    public static final String METHOD_UNSUBSCRIBE = "unsubscribe";

    // ── Request Frame ────────────────────────────────────────────

    /** Client → Server request: {id, method, params} */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({ "id", "method", "params" })
    public static class RequestFrame {
        private long id;
        private String method;
        private Object params;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConnectParams {
        private String token;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChannelParams {
        private String channel;
    }

    // ── Reply Frame ──────────────────────────────────────────────

    /** Server → Client reply: {id?, result?, error?} */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ReplyFrame {
        private Long id;
        private JsonNode result;
        private ErrorShape error;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ErrorShape {
        private long code;
        private String message;
    }

    // ── Push Frame ───────────────────────────────────────────────

    /** Server → Client push: {channel, pub: {data}} */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PushFrame {
        private String channel;
        private PublicationBody pub;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PublicationBody {
        private JsonNode data;
    }
}
