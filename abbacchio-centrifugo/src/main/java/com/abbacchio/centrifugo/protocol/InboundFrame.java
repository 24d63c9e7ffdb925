package com.abbacchio.centrifugo.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A decoded inbound text frame.
 */
public sealed interface InboundFrame permits InboundFrame.Reply, InboundFrame.Push, InboundFrame.Ignored {

    /**
     * Reply to an earlier request. {@code id} is null when the server omitted it.
     * {@code error} is null on success.
     */
    record Reply(Long id, JsonNode result, ProtocolTypes.ErrorShape error) implements InboundFrame {
        public boolean isError() {
            return error != null;
        }

        public String errorMessage() {
            if (error == null) {
                return null;
            }
            return error.getMessage() != null ? error.getMessage() : "error " + error.getCode();
        }
    }

    /**
     * Server push. {@code data} is null when the push carries no publication.
     */
    record Push(String channel, JsonNode data) implements InboundFrame {
        public boolean isPublication() {
            return channel != null && data != null;
        }
    }

    /** Anything that is neither a reply nor a push. */
    record Ignored(String reason) implements InboundFrame {
    }
}
