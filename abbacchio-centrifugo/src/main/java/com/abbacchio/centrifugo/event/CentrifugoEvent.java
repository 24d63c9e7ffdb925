package com.abbacchio.centrifugo.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Notifications a session delivers to its {@link EventSink}.
 *
 * <p>
 * Serialised with a {@code type} tag; handles are written as {@code channel_id}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CentrifugoEvent.Connected.class, name = "connected"),
        @JsonSubTypes.Type(value = CentrifugoEvent.Disconnected.class, name = "disconnected"),
        @JsonSubTypes.Type(value = CentrifugoEvent.Error.class, name = "error"),
        @JsonSubTypes.Type(value = CentrifugoEvent.Subscribed.class, name = "subscribed"),
        @JsonSubTypes.Type(value = CentrifugoEvent.SubscriptionError.class, name = "subscription-error"),
        @JsonSubTypes.Type(value = CentrifugoEvent.Publication.class, name = "publication")
})
public sealed interface CentrifugoEvent permits CentrifugoEvent.Connected, CentrifugoEvent.Disconnected,
        CentrifugoEvent.Error, CentrifugoEvent.Subscribed, CentrifugoEvent.SubscriptionError,
        CentrifugoEvent.Publication {

    String REASON_CONNECTION_CLOSED = "Connection closed";
    String REASON_USER_DISCONNECTED = "User disconnected";

    /** Handshake acknowledged by the server. */
    record Connected() implements CentrifugoEvent {
    }

    record Disconnected(String reason) implements CentrifugoEvent {
    }

    /** Fatal transport or handshake failure; the session has ended. */
    record Error(String error) implements CentrifugoEvent {
    }

    record Subscribed(@JsonProperty("channel_id") String handle) implements CentrifugoEvent {
    }

    record SubscriptionError(@JsonProperty("channel_id") String handle, String error) implements CentrifugoEvent {
    }

    /** Publication data exactly as the server sent it. */
    record Publication(@JsonProperty("channel_id") String handle, JsonNode data) implements CentrifugoEvent {
    }
}
