package com.abbacchio.centrifugo.session;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;
import java.util.Objects;

/**
 * Connection status as seen by callers.
 * Serialises as {@code "disconnected"}, {@code "connecting"}, {@code "connected"}
 * or {@code {"error": message}}.
 */
public record ConnectionStatus(State state, String message) {

    public enum State {
        DISCONNECTED,
        CONNECTING,
        CONNECTED,
        ERROR
    }

    public static final ConnectionStatus DISCONNECTED = new ConnectionStatus(State.DISCONNECTED, null);
    public static final ConnectionStatus CONNECTING = new ConnectionStatus(State.CONNECTING, null);
    public static final ConnectionStatus CONNECTED = new ConnectionStatus(State.CONNECTED, null);

    public ConnectionStatus {
        Objects.requireNonNull(state, "state");
        if (state != State.ERROR) {
            message = null;
        } else if (message == null) {
            message = "";
        }
    }

    public static ConnectionStatus error(String message) {
        return new ConnectionStatus(State.ERROR, message);
    }

    public boolean isConnected() {
        return state == State.CONNECTED;
    }

    public boolean isError() {
        return state == State.ERROR;
    }

    @JsonValue
    public Object toJson() {
        if (state == State.ERROR) {
            return Map.of("error", message);
        }
        return state.name().toLowerCase();
    }

    @Override
    public String toString() {
        return state == State.ERROR ? "Error(" + message + ")" : state.name();
    }
}
