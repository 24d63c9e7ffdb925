package com.abbacchio.centrifugo.transport;

/**
 * An open (or opening) WebSocket toward the gateway.
 */
public interface GatewaySocket {

    int NORMAL_CLOSURE = 1000;

    /**
     * Queue a text frame. Returns false when the socket is closing, closed or failed.
     */
    boolean send(String text);

    /** Start a graceful close handshake. */
    void close(int code, String reason);

    /** Drop the connection immediately, discarding queued frames. */
    void cancel();
}
