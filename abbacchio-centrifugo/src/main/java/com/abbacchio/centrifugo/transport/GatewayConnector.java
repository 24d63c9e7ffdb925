package com.abbacchio.centrifugo.transport;

/**
 * Opens sockets toward the gateway.
 */
public interface GatewayConnector {

    /**
     * Start opening a socket. The outcome arrives through {@code listener}:
     * {@link SocketListener#onOpen()} or {@link SocketListener#onFailure(Throwable)}.
     *
     * @throws IllegalArgumentException if the URL cannot be used
     */
    GatewaySocket open(String url, SocketListener listener);
}
