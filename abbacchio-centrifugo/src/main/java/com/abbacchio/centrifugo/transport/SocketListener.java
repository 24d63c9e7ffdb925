package com.abbacchio.centrifugo.transport;

/**
 * Socket callbacks. Invoked on a transport thread, one at a time, in arrival order.
 */
public interface SocketListener {

    void onOpen();

    void onText(String text);

    /** Close frame received, or the stream ended. */
    void onClosed(int code, String reason);

    /** Handshake, read or write failure. */
    void onFailure(Throwable error);
}
