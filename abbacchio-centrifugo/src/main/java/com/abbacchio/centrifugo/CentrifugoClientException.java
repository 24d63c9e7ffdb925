package com.abbacchio.centrifugo;

/**
 * A command could not be handed to a session: no session is live, the command
 * queue stayed full, or the caller was interrupted.
 */
public class CentrifugoClientException extends Exception {

    public CentrifugoClientException(String message) {
        super(message);
    }

    public CentrifugoClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
