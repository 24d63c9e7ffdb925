package com.abbacchio.centrifugo.session;

/**
 * Commands callers enqueue for a live session.
 */
public sealed interface SessionCommand permits SessionCommand.Connect, SessionCommand.Subscribe,
        SessionCommand.Unsubscribe, SessionCommand.Disconnect {

    /** Ignored by a live session; a new connection always starts a new session. */
    record Connect(String url, String token) implements SessionCommand {
    }

    record Subscribe(String handle, String logicalName) implements SessionCommand {
    }

    record Unsubscribe(String handle) implements SessionCommand {
    }

    record Disconnect() implements SessionCommand {
    }
}
