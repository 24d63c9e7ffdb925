package com.abbacchio.centrifugo.event;

/**
 * One-way channel from a session toward the application shell.
 *
 * <p>
 * Called on the session thread, in inbound processing order. Implementations
 * should hand the event off quickly; a slow sink stalls the session.
 */
@FunctionalInterface
public interface EventSink {

    void emit(CentrifugoEvent event);

    /** Sink that discards everything. */
    static EventSink discarding() {
        return event -> {
        };
    }
}
