package com.abbacchio.centrifugo.session;

/**
 * A sent request awaiting its reply.
 */
public sealed interface PendingRequest permits PendingRequest.Subscribe, PendingRequest.Unsubscribe {

    long id();

    record Subscribe(long id, String handle, String logicalName, String channel) implements PendingRequest {
    }

    record Unsubscribe(long id, String channel) implements PendingRequest {
    }
}
