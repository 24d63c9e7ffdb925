package com.abbacchio.centrifugo.session;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Allocates request ids and matches replies to pending requests.
 *
 * <p>
 * Id {@value #CONNECT_REQUEST_ID} belongs to the implicit connect request; all
 * others start at {@value #FIRST_REQUEST_ID} and only grow. Owned by a single
 * session thread, so it is not synchronised.
 */
public class RequestCorrelator {

    public static final long CONNECT_REQUEST_ID = 1;
    public static final long FIRST_REQUEST_ID = 2;

    private final Map<Long, PendingRequest> pending = new HashMap<>();
    private long nextId = FIRST_REQUEST_ID;

    public static boolean isConnectReply(Long id) {
        return id != null && id == CONNECT_REQUEST_ID;
    }

    /** Reserve the next id. */
    public long allocate() {
        return nextId++;
    }

    /**
     * Record a request sent under an id from {@link #allocate()}.
     */
    public void track(PendingRequest request) {
        if (request.id() < FIRST_REQUEST_ID || request.id() >= nextId) {
            throw new IllegalArgumentException("id " + request.id() + " was not allocated");
        }
        if (pending.putIfAbsent(request.id(), request) != null) {
            throw new IllegalStateException("id " + request.id() + " already pending");
        }
    }

    /**
     * Remove and return the request a reply answers. Empty for the connect id,
     * stale or duplicate replies.
     */
    public Optional<PendingRequest> complete(long id) {
        if (id == CONNECT_REQUEST_ID) {
            return Optional.empty();
        }
        return Optional.ofNullable(pending.remove(id));
    }

    public int pendingCount() {
        return pending.size();
    }

    /** The id the next {@link #allocate()} will return. */
    public long peekNextId() {
        return nextId;
    }

    /** Forget all pending requests; no failure is reported for them. */
    public void clear() {
        pending.clear();
    }
}
