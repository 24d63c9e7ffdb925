package com.abbacchio.centrifugo.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The state a client shares between its live session and outside readers:
 * connection status and the confirmed subscriptions ({@code handle → logical name}).
 *
 * <p>
 * Every session gets a generation number from {@link #beginSession()}; writes
 * tagged with an older generation are rejected, so a replaced session can no
 * longer touch the state of its successor.
 */
public class SharedState {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private final Map<String, String> subscriptions = new LinkedHashMap<>();
    private long generation;

    /**
     * Start a new generation: status becomes {@code Connecting}, subscriptions are wiped.
     */
    public long beginSession() {
        lock.writeLock().lock();
        try {
            generation++;
            status = ConnectionStatus.CONNECTING;
            subscriptions.clear();
            return generation;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isCurrent(long sessionGeneration) {
        lock.readLock().lock();
        try {
            return generation == sessionGeneration;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean setStatus(long sessionGeneration, ConnectionStatus newStatus) {
        lock.writeLock().lock();
        try {
            if (generation != sessionGeneration) {
                return false;
            }
            status = newStatus;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Terminal transition: set the status and drop all subscriptions in one step.
     */
    public boolean finish(long sessionGeneration, ConnectionStatus finalStatus) {
        lock.writeLock().lock();
        try {
            if (generation != sessionGeneration) {
                return false;
            }
            status = finalStatus;
            subscriptions.clear();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void putSubscription(long sessionGeneration, String handle, String logicalName) {
        lock.writeLock().lock();
        try {
            if (generation == sessionGeneration) {
                subscriptions.put(handle, logicalName);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void removeSubscription(long sessionGeneration, String handle) {
        lock.writeLock().lock();
        try {
            if (generation == sessionGeneration) {
                subscriptions.remove(handle);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ConnectionStatus getStatus() {
        lock.readLock().lock();
        try {
            return status;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Snapshot copy; later changes are not reflected. */
    public Map<String, String> getSubscriptions() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(subscriptions));
        } finally {
            lock.readLock().unlock();
        }
    }
}
