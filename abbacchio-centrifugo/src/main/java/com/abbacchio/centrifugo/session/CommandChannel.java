package com.abbacchio.centrifugo.session;

import com.abbacchio.centrifugo.CentrifugoClientException;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounded multi-producer, single-consumer command queue feeding one session.
 *
 * <p>
 * Every queued command, and the close itself, releases one permit on the
 * session's wake-up semaphore.
 */
public class CommandChannel {

    private final BlockingQueue<SessionCommand> queue;
    private final Semaphore wakeups;
    private volatile boolean closed;

    CommandChannel(int capacity, Semaphore wakeups) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.wakeups = wakeups;
    }

    /**
     * Queue a command, waiting up to {@code timeoutMs} for room.
     *
     * @throws CentrifugoClientException if the channel is closed, stays full, or the caller is interrupted
     */
    public void send(SessionCommand command, long timeoutMs) throws CentrifugoClientException {
        if (closed) {
            throw new CentrifugoClientException("Not connected");
        }
        try {
            if (!queue.offer(command, timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new CentrifugoClientException("Command queue full, session is not keeping up");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CentrifugoClientException("Interrupted while queueing command", e);
        }
        // Closed while offering: take the command back unless the session already has it
        if (closed && queue.remove(command)) {
            throw new CentrifugoClientException("Not connected");
        }
        wakeups.release();
    }

    /**
     * Close the channel. The session drains what is already queued, then ends
     * as if every sender had gone away.
     */
    public synchronized void close() {
        if (!closed) {
            closed = true;
            wakeups.release();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    SessionCommand poll() {
        return queue.poll();
    }

    int size() {
        return queue.size();
    }
}
