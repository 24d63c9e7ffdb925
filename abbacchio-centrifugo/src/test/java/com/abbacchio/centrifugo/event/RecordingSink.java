package com.abbacchio.centrifugo.event;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Sink that queues events for assertions.
 */
public class RecordingSink implements EventSink {

    private final BlockingQueue<CentrifugoEvent> events = new LinkedBlockingQueue<>();

    @Override
    public void emit(CentrifugoEvent event) {
        events.add(event);
    }

    public CentrifugoEvent next() throws InterruptedException {
        CentrifugoEvent event = events.poll(2, TimeUnit.SECONDS);
        if (event == null) {
            throw new AssertionError("no event within 2s");
        }
        return event;
    }

    public void assertNoMore(long waitMs) throws InterruptedException {
        assertNull(events.poll(waitMs, TimeUnit.MILLISECONDS));
    }
}
