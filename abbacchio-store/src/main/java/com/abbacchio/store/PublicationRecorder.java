package com.abbacchio.store;

import com.abbacchio.centrifugo.event.CentrifugoEvent;
import com.abbacchio.centrifugo.event.EventSink;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Function;

/**
 * {@link EventSink} that writes every publication into a {@link LogStore}
 * and forwards all events, publications included, to a downstream sink.
 *
 * <p>
 * Entries are filed under the logical name the handle was subscribed with,
 * resolved through {@link #resolveChannelsWith}; without a resolver, or for
 * a handle it does not know, the handle itself is used.
 *
 * <pre>
 *   PublicationRecorder recorder = new PublicationRecorder(store, ui);
 *   CentrifugoClient client = CentrifugoClient.fromConfig(config, recorder);
 *   recorder.resolveChannelsWith(handle -&gt; client.getSubscriptions().get(handle));
 * </pre>
 */
@Slf4j
public class PublicationRecorder implements EventSink {

    private final LogStore store;
    private final EventSink downstream;
    private volatile Function<String, String> channelResolver = handle -> null;

    public PublicationRecorder(LogStore store, EventSink downstream) {
        this.store = store;
        this.downstream = downstream != null ? downstream : EventSink.discarding();
    }

    public PublicationRecorder resolveChannelsWith(Function<String, String> resolver) {
        this.channelResolver = resolver != null ? resolver : handle -> null;
        return this;
    }

    @Override
    public void emit(CentrifugoEvent event) {
        if (event instanceof CentrifugoEvent.Publication publication) {
            record(publication);
        }
        downstream.emit(event);
    }

    private void record(CentrifugoEvent.Publication publication) {
        try {
            String channel = channelResolver.apply(publication.handle());
            if (channel == null) {
                channel = publication.handle();
            }
            List<LogEntry> entries = LogEntries.fromPublication(channel, publication.data());
            if (!entries.isEmpty()) {
                store.insert(entries);
                log.trace("Stored {} entries for {}", entries.size(), channel);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to store publication for {}: {}", publication.handle(), e.getMessage());
        }
    }
}
