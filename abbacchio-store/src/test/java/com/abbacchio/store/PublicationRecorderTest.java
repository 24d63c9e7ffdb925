package com.abbacchio.store;

import com.abbacchio.centrifugo.event.CentrifugoEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PublicationRecorderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private InMemoryLogStore store;
    private List<CentrifugoEvent> forwarded;
    private PublicationRecorder recorder;

    @BeforeEach
    void setUp() {
        store = new InMemoryLogStore();
        forwarded = new ArrayList<>();
        recorder = new PublicationRecorder(store, forwarded::add);
    }

    @Test
    void publication_isStoredUnderLogicalNameAndForwarded() throws Exception {
        recorder.resolveChannelsWith(Map.of("c1", "app")::get);
        var publication = new CentrifugoEvent.Publication("c1",
                mapper.readTree("{\"type\":\"log\",\"data\":{\"id\":\"e1\",\"msg\":\"hello\"}}"));

        recorder.emit(publication);

        assertEquals(List.of(publication), forwarded);
        List<LogEntry> stored = store.query(LogQuery.forChannel("app"));
        assertEquals(1, stored.size());
        assertEquals("hello", stored.get(0).getMsg());
    }

    @Test
    void unknownHandle_fallsBackToHandle() throws Exception {
        recorder.emit(new CentrifugoEvent.Publication("c7", mapper.readTree("{\"msg\":\"x\"}")));

        assertEquals(List.of("c7"), store.channels());
    }

    @Test
    void otherEvents_areForwardedOnly() {
        recorder.emit(new CentrifugoEvent.Connected());
        recorder.emit(new CentrifugoEvent.Subscribed("c1"));

        assertEquals(2, forwarded.size());
        assertEquals(0, store.size());
    }

    @Test
    void storeFailure_isContained() throws Exception {
        LogStore broken = new InMemoryLogStore() {
            @Override
            public void insert(List<LogEntry> entries) {
                throw new IllegalStateException("disk full");
            }
        };
        PublicationRecorder failing = new PublicationRecorder(broken, forwarded::add);
        var publication = new CentrifugoEvent.Publication("c1", mapper.readTree("{\"msg\":\"x\"}"));

        assertDoesNotThrow(() -> failing.emit(publication));
        assertEquals(List.of(publication), forwarded);
    }
}
