package com.abbacchio.centrifugo.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON rendering of {@link CentrifugoEvent}s for shells that consume events as text.
 */
public final class CentrifugoEvents {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    private static final ObjectWriter WRITER = MAPPER.writerFor(CentrifugoEvent.class);

    private CentrifugoEvents() {
    }

    public static String toJson(CentrifugoEvent event) {
        try {
            return WRITER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render event " + event, e);
        }
    }

    public static CentrifugoEvent fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, CentrifugoEvent.class);
    }
}
