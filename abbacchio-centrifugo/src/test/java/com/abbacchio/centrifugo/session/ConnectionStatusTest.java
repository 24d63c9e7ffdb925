package com.abbacchio.centrifugo.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionStatusTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void serialisesAsLowercaseOrErrorObject() throws Exception {
        assertEquals("\"disconnected\"", mapper.writeValueAsString(ConnectionStatus.DISCONNECTED));
        assertEquals("\"connecting\"", mapper.writeValueAsString(ConnectionStatus.CONNECTING));
        assertEquals("\"connected\"", mapper.writeValueAsString(ConnectionStatus.CONNECTED));
        assertEquals("{\"error\":\"boom\"}", mapper.writeValueAsString(ConnectionStatus.error("boom")));
    }

    @Test
    void errorCarriesMessage_othersDoNot() {
        assertEquals("boom", ConnectionStatus.error("boom").message());
        assertEquals("", ConnectionStatus.error(null).message());
        assertNull(new ConnectionStatus(ConnectionStatus.State.CONNECTED, "ignored").message());
        assertEquals(ConnectionStatus.CONNECTED, new ConnectionStatus(ConnectionStatus.State.CONNECTED, "x"));
        assertEquals("Error(boom)", ConnectionStatus.error("boom").toString());
        assertTrue(ConnectionStatus.error("boom").isError());
    }
}
