package com.abbacchio.centrifugo;

import com.abbacchio.centrifugo.event.CentrifugoEvent;
import com.abbacchio.centrifugo.event.RecordingSink;
import com.abbacchio.centrifugo.session.ConnectionStatus;
import com.abbacchio.centrifugo.transport.FakeGatewayConnector;
import com.abbacchio.centrifugo.transport.FakeGatewayConnector.FakeSocket;
import com.abbacchio.common.config.AbbacchioConfig;
import com.abbacchio.common.logging.LogRedact;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CentrifugoClientTest {

    private FakeGatewayConnector connector;
    private RecordingSink sink;
    private CentrifugoClient client;

    @BeforeEach
    void setUp() {
        connector = new FakeGatewayConnector();
        sink = new RecordingSink();
        client = new CentrifugoClient(connector, sink, CentrifugoSettings.builder()
                .url("ws://gateway.test/connection/websocket")
                .token("secret-token")
                .commandSendTimeoutMs(500)
                .build());
    }

    @AfterEach
    void tearDown() {
        client.close();
        LogRedact.setMode(LogRedact.RedactMode.ON);
    }

    private FakeSocket connectAndHandshake() throws Exception {
        client.connect();
        FakeSocket socket = connector.awaitSocket();
        socket.listener().onOpen();
        assertNotNull(socket.nextSent());
        socket.listener().onText("{\"id\":1,\"result\":{}}");
        assertEquals(new CentrifugoEvent.Connected(), sink.next());
        return socket;
    }

    @Test
    void initialStatus_isDisconnected() {
        assertEquals(ConnectionStatus.DISCONNECTED, client.getStatus());
        assertTrue(client.getSubscriptions().isEmpty());
    }

    @Test
    void commandsBeforeConnect_failWithNotConnected() {
        CentrifugoClientException error = assertThrows(CentrifugoClientException.class,
                () -> client.subscribe("c1", "app"));
        assertEquals("Not connected", error.getMessage());

        assertThrows(CentrifugoClientException.class, () -> client.unsubscribe("c1"));
    }

    @Test
    void disconnectWithoutSession_isNoOp() throws Exception {
        client.disconnect();

        assertEquals(ConnectionStatus.DISCONNECTED, client.getStatus());
        sink.assertNoMore(50);
    }

    @Test
    void connect_blankUrl_isRejected() {
        assertThrows(CentrifugoClientException.class, () -> client.connect("  ", "t"));
        assertEquals(ConnectionStatus.DISCONNECTED, client.getStatus());
    }

    @Test
    void connect_setsConnectingImmediately() throws Exception {
        client.connect();

        assertEquals(ConnectionStatus.CONNECTING, client.getStatus());
        FakeSocket socket = connector.awaitSocket();
        assertEquals("ws://gateway.test/connection/websocket", socket.url());
    }

    @Test
    void fullFlow_subscribeReceiveUnsubscribeDisconnect() throws Exception {
        FakeSocket socket = connectAndHandshake();
        assertEquals(ConnectionStatus.CONNECTED, client.getStatus());

        client.subscribe("c1", "app");
        assertNotNull(socket.nextSent());
        socket.listener().onText("{\"id\":2,\"result\":{}}");
        assertEquals(new CentrifugoEvent.Subscribed("c1"), sink.next());
        assertEquals(Map.of("c1", "app"), client.getSubscriptions());

        socket.listener().onText("{\"channel\":\"logs:app\",\"pub\":{\"data\":{\"msg\":\"hi\"}}}");
        CentrifugoEvent.Publication publication = assertInstanceOf(CentrifugoEvent.Publication.class, sink.next());
        assertEquals("c1", publication.handle());
        assertEquals("hi", publication.data().get("msg").asText());

        client.unsubscribe("c1");
        assertTrue(socket.nextSent().contains("\"unsubscribe\""));
        Await.until(() -> client.getSubscriptions().isEmpty());

        client.disconnect();
        assertEquals(new CentrifugoEvent.Disconnected(CentrifugoEvent.REASON_USER_DISCONNECTED), sink.next());
        assertEquals(ConnectionStatus.DISCONNECTED, client.getStatus());
    }

    @Test
    void commandsAfterSessionEnded_failWithNotConnected() throws Exception {
        FakeSocket socket = connectAndHandshake();
        socket.listener().onClosed(1000, "");
        assertEquals(new CentrifugoEvent.Disconnected(CentrifugoEvent.REASON_CONNECTION_CLOSED), sink.next());

        CentrifugoClientException error = assertThrows(CentrifugoClientException.class,
                () -> client.subscribe("c1", "app"));
        assertEquals("Not connected", error.getMessage());
    }

    @Test
    void commandsRightAfterTerminalEvent_areAlwaysRejected() throws Exception {
        for (int i = 0; i < 100; i++) {
            FakeSocket socket = connectAndHandshake();
            socket.listener().onClosed(1000, "");
            assertEquals(new CentrifugoEvent.Disconnected(CentrifugoEvent.REASON_CONNECTION_CLOSED), sink.next());

            assertThrows(CentrifugoClientException.class, () -> client.subscribe("c1", "app"), "round " + i);
            assertThrows(CentrifugoClientException.class, () -> client.unsubscribe("c1"), "round " + i);
        }
    }

    @Test
    void commandsAfterStatusTurnsTerminal_areRejected() throws Exception {
        FakeSocket socket = connectAndHandshake();

        socket.listener().onFailure(new java.io.IOException("Connection reset"));
        Await.until(() -> client.getStatus().isError());

        assertThrows(CentrifugoClientException.class, () -> client.subscribe("c1", "app"));
    }

    @Test
    void reconnect_replacesPreviousSessionSilently() throws Exception {
        FakeSocket first = connectAndHandshake();

        client.connect("ws://other.test/connection/websocket", "t2");
        FakeSocket second = connector.awaitSocket();
        Await.until(first::isCancelled);

        // Nothing the old session sees any more reaches the sink
        first.listener().onFailure(new java.io.IOException("old failure"));
        first.listener().onText("{\"id\":1,\"result\":{}}");
        sink.assertNoMore(150);
        assertEquals(ConnectionStatus.CONNECTING, client.getStatus());

        second.listener().onOpen();
        assertTrue(second.nextSent().contains("\"t2\""));
        second.listener().onText("{\"id\":1,\"result\":{}}");
        assertEquals(new CentrifugoEvent.Connected(), sink.next());
        assertEquals(ConnectionStatus.CONNECTED, client.getStatus());
    }

    @Test
    void reconnect_startsWithEmptySubscriptions() throws Exception {
        FakeSocket socket = connectAndHandshake();
        client.subscribe("c1", "app");
        assertNotNull(socket.nextSent());
        socket.listener().onText("{\"id\":2,\"result\":{}}");
        assertEquals(new CentrifugoEvent.Subscribed("c1"), sink.next());

        client.connect();

        assertTrue(client.getSubscriptions().isEmpty());
    }

    @Test
    void close_disconnectsAndRejectsFurtherConnects() throws Exception {
        FakeSocket socket = connectAndHandshake();

        client.close();

        assertEquals(new CentrifugoEvent.Disconnected(CentrifugoEvent.REASON_CONNECTION_CLOSED), sink.next());
        assertEquals(1000, socket.closeCode());
        assertEquals(ConnectionStatus.DISCONNECTED, client.getStatus());
        CentrifugoClientException error = assertThrows(CentrifugoClientException.class, client::connect);
        assertEquals("Client closed", error.getMessage());
    }

    @Test
    void fromConfig_appliesSettingsAndRedactMode() {
        AbbacchioConfig config = new AbbacchioConfig();
        AbbacchioConfig.CentrifugoConfig centrifugo = new AbbacchioConfig.CentrifugoConfig();
        centrifugo.setUrl("ws://configured:9000/connection/websocket");
        centrifugo.setChannelPrefix("app-logs");
        config.setCentrifugo(centrifugo);
        AbbacchioConfig.LoggingConfig logging = new AbbacchioConfig.LoggingConfig();
        logging.setRedact("off");
        config.setLogging(logging);

        try (CentrifugoClient configured = CentrifugoClient.fromConfig(config, sink)) {
            assertEquals("ws://configured:9000/connection/websocket", configured.getSettings().getUrl());
            assertEquals("app-logs", configured.getSettings().getChannelPrefix());
            assertEquals(32, configured.getSettings().getCommandQueueCapacity());
            assertEquals(LogRedact.RedactMode.OFF, LogRedact.getMode());
        }
    }
}
