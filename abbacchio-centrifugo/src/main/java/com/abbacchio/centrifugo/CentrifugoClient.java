package com.abbacchio.centrifugo;

import com.abbacchio.centrifugo.event.EventSink;
import com.abbacchio.centrifugo.protocol.ChannelNames;
import com.abbacchio.centrifugo.protocol.FrameCodec;
import com.abbacchio.centrifugo.session.CommandChannel;
import com.abbacchio.centrifugo.session.ConnectionSession;
import com.abbacchio.centrifugo.session.ConnectionStatus;
import com.abbacchio.centrifugo.session.SessionCommand;
import com.abbacchio.centrifugo.session.SharedState;
import com.abbacchio.centrifugo.transport.GatewayConnector;
import com.abbacchio.centrifugo.transport.OkHttpGatewayConnector;
import com.abbacchio.common.config.AbbacchioConfig;
import com.abbacchio.common.logging.LogRedact;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Command API over at most one live {@link ConnectionSession}.
 *
 * <p>
 * {@link #connect} starts a session on its own thread and returns at once;
 * progress is reported through the {@link EventSink} and {@link #getStatus()}.
 * A new connect cancels the previous session first, so nothing the old
 * session does afterwards reaches the sink or the status.
 *
 * <p>
 * Usage:
 * <pre>
 *   try (var client = CentrifugoClient.fromConfig(config, events::add)) {
 *       client.connect();
 *       client.subscribe("c1", "app");
 *       ...
 *   }
 * </pre>
 */
@Slf4j
public class CentrifugoClient implements AutoCloseable {

    private static final long CLOSE_JOIN_TIMEOUT_MS = 5_000;

    private final GatewayConnector connector;
    private final AutoCloseable ownedConnector;
    private final EventSink sink;
    private final CentrifugoSettings settings;
    private final ChannelNames channelNames;
    private final FrameCodec codec = new FrameCodec();
    private final SharedState state = new SharedState();

    private final Object lock = new Object();
    private volatile ConnectionSession current;
    private Thread currentThread;
    private volatile boolean closed;

    public CentrifugoClient(GatewayConnector connector, EventSink sink, CentrifugoSettings settings) {
        this(connector, null, sink, settings);
    }

    private CentrifugoClient(GatewayConnector connector, AutoCloseable ownedConnector, EventSink sink,
                             CentrifugoSettings settings) {
        this.connector = connector;
        this.ownedConnector = ownedConnector;
        this.sink = sink != null ? sink : EventSink.discarding();
        this.settings = settings != null ? settings : CentrifugoSettings.defaults();
        this.channelNames = new ChannelNames(this.settings.getChannelPrefix());
    }

    /**
     * Client over a private OkHttp connector, configured from the loaded config.
     */
    public static CentrifugoClient fromConfig(AbbacchioConfig config, EventSink sink) {
        if (config != null && config.getLogging() != null) {
            LogRedact.setMode(LogRedact.RedactMode.normalize(config.getLogging().getRedact()));
        }
        OkHttpGatewayConnector connector = new OkHttpGatewayConnector();
        return new CentrifugoClient(connector, connector, sink, CentrifugoSettings.resolve(config));
    }

    public CentrifugoSettings getSettings() {
        return settings;
    }

    // ==================== Commands ====================

    /** Connect with the configured URL and token. */
    public void connect() throws CentrifugoClientException {
        connect(settings.getUrl(), settings.getToken());
    }

    /**
     * Start a new session. Returns once the session thread is running, not once connected.
     */
    public void connect(String url, String token) throws CentrifugoClientException {
        if (url == null || url.isBlank()) {
            throw new CentrifugoClientException("Gateway URL required");
        }
        synchronized (lock) {
            if (closed) {
                throw new CentrifugoClientException("Client closed");
            }
            ConnectionSession previous = current;
            if (previous != null && !previous.isTerminated()) {
                log.info("Replacing session {}", previous.getSessionId());
            }
            if (previous != null) {
                previous.cancel();
            }

            long generation = state.beginSession();
            ConnectionSession session = new ConnectionSession(url.trim(), token, connector, state, generation,
                    sink, channelNames, codec, settings.getCommandQueueCapacity());
            Thread thread = new Thread(session, "centrifugo-session-" + session.getSessionId());
            thread.setDaemon(true);
            current = session;
            currentThread = thread;
            thread.start();
        }
    }

    public void subscribe(String handle, String logicalName) throws CentrifugoClientException {
        requireText(handle, "handle");
        requireText(logicalName, "logical name");
        send(new SessionCommand.Subscribe(handle, logicalName));
    }

    public void unsubscribe(String handle) throws CentrifugoClientException {
        requireText(handle, "handle");
        send(new SessionCommand.Unsubscribe(handle));
    }

    /**
     * Ask the live session to close. No-op when nothing is connected.
     */
    public void disconnect() throws CentrifugoClientException {
        ConnectionSession session = current;
        if (session == null || session.commandChannel().isClosed()) {
            return;
        }
        session.commandChannel().send(new SessionCommand.Disconnect(), settings.getCommandSendTimeoutMs());
    }

    public ConnectionStatus getStatus() {
        return state.getStatus();
    }

    /** Confirmed subscriptions of the live session, {@code handle → logical name}. */
    public Map<String, String> getSubscriptions() {
        return state.getSubscriptions();
    }

    /**
     * Close the command channel of the live session (it then closes its socket
     * and reports {@code Disconnected}), wait briefly for it to finish, and
     * release the connector if this client created it.
     */
    @Override
    public void close() {
        Thread thread;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            if (current != null) {
                current.commandChannel().close();
            }
            thread = currentThread;
        }
        if (thread != null) {
            try {
                thread.join(CLOSE_JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("Session thread {} did not stop in time, cancelling", thread.getName());
                current.cancel();
            }
        }
        if (ownedConnector != null) {
            try {
                ownedConnector.close();
            } catch (Exception e) {
                log.warn("Failed to release connector: {}", e.getMessage());
            }
        }
    }

    // ==================== Helpers ====================

    private void send(SessionCommand command) throws CentrifugoClientException {
        ConnectionSession session = current;
        if (session == null) {
            throw new CentrifugoClientException("Not connected");
        }
        CommandChannel channel = session.commandChannel();
        channel.send(command, settings.getCommandSendTimeoutMs());
    }

    private static void requireText(String value, String what) throws CentrifugoClientException {
        if (value == null || value.isBlank()) {
            throw new CentrifugoClientException(what + " required");
        }
    }
}
