package com.abbacchio.centrifugo.session;

import com.abbacchio.centrifugo.event.CentrifugoEvent;
import com.abbacchio.centrifugo.event.EventSink;
import com.abbacchio.centrifugo.protocol.ChannelNames;
import com.abbacchio.centrifugo.protocol.FrameCodec;
import com.abbacchio.centrifugo.protocol.InboundFrame;
import com.abbacchio.centrifugo.transport.GatewayConnector;
import com.abbacchio.centrifugo.transport.GatewaySocket;
import com.abbacchio.centrifugo.transport.SocketListener;
import com.abbacchio.common.logging.LogRedact;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One connection lifecycle: open the socket, perform the connect handshake,
 * then serve inbound frames and caller commands until a terminal transition.
 *
 * <p>
 * {@link #run()} is the session's event loop and must run on a dedicated
 * thread. Socket callbacks only enqueue signals; the correlator, the registry
 * and the socket are touched from the loop thread alone. Inbound signals and
 * commands share one wake-up semaphore, and the loop alternates which source it
 * serves first so neither can starve the other.
 *
 * <p>
 * States: CONNECTING (socket handshake) → HANDSHAKING (connect request sent)
 * → CONNECTED, and from any of them → TERMINATED. Once terminated nothing else
 * is read, processed or emitted.
 */
@Slf4j
public class ConnectionSession implements Runnable {

    private static final AtomicLong SESSION_IDS = new AtomicLong();

    enum Phase {
        CONNECTING,
        HANDSHAKING,
        CONNECTED,
        TERMINATED
    }

    /** Socket-side input to the loop. */
    sealed interface SocketSignal permits Opened, Text, Closed, Failed {
    }

    record Opened() implements SocketSignal {
    }

    record Text(String text) implements SocketSignal {
    }

    record Closed(int code, String reason) implements SocketSignal {
    }

    record Failed(Throwable error) implements SocketSignal {
    }

    private final long sessionId = SESSION_IDS.incrementAndGet();
    private final String url;
    private final String token;
    private final GatewayConnector connector;
    private final SharedState sharedState;
    private final long generation;
    private final EventSink sink;
    private final ChannelNames channelNames;
    private final FrameCodec codec;

    private final Semaphore wakeups = new Semaphore(0);
    private final BlockingQueue<SocketSignal> inbound = new LinkedBlockingQueue<>();
    private final CommandChannel commands;

    private final RequestCorrelator correlator = new RequestCorrelator();
    private final SubscriptionRegistry registry = new SubscriptionRegistry();

    private GatewaySocket socket;
    private volatile Phase phase = Phase.CONNECTING;
    private volatile boolean cancelled;
    private boolean closeStarted;
    private boolean preferInbound = true;

    /**
     * @param generation value from {@link SharedState#beginSession()} for this session
     */
    public ConnectionSession(String url, String token, GatewayConnector connector, SharedState sharedState,
                             long generation, EventSink sink, ChannelNames channelNames, FrameCodec codec,
                             int commandQueueCapacity) {
        this.url = url;
        this.token = token != null ? token : "";
        this.connector = connector;
        this.sharedState = sharedState;
        this.generation = generation;
        this.sink = sink;
        this.channelNames = channelNames;
        this.codec = codec;
        this.commands = new CommandChannel(commandQueueCapacity, wakeups);
    }

    public long getSessionId() {
        return sessionId;
    }

    public CommandChannel commandChannel() {
        return commands;
    }

    public boolean isTerminated() {
        return phase == Phase.TERMINATED;
    }

    Phase phase() {
        return phase;
    }

    /**
     * Stop the session without any further status change or event. Used when a
     * newer session replaces this one.
     */
    public void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        commands.close();
        wakeups.release();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    // ==================== Event loop ====================

    @Override
    public void run() {
        log.info("[session {}] Connecting to {}", sessionId, LogRedact.redactUrl(url));
        try {
            if (openSocket() && awaitOpen() && sendConnect()) {
                serve();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled = true;
        } finally {
            phase = Phase.TERMINATED;
            commands.close();
            correlator.clear();
            registry.clear();
            // Paths that did not start a close handshake just drop the connection
            if (socket != null && !closeStarted) {
                socket.cancel();
            }
            log.info("[session {}] Ended{}", sessionId, cancelled ? " (cancelled)" : "");
        }
    }

    private boolean openSocket() {
        try {
            socket = connector.open(url, new QueueingListener());
            return true;
        } catch (RuntimeException e) {
            String message = describe(e);
            terminate(ConnectionStatus.error(message), new CentrifugoEvent.Error("Connection failed: " + message));
            return false;
        }
    }

    /**
     * Wait for the socket handshake. Commands stay queued meanwhile; their
     * wake-ups are handed back once the socket is open.
     */
    private boolean awaitOpen() throws InterruptedException {
        int deferredWakeups = 0;
        try {
            while (true) {
                wakeups.acquire();
                if (cancelled) {
                    return false;
                }
                SocketSignal signal = inbound.poll();
                if (signal == null) {
                    deferredWakeups++;
                    continue;
                }
                if (signal instanceof Opened) {
                    return true;
                }
                String message;
                if (signal instanceof Failed failed) {
                    message = describe(failed.error());
                } else if (signal instanceof Closed closed) {
                    message = "closed during handshake (" + closed.code() + ")";
                } else {
                    log.debug("[session {}] Ignoring frame before open", sessionId);
                    continue;
                }
                terminate(ConnectionStatus.error(message), new CentrifugoEvent.Error("Connection failed: " + message));
                return false;
            }
        } finally {
            if (deferredWakeups > 0) {
                wakeups.release(deferredWakeups);
            }
        }
    }

    private boolean sendConnect() {
        phase = Phase.HANDSHAKING;
        if (!socket.send(codec.encodeConnect(RequestCorrelator.CONNECT_REQUEST_ID, token))) {
            String message = "socket not writable";
            terminate(ConnectionStatus.error(message), new CentrifugoEvent.Error("Failed to send connect: " + message));
            return false;
        }
        log.debug("[session {}] Connect request sent (token {})", sessionId, LogRedact.maskToken(token));
        return true;
    }

    private void serve() throws InterruptedException {
        while (phase != Phase.TERMINATED) {
            wakeups.acquire();
            if (cancelled) {
                return;
            }

            SocketSignal signal = null;
            SessionCommand command = null;
            if (preferInbound) {
                signal = inbound.poll();
                if (signal == null) {
                    command = commands.poll();
                }
            } else {
                command = commands.poll();
                if (command == null) {
                    signal = inbound.poll();
                }
            }
            preferInbound = !preferInbound;

            if (signal != null) {
                handleSignal(signal);
            } else if (command != null) {
                handleCommand(command);
            } else if (commands.isClosed()) {
                closeSocket(CentrifugoEvent.REASON_CONNECTION_CLOSED);
                terminate(ConnectionStatus.DISCONNECTED,
                        new CentrifugoEvent.Disconnected(CentrifugoEvent.REASON_CONNECTION_CLOSED));
            }
        }
    }

    // ==================== Inbound ====================

    private void handleSignal(SocketSignal signal) {
        if (signal instanceof Text text) {
            handleFrame(codec.decode(text.text()));
        } else if (signal instanceof Closed closed) {
            log.info("[session {}] Server closed connection ({} {})", sessionId, closed.code(), closed.reason());
            closeStarted = true;
            terminate(ConnectionStatus.DISCONNECTED,
                    new CentrifugoEvent.Disconnected(CentrifugoEvent.REASON_CONNECTION_CLOSED));
        } else if (signal instanceof Failed failed) {
            String message = describe(failed.error());
            log.warn("[session {}] Transport error: {}", sessionId, message);
            terminate(ConnectionStatus.error(message), new CentrifugoEvent.Error(message));
        }
    }

    private void handleFrame(InboundFrame frame) {
        if (frame instanceof InboundFrame.Reply reply) {
            handleReply(reply);
        } else if (frame instanceof InboundFrame.Push push) {
            handlePush(push);
        } else if (frame instanceof InboundFrame.Ignored ignored) {
            log.trace("[session {}] Ignored frame: {}", sessionId, ignored.reason());
        }
    }

    private void handleReply(InboundFrame.Reply reply) {
        if (reply.id() == null) {
            return;
        }
        if (RequestCorrelator.isConnectReply(reply.id())) {
            handleConnectReply(reply);
            return;
        }
        correlator.complete(reply.id()).ifPresentOrElse(
                pending -> {
                    if (pending instanceof PendingRequest.Subscribe subscribe) {
                        handleSubscribeReply(subscribe, reply);
                    } else {
                        log.debug("[session {}] Unsubscribe {} acknowledged", sessionId, pending.id());
                    }
                },
                () -> log.debug("[session {}] No pending request for reply id {}", sessionId, reply.id()));
    }

    private void handleConnectReply(InboundFrame.Reply reply) {
        if (reply.isError()) {
            String message = reply.errorMessage();
            log.warn("[session {}] Connect rejected: {}", sessionId, message);
            terminate(ConnectionStatus.error(message), new CentrifugoEvent.Error(message));
            return;
        }
        if (phase != Phase.HANDSHAKING) {
            log.debug("[session {}] Duplicate connect reply ignored", sessionId);
            return;
        }
        phase = Phase.CONNECTED;
        sharedState.setStatus(generation, ConnectionStatus.CONNECTED);
        log.info("[session {}] Connected", sessionId);
        emit(new CentrifugoEvent.Connected());
    }

    private void handleSubscribeReply(PendingRequest.Subscribe subscribe, InboundFrame.Reply reply) {
        if (reply.isError()) {
            log.warn("[session {}] Subscribe to {} failed: {}", sessionId, subscribe.channel(), reply.errorMessage());
            emit(new CentrifugoEvent.SubscriptionError(subscribe.handle(), reply.errorMessage()));
            return;
        }
        registry.register(subscribe.handle(), subscribe.channel());
        sharedState.putSubscription(generation, subscribe.handle(), subscribe.logicalName());
        log.debug("[session {}] Subscribed {} -> {}", sessionId, subscribe.handle(), subscribe.channel());
        emit(new CentrifugoEvent.Subscribed(subscribe.handle()));
    }

    private void handlePush(InboundFrame.Push push) {
        if (!push.isPublication()) {
            return;
        }
        registry.handleFor(push.channel()).ifPresentOrElse(
                handle -> emit(new CentrifugoEvent.Publication(handle, push.data())),
                () -> log.debug("[session {}] Dropping publication for unknown channel {}", sessionId, push.channel()));
    }

    // ==================== Commands ====================

    private void handleCommand(SessionCommand command) {
        if (command instanceof SessionCommand.Subscribe subscribe) {
            subscribe(subscribe);
        } else if (command instanceof SessionCommand.Unsubscribe unsubscribe) {
            unsubscribe(unsubscribe);
        } else if (command instanceof SessionCommand.Disconnect) {
            log.info("[session {}] Disconnect requested", sessionId);
            closeSocket(CentrifugoEvent.REASON_USER_DISCONNECTED);
            terminate(ConnectionStatus.DISCONNECTED,
                    new CentrifugoEvent.Disconnected(CentrifugoEvent.REASON_USER_DISCONNECTED));
        } else if (command instanceof SessionCommand.Connect) {
            log.debug("[session {}] Already connected, ignoring connect command", sessionId);
        }
    }

    private void subscribe(SessionCommand.Subscribe command) {
        String channel = channelNames.channelFor(command.logicalName());
        long id = correlator.allocate();
        correlator.track(new PendingRequest.Subscribe(id, command.handle(), command.logicalName(), channel));
        send(codec.encodeSubscribe(id, channel), "subscribe " + channel);
    }

    private void unsubscribe(SessionCommand.Unsubscribe command) {
        var channel = registry.channelFor(command.handle());
        if (channel.isEmpty()) {
            log.debug("[session {}] Unsubscribe for unknown handle {} ignored", sessionId, command.handle());
            return;
        }
        long id = correlator.allocate();
        correlator.track(new PendingRequest.Unsubscribe(id, channel.get()));
        send(codec.encodeUnsubscribe(id, channel.get()), "unsubscribe " + channel.get());
        registry.remove(command.handle());
        sharedState.removeSubscription(generation, command.handle());
    }

    private void closeSocket(String reason) {
        closeStarted = true;
        socket.close(GatewaySocket.NORMAL_CLOSURE, reason);
    }

    private void send(String frame, String what) {
        // A refused write means the socket is going away; its close or failure
        // signal ends the session.
        if (!socket.send(frame)) {
            log.warn("[session {}] Could not send {}: socket not writable", sessionId, what);
        }
    }

    // ==================== Terminal transitions ====================

    private void terminate(ConnectionStatus finalStatus, CentrifugoEvent event) {
        if (phase == Phase.TERMINATED) {
            return;
        }
        phase = Phase.TERMINATED;
        // Refuse new commands before anyone can observe the terminal status
        commands.close();
        correlator.clear();
        registry.clear();
        if (cancelled) {
            return;
        }
        sharedState.finish(generation, finalStatus);
        emit(event);
    }

    private void emit(CentrifugoEvent event) {
        if (cancelled || !sharedState.isCurrent(generation)) {
            log.debug("[session {}] Suppressing {} from replaced session", sessionId, event.getClass().getSimpleName());
            return;
        }
        try {
            sink.emit(event);
        } catch (RuntimeException e) {
            log.warn("[session {}] Event sink failed on {}: {}", sessionId, event.getClass().getSimpleName(),
                    e.getMessage());
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }

    // ==================== Socket callbacks ====================

    private final class QueueingListener implements SocketListener {

        @Override
        public void onOpen() {
            offer(new Opened());
        }

        @Override
        public void onText(String text) {
            offer(new Text(text));
        }

        @Override
        public void onClosed(int code, String reason) {
            offer(new Closed(code, reason));
        }

        @Override
        public void onFailure(Throwable error) {
            offer(new Failed(error));
        }

        private void offer(SocketSignal signal) {
            if (phase == Phase.TERMINATED) {
                return;
            }
            inbound.add(signal);
            wakeups.release();
        }
    }
}
