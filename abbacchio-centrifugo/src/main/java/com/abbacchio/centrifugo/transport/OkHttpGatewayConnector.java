package com.abbacchio.centrifugo.transport;

import com.abbacchio.common.logging.LogRedact;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;

import java.io.EOFException;
import java.util.concurrent.TimeUnit;

/**
 * {@link GatewayConnector} backed by the OkHttp WebSocket client.
 */
@Slf4j
public class OkHttpGatewayConnector implements GatewayConnector, AutoCloseable {

    private final OkHttpClient client;
    private final boolean ownsClient;

    public OkHttpGatewayConnector() {
        this(new OkHttpClient.Builder()
                .readTimeout(0, TimeUnit.MILLISECONDS) // WebSocket: no read timeout
                .build(), true);
    }

    public OkHttpGatewayConnector(OkHttpClient client) {
        this(client, false);
    }

    private OkHttpGatewayConnector(OkHttpClient client, boolean ownsClient) {
        this.client = client;
        this.ownsClient = ownsClient;
    }

    @Override
    public GatewaySocket open(String url, SocketListener listener) {
        Request request = new Request.Builder().url(url).build();
        WebSocket ws = client.newWebSocket(request, new Bridge(listener));
        return new OkHttpSocket(ws);
    }

    @Override
    public void close() {
        if (!ownsClient) {
            return;
        }
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private static final class OkHttpSocket implements GatewaySocket {
        private final WebSocket ws;

        OkHttpSocket(WebSocket ws) {
            this.ws = ws;
        }

        @Override
        public boolean send(String text) {
            return ws.send(text);
        }

        @Override
        public void close(int code, String reason) {
            try {
                ws.close(code, reason);
            } catch (IllegalArgumentException e) {
                log.debug("Close rejected ({}), cancelling instead", e.getMessage());
                ws.cancel();
            }
        }

        @Override
        public void cancel() {
            ws.cancel();
        }
    }

    private static final class Bridge extends WebSocketListener {
        private final SocketListener listener;

        Bridge(SocketListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket ws, Response response) {
            listener.onOpen();
        }

        @Override
        public void onMessage(WebSocket ws, String text) {
            listener.onText(text);
        }

        @Override
        public void onMessage(WebSocket ws, ByteString bytes) {
            log.debug("Ignoring binary frame ({} bytes)", bytes.size());
        }

        @Override
        public void onClosing(WebSocket ws, int code, String reason) {
            listener.onClosed(code, reason);
            // Complete the close handshake
            ws.close(GatewaySocket.NORMAL_CLOSURE, null);
        }

        @Override
        public void onFailure(WebSocket ws, Throwable t, Response response) {
            if (t instanceof EOFException) {
                listener.onClosed(1006, "end of stream");
                return;
            }
            if (response != null) {
                log.debug("Socket failure with HTTP {} from {}", response.code(),
                        LogRedact.redactUrl(response.request().url().toString()));
            }
            listener.onFailure(t);
        }
    }
}
