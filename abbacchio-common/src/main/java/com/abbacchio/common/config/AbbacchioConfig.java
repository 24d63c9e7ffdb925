package com.abbacchio.common.config;

import lombok.Data;

/**
 * Root configuration type for the Abbacchio client.
 * Loaded from {@code ~/.abbacchio/config.json} by {@link ConfigService}.
 */
@Data
public class AbbacchioConfig {

    /** Centrifugo connection settings. */
    private CentrifugoConfig centrifugo;

    /** Local log store settings. */
    private StoreConfig store;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class CentrifugoConfig {
        /** WebSocket endpoint, e.g. ws://localhost:8000/connection/websocket. */
        private String url;
        /** Connection token handed to the gateway in the connect request. */
        private String token;
        /** Namespace prefix for channel names ("logs" gives "logs:&lt;name&gt;"). */
        private String channelPrefix;
        /** Capacity of the per-session command queue. */
        private Integer commandQueueCapacity;
        /** How long a caller may block while queueing a command. */
        private Long commandSendTimeoutMs;
    }

    @Data
    public static class StoreConfig {
        /** Entries older than this are removed by prune. */
        private Long maxAgeMs;
    }

    @Data
    public static class LoggingConfig {
        /** "off" disables token redaction in log output. */
        private String redact;
    }
}
