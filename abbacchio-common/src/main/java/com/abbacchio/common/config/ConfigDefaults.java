package com.abbacchio.common.config;

import java.time.Duration;

/**
 * Default values applied to missing config sections.
 */
public final class ConfigDefaults {

    private ConfigDefaults() {
    }

    public static final String DEFAULT_URL = "ws://localhost:8000/connection/websocket";
    public static final String DEFAULT_CHANNEL_PREFIX = "logs";
    public static final int DEFAULT_COMMAND_QUEUE_CAPACITY = 32;
    public static final long DEFAULT_COMMAND_SEND_TIMEOUT_MS = 5_000;
    public static final long DEFAULT_STORE_MAX_AGE_MS = Duration.ofDays(7).toMillis();

    /**
     * Fill in every unset value. Returns the same instance.
     */
    public static AbbacchioConfig apply(AbbacchioConfig config) {
        if (config.getCentrifugo() == null) {
            config.setCentrifugo(new AbbacchioConfig.CentrifugoConfig());
        }
        var centrifugo = config.getCentrifugo();
        if (isBlank(centrifugo.getUrl())) centrifugo.setUrl(DEFAULT_URL);
        if (centrifugo.getToken() == null) centrifugo.setToken("");
        if (isBlank(centrifugo.getChannelPrefix())) centrifugo.setChannelPrefix(DEFAULT_CHANNEL_PREFIX);
        if (centrifugo.getCommandQueueCapacity() == null || centrifugo.getCommandQueueCapacity() <= 0) {
            centrifugo.setCommandQueueCapacity(DEFAULT_COMMAND_QUEUE_CAPACITY);
        }
        if (centrifugo.getCommandSendTimeoutMs() == null || centrifugo.getCommandSendTimeoutMs() < 0) {
            centrifugo.setCommandSendTimeoutMs(DEFAULT_COMMAND_SEND_TIMEOUT_MS);
        }

        if (config.getStore() == null) {
            config.setStore(new AbbacchioConfig.StoreConfig());
        }
        if (config.getStore().getMaxAgeMs() == null || config.getStore().getMaxAgeMs() <= 0) {
            config.getStore().setMaxAgeMs(DEFAULT_STORE_MAX_AGE_MS);
        }

        if (config.getLogging() == null) {
            config.setLogging(new AbbacchioConfig.LoggingConfig());
        }
        return config;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
