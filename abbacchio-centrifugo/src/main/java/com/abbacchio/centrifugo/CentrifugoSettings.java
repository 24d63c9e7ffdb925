package com.abbacchio.centrifugo;

import com.abbacchio.common.config.AbbacchioConfig;
import com.abbacchio.common.config.ConfigDefaults;
import lombok.Builder;
import lombok.Data;

/**
 * Resolved, validated client settings.
 */
@Data
@Builder
public class CentrifugoSettings {

    @Builder.Default
    private String url = ConfigDefaults.DEFAULT_URL;
    @Builder.Default
    private String token = "";
    @Builder.Default
    private String channelPrefix = ConfigDefaults.DEFAULT_CHANNEL_PREFIX;
    @Builder.Default
    private int commandQueueCapacity = ConfigDefaults.DEFAULT_COMMAND_QUEUE_CAPACITY;
    @Builder.Default
    private long commandSendTimeoutMs = ConfigDefaults.DEFAULT_COMMAND_SEND_TIMEOUT_MS;

    public static CentrifugoSettings defaults() {
        return CentrifugoSettings.builder().build();
    }

    /**
     * Resolve settings from the loaded config; missing values fall back to defaults.
     */
    public static CentrifugoSettings resolve(AbbacchioConfig config) {
        AbbacchioConfig.CentrifugoConfig raw = config != null ? config.getCentrifugo() : null;
        CentrifugoSettings settings = defaults();
        if (raw == null) {
            return settings;
        }
        if (raw.getUrl() != null && !raw.getUrl().isBlank()) settings.setUrl(raw.getUrl().trim());
        if (raw.getToken() != null) settings.setToken(raw.getToken());
        if (raw.getChannelPrefix() != null && !raw.getChannelPrefix().isBlank())
            settings.setChannelPrefix(raw.getChannelPrefix().trim());
        if (raw.getCommandQueueCapacity() != null && raw.getCommandQueueCapacity() > 0)
            settings.setCommandQueueCapacity(raw.getCommandQueueCapacity());
        if (raw.getCommandSendTimeoutMs() != null && raw.getCommandSendTimeoutMs() >= 0)
            settings.setCommandSendTimeoutMs(raw.getCommandSendTimeoutMs());
        return settings;
    }
}
