package com.abbacchio.centrifugo.protocol;

/**
 * Derives server channel names from logical names: {@code "<prefix>:<name>"}.
 */
public final class ChannelNames {

    public static final String DEFAULT_PREFIX = "logs";
    private static final char SEPARATOR = ':';

    private final String prefix;

    public ChannelNames() {
        this(DEFAULT_PREFIX);
    }

    public ChannelNames(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("channel prefix required");
        }
        this.prefix = prefix.trim();
    }

    public String prefix() {
        return prefix;
    }

    public String channelFor(String logicalName) {
        return prefix + SEPARATOR + logicalName;
    }

    /**
     * Inverse of {@link #channelFor}; returns null for channels outside this prefix.
     */
    public String logicalNameOf(String channel) {
        if (channel == null || !channel.startsWith(prefix + SEPARATOR)) {
            return null;
        }
        return channel.substring(prefix.length() + 1);
    }
}
