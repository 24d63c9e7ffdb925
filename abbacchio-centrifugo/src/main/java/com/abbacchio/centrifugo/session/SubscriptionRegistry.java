package com.abbacchio.centrifugo.session;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bidirectional handle ↔ channel map for one session.
 *
 * <p>
 * The two directions are kept mutual inverses: a handle maps to at most one
 * channel and a channel to at most one handle. Single-threaded.
 */
public class SubscriptionRegistry {

    /** handle → channel name */
    private final Map<String, String> channelsByHandle = new HashMap<>();

    /** channel name → handle */
    private final Map<String, String> handlesByChannel = new HashMap<>();

    /**
     * Record a confirmed subscription. Replaces any earlier channel of the
     * handle and any earlier owner of the channel.
     */
    public void register(String handle, String channel) {
        String previousChannel = channelsByHandle.remove(handle);
        if (previousChannel != null) {
            handlesByChannel.remove(previousChannel);
        }
        String previousHandle = handlesByChannel.remove(channel);
        if (previousHandle != null) {
            channelsByHandle.remove(previousHandle);
        }
        channelsByHandle.put(handle, channel);
        handlesByChannel.put(channel, handle);
    }

    public Optional<String> handleFor(String channel) {
        return Optional.ofNullable(handlesByChannel.get(channel));
    }

    public Optional<String> channelFor(String handle) {
        return Optional.ofNullable(channelsByHandle.get(handle));
    }

    /** Remove both directions for a handle; returns its channel if it had one. */
    public Optional<String> remove(String handle) {
        String channel = channelsByHandle.remove(handle);
        if (channel != null) {
            handlesByChannel.remove(channel);
        }
        return Optional.ofNullable(channel);
    }

    public void clear() {
        channelsByHandle.clear();
        handlesByChannel.clear();
    }

    public int size() {
        return channelsByHandle.size();
    }

    public Map<String, String> channelsByHandle() {
        return Collections.unmodifiableMap(channelsByHandle);
    }

    public Map<String, String> handlesByChannel() {
        return Collections.unmodifiableMap(handlesByChannel);
    }
}
