package com.abbacchio.centrifugo.session;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SubscriptionRegistryTest {

    private final SubscriptionRegistry registry = new SubscriptionRegistry();

    @Test
    void register_mapsBothDirections() {
        registry.register("c1", "logs:app");

        assertEquals(Optional.of("c1"), registry.handleFor("logs:app"));
        assertEquals(Optional.of("logs:app"), registry.channelFor("c1"));
        assertEquals(1, registry.size());
    }

    @Test
    void register_sameHandleNewChannel_dropsOldChannel() {
        registry.register("c1", "logs:app");
        registry.register("c1", "logs:worker");

        assertTrue(registry.handleFor("logs:app").isEmpty());
        assertEquals(Optional.of("c1"), registry.handleFor("logs:worker"));
        assertEquals(1, registry.size());
    }

    @Test
    void register_sameChannelNewHandle_dropsOldHandle() {
        registry.register("c1", "logs:app");
        registry.register("c2", "logs:app");

        assertTrue(registry.channelFor("c1").isEmpty());
        assertEquals(Optional.of("c2"), registry.handleFor("logs:app"));
    }

    @Test
    void remove_returnsChannelAndClearsBothSides() {
        registry.register("c1", "logs:app");

        assertEquals(Optional.of("logs:app"), registry.remove("c1"));
        assertTrue(registry.handleFor("logs:app").isEmpty());
        assertTrue(registry.remove("c1").isEmpty());
    }

    @Test
    void randomOperations_keepMapsMutualInverses() {
        Random random = new Random(7);
        for (int i = 0; i < 2_000; i++) {
            String handle = "h" + random.nextInt(6);
            String channel = "logs:" + random.nextInt(6);
            switch (random.nextInt(3)) {
                case 0, 1 -> registry.register(handle, channel);
                default -> registry.remove(handle);
            }
            assertInverse();
        }
        registry.clear();
        assertEquals(0, registry.size());
        assertTrue(registry.handlesByChannel().isEmpty());
    }

    private void assertInverse() {
        Map<String, String> forward = registry.channelsByHandle();
        Map<String, String> backward = registry.handlesByChannel();
        assertEquals(forward.size(), backward.size());
        forward.forEach((handle, channel) -> assertEquals(handle, backward.get(channel)));
    }
}
