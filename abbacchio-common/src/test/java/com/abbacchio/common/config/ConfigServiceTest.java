package com.abbacchio.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("config.json");
    }

    private ConfigService service(Map<String, String> env) {
        return new ConfigService(configPath, Duration.ofMinutes(1), ConfigService.envOf(env));
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "centrifugo": {
                    "url": "ws://gateway:8000/connection/websocket",
                    "token": "abc",
                    "channelPrefix": "app",
                    "commandQueueCapacity": 8
                  },
                  "store": { "maxAgeMs": 60000 }
                }
                """;
        Files.writeString(configPath, json);

        AbbacchioConfig config = service(Map.of()).loadConfig();

        assertEquals("ws://gateway:8000/connection/websocket", config.getCentrifugo().getUrl());
        assertEquals("abc", config.getCentrifugo().getToken());
        assertEquals("app", config.getCentrifugo().getChannelPrefix());
        assertEquals(8, config.getCentrifugo().getCommandQueueCapacity());
        assertEquals(ConfigDefaults.DEFAULT_COMMAND_SEND_TIMEOUT_MS,
                config.getCentrifugo().getCommandSendTimeoutMs());
        assertEquals(60_000L, config.getStore().getMaxAgeMs());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        AbbacchioConfig config = service(Map.of()).loadConfig();

        assertEquals(ConfigDefaults.DEFAULT_URL, config.getCentrifugo().getUrl());
        assertEquals("", config.getCentrifugo().getToken());
        assertEquals(ConfigDefaults.DEFAULT_CHANNEL_PREFIX, config.getCentrifugo().getChannelPrefix());
        assertEquals(ConfigDefaults.DEFAULT_COMMAND_QUEUE_CAPACITY,
                config.getCentrifugo().getCommandQueueCapacity());
        assertEquals(ConfigDefaults.DEFAULT_STORE_MAX_AGE_MS, config.getStore().getMaxAgeMs());
        assertEquals(Duration.ofDays(7).toMillis(), config.getStore().getMaxAgeMs());
        assertNotNull(config.getLogging());
    }

    @Test
    void loadConfig_malformedJson_fallsBackToDefaults() throws IOException {
        Files.writeString(configPath, "{ not json");

        AbbacchioConfig config = service(Map.of()).loadConfig();

        assertEquals(ConfigDefaults.DEFAULT_URL, config.getCentrifugo().getUrl());
    }

    @Test
    void loadConfig_substitutesEnvVars() throws IOException {
        Files.writeString(configPath, """
                { "centrifugo": { "token": "${CENTRIFUGO_TOKEN}", "url": "${CENTRIFUGO_URL:-ws://fallback/ws}" } }
                """);

        AbbacchioConfig config = service(Map.of("CENTRIFUGO_TOKEN", "secret-token")).loadConfig();

        assertEquals("secret-token", config.getCentrifugo().getToken());
        assertEquals("ws://fallback/ws", config.getCentrifugo().getUrl());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        assertEquals("hello", service(Map.of()).substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_missingWithoutDefault_becomesEmpty() {
        assertEquals("a--b", service(Map.of()).substituteEnvVars("a-${NOPE}-b"));
    }

    @Test
    void loadConfig_isCached() throws IOException {
        Files.writeString(configPath, """
                { "centrifugo": { "channelPrefix": "first" } }
                """);

        ConfigService service = service(Map.of());
        AbbacchioConfig first = service.loadConfig();
        AbbacchioConfig second = service.loadConfig();

        assertSame(first, second);
    }

    @Test
    void reloadConfig_picksUpChanges() throws IOException {
        Files.writeString(configPath, """
                { "centrifugo": { "channelPrefix": "first" } }
                """);
        ConfigService service = service(Map.of());
        assertEquals("first", service.loadConfig().getCentrifugo().getChannelPrefix());

        Files.writeString(configPath, """
                { "centrifugo": { "channelPrefix": "second" } }
                """);

        assertEquals("second", service.reloadConfig().getCentrifugo().getChannelPrefix());
    }

    @Test
    void saveConfig_roundTripsThroughDisk() throws IOException {
        ConfigService service = new ConfigService(tempDir.resolve("nested/config.json"),
                Duration.ofMinutes(1), ConfigService.envOf(Map.of()));
        AbbacchioConfig config = service.loadConfig();
        config.getCentrifugo().setChannelPrefix("saved");

        service.saveConfig(config);

        assertTrue(Files.exists(service.getConfigPath()));
        assertEquals("saved", service.loadConfig().getCentrifugo().getChannelPrefix());
    }
}
