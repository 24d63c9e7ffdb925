package com.abbacchio.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the client configuration.
 */
@Slf4j
public class ConfigService {

    public static final Path DEFAULT_CONFIG_PATH = Path.of("~", ".abbacchio", "config.json");

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, AbbacchioConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService() {
        this(DEFAULT_CONFIG_PATH);
    }

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        // Expand ~ to user home directory
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public AbbacchioConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public AbbacchioConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Write the config back to disk as pretty-printed JSON.
     */
    public void saveConfig(AbbacchioConfig config) throws IOException {
        if (configPath.getParent() != null) {
            Files.createDirectories(configPath.getParent());
        }
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json);
        cache.invalidateAll();
        log.info("Config saved to: {}", configPath);
    }

    public Path getConfigPath() {
        return configPath;
    }

    private AbbacchioConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return ConfigDefaults.apply(new AbbacchioConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            AbbacchioConfig config = objectMapper.readValue(raw, AbbacchioConfig.class);
            if (config == null) {
                config = new AbbacchioConfig();
            }
            log.info("Config loaded from: {}", configPath);
            return ConfigDefaults.apply(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return ConfigDefaults.apply(new AbbacchioConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null || value.isEmpty()) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Convenience for tests and embedders: a lookup backed by a fixed map.
     */
    public static Function<String, String> envOf(Map<String, String> values) {
        return values::get;
    }
}
