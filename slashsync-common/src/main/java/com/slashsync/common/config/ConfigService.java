package com.slashsync.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the SlashSync configuration file.
 */
@Slf4j
public class ConfigService {

    public static final String DEFAULT_API_BASE_URL = "https://discord.com/api/v10";

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, SlashSyncConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            configPath = Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        this.configPath = configPath;
        this.env = env != null ? env : System::getenv;
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
    public SlashSyncConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public SlashSyncConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private SlashSyncConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new SlashSyncConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            SlashSyncConfig config = objectMapper.readValue(raw, SlashSyncConfig.class);
            log.info("Config loaded from: {}", configPath);
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new SlashSyncConfig());
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
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config fields.
     */
    SlashSyncConfig applyDefaults(SlashSyncConfig config) {
        if (config.getApiBaseUrl() == null || config.getApiBaseUrl().isBlank()) {
            config.setApiBaseUrl(DEFAULT_API_BASE_URL);
        }
        if (config.getSync() == null) {
            config.setSync(new SlashSyncConfig.SyncConfig());
        }
        if (config.getHttp() == null) {
            config.setHttp(new SlashSyncConfig.HttpConfig());
        }
        if (config.getSync().getGuildTimeoutMs() <= 0) {
            config.getSync().setGuildTimeoutMs(new SlashSyncConfig.SyncConfig().getGuildTimeoutMs());
        }
        return config;
    }
}
