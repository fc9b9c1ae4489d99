package com.slashsync.common.config;

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
        configPath = tempDir.resolve("slashsync.json");
    }

    private ConfigService service(Map<String, String> env) {
        return new ConfigService(configPath, Duration.ofMinutes(1), env::get);
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "applicationId": "1000",
                  "token": "Bot abc",
                  "sync": {
                    "deleteNotExistingCommands": false,
                    "concurrentGuilds": true,
                    "guildTimeoutMs": 2500
                  }
                }
                """;
        Files.writeString(configPath, json);

        SlashSyncConfig config = service(Map.of()).loadConfig();

        assertEquals("1000", config.getApplicationId());
        assertEquals("Bot abc", config.getToken());
        assertFalse(config.getSync().isDeleteNotExistingCommands());
        assertTrue(config.getSync().isConcurrentGuilds());
        assertTrue(config.getSync().isEnabled());
        assertEquals(2500, config.getSync().getGuildTimeoutMs());
        assertEquals(ConfigService.DEFAULT_API_BASE_URL, config.getApiBaseUrl());
        assertNotNull(config.getHttp());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        SlashSyncConfig config = new ConfigService(tempDir.resolve("nope.json")).loadConfig();

        assertNotNull(config.getSync());
        assertTrue(config.getSync().isDeleteNotExistingCommands());
        assertFalse(config.getSync().isSyncOnUnitReload());
        assertEquals(10_000, config.getSync().getGuildTimeoutMs());
    }

    @Test
    void loadConfig_unknownPropertiesIgnored() throws IOException {
        Files.writeString(configPath, """
                { "applicationId": "7", "somethingElse": { "x": 1 } }
                """);
        assertEquals("7", service(Map.of()).loadConfig().getApplicationId());
    }

    @Test
    void loadConfig_substitutesEnvironment() throws IOException {
        Files.writeString(configPath, """
                { "token": "${BOT_TOKEN}", "applicationId": "${APP_ID:-55}" }
                """);

        SlashSyncConfig config = service(Map.of("BOT_TOKEN", "secret")).loadConfig();

        assertEquals("secret", config.getToken());
        assertEquals("55", config.getApplicationId());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        assertEquals("hello", service(Map.of()).substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_missingWithoutDefault_isEmpty() {
        assertEquals("[]", service(Map.of()).substituteEnvVars("[${NOT_SET}]"));
    }

    @Test
    void loadConfig_isCached_untilReload() throws IOException {
        Files.writeString(configPath, "{ \"applicationId\": \"1\" }");
        ConfigService service = service(Map.of());
        SlashSyncConfig first = service.loadConfig();

        Files.writeString(configPath, "{ \"applicationId\": \"2\" }");
        assertSame(first, service.loadConfig());
        assertEquals("2", service.reloadConfig().getApplicationId());
    }

    @Test
    void applyDefaults_fixesNonPositiveTimeout() {
        SlashSyncConfig config = new SlashSyncConfig();
        config.setSync(new SlashSyncConfig.SyncConfig());
        config.getSync().setGuildTimeoutMs(0);

        service(Map.of()).applyDefaults(config);

        assertEquals(10_000, config.getSync().getGuildTimeoutMs());
    }
}
