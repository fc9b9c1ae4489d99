package com.slashsync.discord;

import com.slashsync.common.config.ConfigService;
import com.slashsync.common.config.SlashSyncConfig;
import com.slashsync.core.dispatch.DispatchEngine;
import com.slashsync.core.dispatch.DispatchResult;
import com.slashsync.core.dispatch.ErrorSink;
import com.slashsync.core.dispatch.Interaction;
import com.slashsync.core.dispatch.LoggingErrorSink;
import com.slashsync.core.model.OptionChoice;
import com.slashsync.core.node.ApplicationCommand;
import com.slashsync.core.registry.CommandRegistry;
import com.slashsync.core.registry.CommandUnit;
import com.slashsync.core.registry.UnitReload;
import com.slashsync.core.sync.CommandTransport;
import com.slashsync.core.sync.SyncEngine;
import com.slashsync.core.sync.SyncReport;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point wiring one registry to the Discord transport and to the
 * synchronization and dispatch engines.
 * <p>
 * Typical lifecycle: register commands or load units, call {@link #onReady}
 * once the gateway session is up, then feed every interaction payload to
 * {@link #handleInteraction}.
 */
@Slf4j
public class SlashSyncClient implements AutoCloseable {

    /** Interaction callback type answering an autocomplete request. */
    public static final int CALLBACK_AUTOCOMPLETE_RESULT = 8;

    private final SlashSyncConfig config;
    private final CommandRegistry registry;
    private final CommandTransport transport;
    private final SyncEngine syncEngine;
    private final DispatchEngine dispatchEngine;
    private final InteractionParser parser;

    public static SlashSyncClient fromConfigFile(Path configPath) {
        return new SlashSyncClient(new ConfigService(configPath).loadConfig());
    }

    public SlashSyncClient(SlashSyncConfig config) {
        this(config, new DiscordRestTransport(config), new LoggingErrorSink());
    }

    public SlashSyncClient(SlashSyncConfig config, CommandTransport transport, ErrorSink errorSink) {
        this.config = config;
        this.registry = new CommandRegistry();
        this.transport = transport;
        SlashSyncConfig.SyncConfig sync = config.getSync() != null ? config.getSync()
                : new SlashSyncConfig.SyncConfig();
        this.syncEngine = new SyncEngine(registry, transport, sync);
        this.dispatchEngine = new DispatchEngine(registry, errorSink);
        this.parser = new InteractionParser();
    }

    public CommandRegistry getRegistry() {
        return registry;
    }

    public SyncEngine getSyncEngine() {
        return syncEngine;
    }

    public DispatchEngine getDispatchEngine() {
        return dispatchEngine;
    }

    // =========================================================================
    // Commands
    // =========================================================================

    public <T extends ApplicationCommand> T register(T command) {
        return registry.register(command);
    }

    public List<ApplicationCommand> loadUnit(CommandUnit unit) {
        return registry.loadUnit(unit);
    }

    /**
     * Replace a loaded unit and follow up with a synchronization when the
     * configuration asks for one.
     */
    public CompletableFuture<SyncReport> reloadUnit(CommandUnit unit) {
        UnitReload reload = registry.reloadUnit(unit, syncConfig().isDeleteOnUnitReload());
        return syncEngine.afterReload(reload);
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Synchronize, or only collect remote metadata when synchronization is
     * disabled.
     *
     * @param guildIds every guild the application is in
     */
    public CompletableFuture<SyncReport> onReady(Collection<Long> guildIds) {
        if (!syncConfig().isEnabled()) {
            log.info("Command synchronization disabled, collecting remote commands only");
            return syncEngine.collect();
        }
        return syncEngine.synchronize(guildIds);
    }

    // =========================================================================
    // Interactions
    // =========================================================================

    /**
     * Parse and dispatch one interaction payload.
     */
    public DispatchResult handleInteraction(String payload) {
        Interaction interaction = parser.parse(payload);
        return dispatchEngine.dispatch(interaction);
    }

    /**
     * Callback body answering an autocomplete interaction with the given
     * suggestions.
     */
    public static Map<String, Object> autocompleteResponse(List<OptionChoice> choices) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("type", CALLBACK_AUTOCOMPLETE_RESULT);
        response.put("data", Map.of("choices", choices.stream().map(OptionChoice::toWire).toList()));
        return response;
    }

    @Override
    public void close() {
        if (transport instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close transport: {}", e.getMessage());
            }
        }
    }

    private SlashSyncConfig.SyncConfig syncConfig() {
        return config.getSync() != null ? config.getSync() : new SlashSyncConfig.SyncConfig();
    }
}
