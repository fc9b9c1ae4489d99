package com.slashsync.discord;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slashsync.common.config.ConfigService;
import com.slashsync.common.config.SlashSyncConfig;
import com.slashsync.core.model.Scope;
import com.slashsync.core.sync.CommandTransport;
import com.slashsync.core.sync.TransportException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandTransport} over the Discord REST API.
 * <p>
 * Requests are sent asynchronously through OkHttp; a response outside 2xx
 * completes the future with the exception produced by
 * {@link DiscordApi#toTransportException}. Nothing is retried.
 */
@Slf4j
public class DiscordRestTransport implements CommandTransport, AutoCloseable {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final TypeReference<List<Map<String, Object>>> COMMAND_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> COMMAND = new TypeReference<>() {
    };

    private final String baseUrl;
    private final long applicationId;
    private final String token;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public DiscordRestTransport(SlashSyncConfig config) {
        this(baseUrl(config), parseApplicationId(config.getApplicationId()), resolveToken(config),
                buildClient(config.getHttp()));
    }

    DiscordRestTransport(String baseUrl, long applicationId, String token, OkHttpClient httpClient) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.applicationId = applicationId;
        this.token = token;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        log.info("Discord transport for application {} (token {})",
                Long.toUnsignedString(applicationId), DiscordToken.redact(token));
    }

    public long getApplicationId() {
        return applicationId;
    }

    // =========================================================================
    // CommandTransport
    // =========================================================================

    @Override
    public CompletableFuture<List<Map<String, Object>>> fetchCommands(Scope scope) {
        String route = DiscordApi.commandsRoute(applicationId, scope) + "?with_localizations=true";
        return call("GET", route, null, COMMAND_LIST);
    }

    @Override
    public CompletableFuture<Map<String, Object>> createCommand(Scope scope, Map<String, Object> command) {
        return call("POST", DiscordApi.commandsRoute(applicationId, scope), command, COMMAND);
    }

    @Override
    public CompletableFuture<Map<String, Object>> editCommand(Scope scope, long commandId,
            Map<String, Object> command) {
        return call("PATCH", DiscordApi.commandRoute(applicationId, scope, commandId), command, COMMAND);
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> bulkOverwriteCommands(Scope scope,
            List<Map<String, Object>> commands) {
        return call("PUT", DiscordApi.commandsRoute(applicationId, scope), commands, COMMAND_LIST);
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    // =========================================================================
    // HTTP
    // =========================================================================

    private <T> CompletableFuture<T> call(String method, String route, Object body, TypeReference<T> type) {
        CompletableFuture<T> future = new CompletableFuture<>();
        Request request;
        try {
            RequestBody requestBody = body == null ? null
                    : RequestBody.create(objectMapper.writeValueAsString(body), JSON);
            request = new Request.Builder()
                    .url(baseUrl + route)
                    .header("Authorization", DiscordToken.authorization(token))
                    .header("User-Agent", "DiscordBot (https://github.com/slashsync/slashsync, 1.0)")
                    .method(method, requestBody)
                    .build();
        } catch (JsonProcessingException e) {
            future.completeExceptionally(new TransportException("Cannot serialize " + method + " " + route, e));
            return future;
        }

        log.debug("{} {}", method, route);
        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(new TransportException(method + " " + route + " failed: "
                        + e.getMessage(), e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (ResponseBody responseBody = response.body()) {
                    String text = responseBody != null ? responseBody.string() : "";
                    if (!response.isSuccessful()) {
                        future.completeExceptionally(
                                DiscordApi.toTransportException(method, route, response.code(), text));
                        return;
                    }
                    future.complete(text.isEmpty() ? null : objectMapper.readValue(text, type));
                } catch (IOException e) {
                    future.completeExceptionally(
                            new TransportException("Unreadable response to " + method + " " + route, e));
                }
            }
        });
        return future;
    }

    // =========================================================================
    // Configuration
    // =========================================================================

    static long parseApplicationId(String applicationId) {
        if (applicationId == null || applicationId.isBlank()) {
            throw new IllegalStateException("applicationId is not configured");
        }
        try {
            return Long.parseUnsignedLong(applicationId.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("applicationId is not a snowflake: " + applicationId, e);
        }
    }

    private static String resolveToken(SlashSyncConfig config) {
        DiscordToken.Resolution resolution = DiscordToken.resolve(config.getToken());
        if (!resolution.isPresent()) {
            throw new IllegalStateException("No bot token configured (set token or " + DiscordToken.ENV_VAR + ")");
        }
        log.debug("Bot token resolved from {}", resolution.source());
        return resolution.token();
    }

    private static String baseUrl(SlashSyncConfig config) {
        String url = config.getApiBaseUrl();
        return url == null || url.isBlank() ? ConfigService.DEFAULT_API_BASE_URL : url;
    }

    private static OkHttpClient buildClient(SlashSyncConfig.HttpConfig http) {
        SlashSyncConfig.HttpConfig settings = http != null ? http : new SlashSyncConfig.HttpConfig();
        return new OkHttpClient.Builder()
                .connectTimeout(settings.getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .readTimeout(settings.getReadTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();
    }
}
