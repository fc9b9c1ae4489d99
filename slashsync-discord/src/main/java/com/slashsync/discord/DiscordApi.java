package com.slashsync.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slashsync.core.model.Scope;
import com.slashsync.core.sync.MissingAccessException;
import com.slashsync.core.sync.TransportException;

import java.io.IOException;

/**
 * Discord REST routes for application commands and error mapping.
 */
public final class DiscordApi {

    private DiscordApi() {
    }

    public static final int STATUS_FORBIDDEN = 403;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // =========================================================================
    // Routes
    // =========================================================================

    /**
     * {@code /applications/{app}/commands} or
     * {@code /applications/{app}/guilds/{guild}/commands}.
     */
    public static String commandsRoute(long applicationId, Scope scope) {
        String base = "/applications/" + Long.toUnsignedString(applicationId);
        return scope.isGlobal() ? base + "/commands" : base + "/guilds/" + scope.guildId() + "/commands";
    }

    public static String commandRoute(long applicationId, Scope scope, long commandId) {
        return commandsRoute(applicationId, scope) + "/" + Long.toUnsignedString(commandId);
    }

    // =========================================================================
    // Errors
    // =========================================================================

    /**
     * Map an unsuccessful response onto the transport error taxonomy: 403 or
     * code 50001 is missing access, anything else a plain transport failure.
     */
    public static TransportException toTransportException(String method, String route, int status,
            String responseBody) {
        int code = errorCode(responseBody);
        String text = formatErrorText(responseBody);
        String message = method + " " + route + " failed with HTTP " + status + (text == null ? "" : ": " + text);
        if (status == STATUS_FORBIDDEN || code == MissingAccessException.MISSING_ACCESS_CODE) {
            return new MissingAccessException(message, status, code);
        }
        return new TransportException(message, status, code);
    }

    /**
     * Format a Discord API error JSON body into a human-readable message.
     * Extracts "message" and optional "retry_after" from the response payload.
     */
    public static String formatErrorText(String responseBody) {
        if (responseBody == null)
            return null;
        String trimmed = responseBody.trim();
        if (trimmed.isEmpty())
            return null;
        JsonNode root = readObject(trimmed);
        if (root == null)
            return trimmed;
        String message = root.path("message").asText("");
        String msg = message.isEmpty() ? "unknown error" : message;
        JsonNode retryAfter = root.get("retry_after");
        if (retryAfter != null && retryAfter.isNumber()) {
            double seconds = retryAfter.asDouble();
            String formatted = seconds < 10 ? String.format("%.1fs", seconds) : Math.round(seconds) + "s";
            return msg + " (retry after " + formatted + ")";
        }
        return msg;
    }

    /**
     * Platform error code of a response body, 0 if absent.
     */
    static int errorCode(String responseBody) {
        JsonNode root = responseBody == null ? null : readObject(responseBody.trim());
        return root == null ? 0 : root.path("code").asInt(0);
    }

    private static JsonNode readObject(String body) {
        if (!body.startsWith("{") || !body.endsWith("}"))
            return null;
        try {
            return MAPPER.readTree(body);
        } catch (IOException e) {
            return null;
        }
    }
}
