package com.slashsync.discord;

/**
 * Discord bot token resolution.
 */
public final class DiscordToken {

    private DiscordToken() {
    }

    public static final String ENV_VAR = "DISCORD_BOT_TOKEN";

    public enum Source {
        ENV, CONFIG, NONE
    }

    public record Resolution(String token, Source source) {

        public boolean isPresent() {
            return source != Source.NONE;
        }
    }

    /**
     * Normalize a Discord bot token: trim, strip leading "Bot " prefix.
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank())
            return null;
        String trimmed = raw.trim();
        return trimmed.replaceFirst("(?i)^Bot\\s+", "");
    }

    /**
     * Resolve the bot token. Priority: config token, then the
     * {@code DISCORD_BOT_TOKEN} environment variable.
     */
    public static Resolution resolve(String configToken, String envToken) {
        String token = normalize(configToken);
        if (token != null)
            return new Resolution(token, Source.CONFIG);
        String env = envToken != null ? envToken : System.getenv(ENV_VAR);
        String normalizedEnv = normalize(env);
        if (normalizedEnv != null)
            return new Resolution(normalizedEnv, Source.ENV);
        return new Resolution("", Source.NONE);
    }

    public static Resolution resolve(String configToken) {
        return resolve(configToken, null);
    }

    /**
     * Value of the {@code Authorization} header.
     */
    public static String authorization(String token) {
        return "Bot " + token;
    }

    /**
     * Safe form for logs: the first 4 characters followed by a mask.
     */
    public static String redact(String token) {
        if (token == null || token.isEmpty())
            return "<none>";
        if (token.length() <= 8)
            return "****";
        return token.substring(0, 4) + "****";
    }
}
