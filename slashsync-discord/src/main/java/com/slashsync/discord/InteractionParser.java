package com.slashsync.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slashsync.core.dispatch.Interaction;
import com.slashsync.core.dispatch.InteractionOption;
import com.slashsync.core.dispatch.ResolvedData;
import com.slashsync.core.model.CommandType;
import com.slashsync.core.model.OptionType;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads Discord interaction payloads (gateway {@code INTERACTION_CREATE} or
 * webhook body) into {@link Interaction}s.
 * <p>
 * Snowflakes arrive as strings and are parsed as unsigned longs. Integer
 * option values become {@link Long}, number values {@link Double}; ids of
 * user, channel, role, mentionable and attachment options stay strings and
 * are resolved against the hydrated {@link DiscordEntities} at dispatch time.
 */
public class InteractionParser {

    private final ObjectMapper objectMapper;

    public InteractionParser() {
        this(new ObjectMapper());
    }

    public InteractionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Interaction parse(String json) {
        try {
            return parse(objectMapper.readTree(json));
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed interaction payload: " + e.getMessage(), e);
        }
    }

    public Interaction parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Interaction payload must be a JSON object");
        }
        JsonNode data = root.path("data");
        CommandType commandType = CommandType.fromValue(data.path("type").asInt(CommandType.CHAT_INPUT.value()));
        if (commandType == null) {
            throw new IllegalArgumentException("Unknown command type " + data.path("type").asText());
        }
        JsonNode user = root.hasNonNull("member") ? root.path("member").path("user") : root.path("user");

        return Interaction.builder()
                .id(snowflake(root.get("id")))
                .applicationId(snowflake(root.get("application_id")))
                .type(root.path("type").asInt())
                .token(root.path("token").asText(null))
                .guildId(optionalSnowflake(root.get("guild_id")))
                .channelId(optionalSnowflake(root.has("channel_id") ? root.get("channel_id")
                        : root.path("channel").get("id")))
                .userId(optionalSnowflake(user.get("id")))
                .locale(root.path("locale").asText(null))
                .commandId(optionalSnowflake(data.get("id")))
                .commandName(data.path("name").asText(null))
                .commandType(commandType)
                .targetId(optionalSnowflake(data.get("target_id")))
                .options(parseOptions(data.get("options")))
                .resolved(parseResolved(data.get("resolved")))
                .build();
    }

    // =========================================================================
    // Options
    // =========================================================================

    List<InteractionOption> parseOptions(JsonNode options) {
        if (options == null || !options.isArray())
            return List.of();
        List<InteractionOption> result = new ArrayList<>();
        for (JsonNode option : options) {
            String name = option.path("name").asText();
            OptionType type = OptionType.fromValue(option.path("type").asInt());
            if (type == null) {
                throw new IllegalArgumentException("Unknown option type " + option.path("type").asText()
                        + " for option " + name);
            }
            if (type.isContainer()) {
                result.add(InteractionOption.layer(name, type, parseOptions(option.get("options"))));
            } else {
                result.add(new InteractionOption(name, type, value(type, option.get("value")),
                        option.path("focused").asBoolean(false), List.of()));
            }
        }
        return result;
    }

    private static Object value(OptionType type, JsonNode value) {
        if (value == null || value.isNull())
            return null;
        return switch (type) {
            case INTEGER -> value.isIntegralNumber() ? value.asLong() : value.asText();
            case NUMBER -> value.isNumber() ? value.asDouble() : value.asText();
            case BOOLEAN -> value.isBoolean() ? value.asBoolean() : value.asText();
            default -> value.asText();
        };
    }

    // =========================================================================
    // Resolved entities
    // =========================================================================

    ResolvedData parseResolved(JsonNode resolved) {
        if (resolved == null || !resolved.isObject())
            return ResolvedData.EMPTY;
        Map<Long, Object> users = entities(resolved.get("users"), this::user);
        Map<Long, Object> members = new HashMap<>();
        forEachEntry(resolved.get("members"), (id, node) -> {
            DiscordEntities.User user = (DiscordEntities.User) users.get(id);
            members.put(id, member(user, node));
        });
        return ResolvedData.builder()
                .users(users)
                .members(members)
                .roles(entities(resolved.get("roles"), this::role))
                .channels(entities(resolved.get("channels"), this::channel))
                .attachments(entities(resolved.get("attachments"), this::attachment))
                .messages(entities(resolved.get("messages"), this::message))
                .build();
    }

    DiscordEntities.User user(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull())
            return null;
        return new DiscordEntities.User(snowflake(node.get("id")), node.path("username").asText(null),
                node.path("global_name").asText(null), node.path("bot").asBoolean(false));
    }

    private DiscordEntities.Member member(DiscordEntities.User user, JsonNode node) {
        List<Long> roleIds = new ArrayList<>();
        for (JsonNode role : node.path("roles")) {
            roleIds.add(snowflake(role));
        }
        DiscordEntities.User resolvedUser = user != null ? user : user(node.get("user"));
        return new DiscordEntities.Member(resolvedUser, node.path("nick").asText(null), List.copyOf(roleIds),
                node.path("permissions").asText(null));
    }

    private DiscordEntities.Role role(JsonNode node) {
        return new DiscordEntities.Role(snowflake(node.get("id")), node.path("name").asText(null),
                node.path("color").asInt(0), node.path("permissions").asText(null));
    }

    private DiscordEntities.Channel channel(JsonNode node) {
        return new DiscordEntities.Channel(snowflake(node.get("id")), node.path("type").asInt(),
                node.path("name").asText(null), optionalSnowflake(node.get("parent_id")));
    }

    private DiscordEntities.Attachment attachment(JsonNode node) {
        return new DiscordEntities.Attachment(snowflake(node.get("id")), node.path("filename").asText(null),
                node.path("url").asText(null), node.path("size").asLong(0), node.path("content_type").asText(null));
    }

    private DiscordEntities.Message message(JsonNode node) {
        return new DiscordEntities.Message(snowflake(node.get("id")), snowflake(node.get("channel_id")),
                node.path("content").asText(""), user(node.get("author")));
    }

    private static <T> Map<Long, Object> entities(JsonNode block, Function<JsonNode, T> reader) {
        Map<Long, Object> result = new LinkedHashMap<>();
        forEachEntry(block, (id, node) -> result.put(id, reader.apply(node)));
        return result;
    }

    private interface EntryConsumer {
        void accept(long id, JsonNode node);
    }

    private static void forEachEntry(JsonNode block, EntryConsumer consumer) {
        if (block == null || !block.isObject())
            return;
        Iterator<Map.Entry<String, JsonNode>> fields = block.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            consumer.accept(Long.parseUnsignedLong(field.getKey()), field.getValue());
        }
    }

    // =========================================================================
    // Snowflakes
    // =========================================================================

    static long snowflake(JsonNode node) {
        Long value = optionalSnowflake(node);
        return value == null ? 0L : value;
    }

    static Long optionalSnowflake(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode())
            return null;
        if (node.isNumber())
            return node.asLong();
        String text = node.asText();
        return text.isEmpty() ? null : Long.parseUnsignedLong(text);
    }
}
