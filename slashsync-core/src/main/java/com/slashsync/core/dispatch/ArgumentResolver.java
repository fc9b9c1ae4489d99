package com.slashsync.core.dispatch;

import com.slashsync.core.model.CommandOption;
import com.slashsync.core.model.CommandType;
import com.slashsync.core.model.OptionType;
import com.slashsync.core.node.InvocableCommand;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the supplied options of an interaction into handler arguments.
 * <p>
 * Entity options are looked up in the interaction's resolved data and fall
 * back to the raw id string when the platform did not hydrate them. Declared
 * options that were not supplied but carry a default get that default.
 */
@Slf4j
public class ArgumentResolver {

    /**
     * Characters that may surround an id in mention syntax ({@code <@!123>}, {@code <@&123>}, {@code <#123>}).
     */
    private static final String MENTION_CHARACTERS = "<>!@&#";

    public BoundArguments resolve(InvocableCommand target, List<InteractionOption> supplied, ResolvedData resolved) {
        Map<String, String> parameterByOption = new HashMap<>();
        target.getConnector().forEach((parameter, option) -> parameterByOption.put(option, parameter));
        Map<String, CommandOption> declared = new LinkedHashMap<>();
        target.getOptions().forEach(option -> declared.put(option.getName(), option));

        Map<String, Object> values = new LinkedHashMap<>();
        String focused = null;
        for (InteractionOption option : supplied) {
            String parameter = parameterByOption.getOrDefault(option.name(), option.name());
            OptionType type = option.type();
            CommandOption declaration = declared.get(option.name());
            if (declaration == null) {
                log.debug("Option {} of {} is not declared locally", option.name(), target.asNode().getQualifiedName());
            } else if (type == null) {
                type = declaration.getType();
            }
            // a focused value is whatever the user typed so far
            Object value = option.focused() ? option.value() : resolveValue(type, option.value(), resolved);
            values.put(parameter, value);
            if (option.focused()) {
                focused = parameter;
            }
        }

        for (CommandOption option : declared.values()) {
            String parameter = parameterByOption.getOrDefault(option.getName(), option.getName());
            if (!values.containsKey(parameter) && option.hasDefault()) {
                values.put(parameter, option.getDefaultValue());
            }
        }
        return new BoundArguments(values, focused, null);
    }

    /**
     * Arguments of a context menu command: none, plus the target entity.
     */
    public BoundArguments resolveTarget(CommandType type, Long targetId, ResolvedData resolved) {
        if (targetId == null)
            return BoundArguments.empty();
        Object target = switch (type) {
            case USER -> firstNonNull(resolved.member(targetId), resolved.user(targetId));
            case MESSAGE -> resolved.message(targetId);
            default -> null;
        };
        return new BoundArguments(Map.of(), null, target == null ? targetId : target);
    }

    Object resolveValue(OptionType type, Object raw, ResolvedData resolved) {
        if (type == null || raw == null)
            return raw;
        return switch (type) {
            case USER -> resolveUser(raw, resolved);
            case ROLE -> lookup(raw, resolved.getRoles());
            case CHANNEL -> lookup(raw, resolved.getChannels());
            case ATTACHMENT -> lookup(raw, resolved.getAttachments());
            case MENTIONABLE -> raw.toString().contains("&")
                    ? lookup(raw, resolved.getRoles())
                    : resolveUser(raw, resolved);
            default -> raw;
        };
    }

    private Object resolveUser(Object raw, ResolvedData resolved) {
        Long id = filterId(raw);
        if (id == null)
            return raw;
        Object found = firstNonNull(resolved.member(id), resolved.user(id));
        return found == null ? raw : found;
    }

    private Object lookup(Object raw, Map<Long, Object> entities) {
        Long id = filterId(raw);
        if (id == null)
            return raw;
        Object found = entities.get(id);
        return found == null ? raw : found;
    }

    /**
     * Strip mention syntax and parse the id; {@code null} if it is not numeric.
     */
    static Long filterId(Object raw) {
        if (raw instanceof Number n)
            return n.longValue();
        StringBuilder digits = new StringBuilder();
        for (char c : raw.toString().trim().toCharArray()) {
            if (MENTION_CHARACTERS.indexOf(c) < 0) {
                digits.append(c);
            }
        }
        try {
            return Long.parseLong(digits.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Object firstNonNull(Object first, Object second) {
        return first != null ? first : second;
    }
}
