package com.slashsync.core.dispatch;

import com.slashsync.core.model.OptionType;

import java.util.List;

/**
 * One entry of an interaction's option tree: either a supplied value or a
 * sub-command / group layer with its own nested options.
 *
 * @param name    option name as declared remotely
 * @param type    option type, {@code null} if the payload sent an unknown type
 * @param value   raw value; ids arrive as strings
 * @param focused whether this is the option being typed during autocomplete
 * @param options nested layer for sub-commands and groups, never null
 */
public record InteractionOption(String name, OptionType type, Object value, boolean focused,
        List<InteractionOption> options) {

    public InteractionOption {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static InteractionOption value(String name, OptionType type, Object value) {
        return new InteractionOption(name, type, value, false, List.of());
    }

    public static InteractionOption focused(String name, OptionType type, Object value) {
        return new InteractionOption(name, type, value, true, List.of());
    }

    public static InteractionOption layer(String name, OptionType type, List<InteractionOption> options) {
        return new InteractionOption(name, type, null, false, options);
    }

    public boolean isLayer() {
        return type != null && type.isContainer();
    }
}
