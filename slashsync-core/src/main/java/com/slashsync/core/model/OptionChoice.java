package com.slashsync.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A fixed choice of a string, integer or number option.
 *
 * @param name              1-100 characters shown to the user
 * @param value             value sent back when the choice is picked
 * @param nameLocalizations localized names, never null
 */
public record OptionChoice(String name, Object value, Map<String, String> nameLocalizations) {

    public OptionChoice {
        if (name == null || name.isEmpty() || name.length() > CommandValidation.MAX_CHOICE_NAME_LENGTH) {
            throw new CommandValidationException(String.format(
                    "The name of a choice must be between 1 and %d characters long, got %d",
                    CommandValidation.MAX_CHOICE_NAME_LENGTH, name == null ? 0 : name.length()));
        }
        if (value == null) {
            value = name;
        }
        if (!(value instanceof String) && !(value instanceof Number)) {
            throw new CommandValidationException(
                    "Choice values must be strings or numbers, got " + value.getClass().getSimpleName());
        }
        nameLocalizations = nameLocalizations == null ? Map.of() : Map.copyOf(nameLocalizations);
    }

    public OptionChoice(String name, Object value) {
        this(name, value, null);
    }

    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("name", name);
        wire.put("value", value);
        if (!nameLocalizations.isEmpty()) {
            wire.put("name_localizations", new LinkedHashMap<>(nameLocalizations));
        }
        return wire;
    }

    @SuppressWarnings("unchecked")
    public static OptionChoice fromWire(Map<String, Object> wire) {
        return new OptionChoice((String) wire.get("name"), wire.get("value"),
                (Map<String, String>) wire.get("name_localizations"));
    }
}
