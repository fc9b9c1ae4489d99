package com.slashsync.core.model;

import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single argument of a slash command or sub-command.
 * <p>
 * Immutable and validated on construction: every rule the remote service would
 * reject is reported here as a {@link CommandValidationException} instead.
 * Options of type {@link OptionType#SUB_COMMAND} /
 * {@link OptionType#SUB_COMMAND_GROUP} only appear when an option list is
 * rebuilt from a remote representation; locally defined sub-commands are
 * {@code SubCommand} nodes.
 */
@Getter
public final class CommandOption {

    private final OptionType type;
    private final String name;
    private final String description;
    private final Map<String, String> nameLocalizations;
    private final Map<String, String> descriptionLocalizations;
    private final boolean required;
    private final List<OptionChoice> choices;
    private final boolean autocomplete;
    private final Number minValue;
    private final Number maxValue;
    private final Integer minLength;
    private final Integer maxLength;
    private final List<ChannelType> channelTypes;
    private final Object defaultValue;
    private final List<CommandOption> options;

    @Builder
    private CommandOption(OptionType type, String name, String description,
            Map<String, String> nameLocalizations, Map<String, String> descriptionLocalizations,
            Boolean required, List<OptionChoice> choices, boolean autocomplete,
            Number minValue, Number maxValue, Integer minLength, Integer maxLength,
            List<ChannelType> channelTypes, Object defaultValue, List<CommandOption> options) {
        if (type == null) {
            throw new CommandValidationException("An option needs a type");
        }
        this.type = type;
        this.name = CommandValidation.requireChatName(name, "option");
        this.description = CommandValidation.requireDescription(description, "option " + name);
        this.nameLocalizations = Map.copyOf(
                CommandValidation.nameLocalizations(nameLocalizations, "option " + name));
        this.descriptionLocalizations = Map.copyOf(
                CommandValidation.descriptionLocalizations(descriptionLocalizations, "option " + name));

        this.required = Boolean.TRUE.equals(required);
        if (this.required && type.isContainer()) {
            throw new CommandValidationException("Sub-commands and sub-command groups cannot be required: " + name);
        }

        this.choices = choices == null ? List.of() : List.copyOf(choices);
        CommandValidation.requireAtMost(this.choices.size(), CommandValidation.MAX_CHOICES,
                "choices per option (use autocomplete for more)");
        if (!this.choices.isEmpty()) {
            if (!type.supportsChoices()) {
                throw new CommandValidationException(
                        "Only options of type string, integer or number can have choices: " + name);
            }
            this.choices.forEach(c -> requireChoiceValueType(type, c));
        }

        if (autocomplete) {
            if (!type.supportsChoices()) {
                throw new CommandValidationException(
                        "Only options of type string, integer or number can have autocomplete: " + name);
            }
            if (!this.choices.isEmpty()) {
                throw new CommandValidationException("Options with choices cannot have autocomplete: " + name);
            }
        }
        this.autocomplete = autocomplete;

        if ((minValue != null || maxValue != null) && !type.isNumeric()) {
            throw new CommandValidationException(
                    "Only options of type integer or number can have a min_value or max_value: " + name);
        }
        if (minValue != null && maxValue != null && minValue.doubleValue() > maxValue.doubleValue()) {
            throw new CommandValidationException("min_value is greater than max_value for option " + name);
        }
        this.minValue = minValue;
        this.maxValue = maxValue;

        if ((minLength != null || maxLength != null) && type != OptionType.STRING) {
            throw new CommandValidationException(
                    "Only options of type string can have a min_length or max_length: " + name);
        }
        requireLength(minLength, name, "min_length");
        requireLength(maxLength, name, "max_length");
        if (minLength != null && maxLength != null && minLength > maxLength) {
            throw new CommandValidationException("min_length is greater than max_length for option " + name);
        }
        this.minLength = minLength;
        this.maxLength = maxLength;

        List<ChannelType> channels = channelTypes == null ? List.of() : List.copyOf(channelTypes);
        if (!channels.isEmpty() && type != OptionType.CHANNEL) {
            throw new CommandValidationException("Only options of type channel can have channel_types: " + name);
        }
        this.channelTypes = channels;

        this.options = options == null ? List.of() : List.copyOf(options);
        if (!this.options.isEmpty() && !type.isContainer()) {
            throw new CommandValidationException("Only sub-commands and groups can have nested options: " + name);
        }
        if (type == OptionType.SUB_COMMAND_GROUP) {
            if (this.options.isEmpty()) {
                throw new CommandValidationException("A sub-command group needs at least one sub-command: " + name);
            }
            for (CommandOption child : this.options) {
                if (child.getType() != OptionType.SUB_COMMAND) {
                    throw new CommandValidationException(
                            "A sub-command group can only contain sub-commands: " + name);
                }
            }
        }
        if (type == OptionType.SUB_COMMAND) {
            for (CommandOption child : this.options) {
                if (child.getType().isContainer()) {
                    throw new CommandValidationException("A sub-command cannot contain sub-commands: " + name);
                }
            }
        }
        CommandValidation.requireAtMost(this.options.size(), CommandValidation.MAX_OPTIONS, "nested options");
        CommandValidation.requireUniqueNames(this.options.stream().map(CommandOption::getName).toList(),
                "options of " + name);

        this.defaultValue = defaultValue;
    }

    /**
     * Whether a default exists that should be injected when the option is absent.
     */
    public boolean hasDefault() {
        return defaultValue != null && !(defaultValue instanceof String s && s.isEmpty());
    }

    /**
     * Wire representation; {@code required} is only emitted when true and at most
     * one of {@code choices}, {@code autocomplete} or {@code options} is present.
     */
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type.value());
        wire.put("name", name);
        wire.put("name_localizations", nameLocalizations.isEmpty() ? null : new LinkedHashMap<>(nameLocalizations));
        wire.put("description", description);
        wire.put("description_localizations",
                descriptionLocalizations.isEmpty() ? null : new LinkedHashMap<>(descriptionLocalizations));
        if (required) {
            wire.put("required", true);
        }
        if (!choices.isEmpty()) {
            wire.put("choices", choices.stream().map(OptionChoice::toWire).toList());
        } else if (autocomplete) {
            wire.put("autocomplete", true);
        } else if (!options.isEmpty()) {
            wire.put("options", options.stream().map(CommandOption::toWire).toList());
        }
        if (minValue != null)
            wire.put("min_value", minValue);
        if (maxValue != null)
            wire.put("max_value", maxValue);
        if (minLength != null)
            wire.put("min_length", minLength);
        if (maxLength != null)
            wire.put("max_length", maxLength);
        if (!channelTypes.isEmpty()) {
            wire.put("channel_types", channelTypes.stream().map(ChannelType::value).toList());
        }
        return wire;
    }

    /**
     * Rebuild an option from a remote representation.
     */
    @SuppressWarnings("unchecked")
    public static CommandOption fromWire(Map<String, Object> wire) {
        OptionType type = OptionType.fromValue(((Number) wire.get("type")).intValue());
        List<OptionChoice> choices = new ArrayList<>();
        for (Map<String, Object> c : (List<Map<String, Object>>) wire.getOrDefault("choices", List.of())) {
            choices.add(OptionChoice.fromWire(c));
        }
        List<ChannelType> channelTypes = new ArrayList<>();
        for (Object c : (List<Object>) wire.getOrDefault("channel_types", List.of())) {
            channelTypes.add(ChannelType.fromValue(((Number) c).intValue()));
        }
        List<CommandOption> nested = new ArrayList<>();
        for (Map<String, Object> o : (List<Map<String, Object>>) wire.getOrDefault("options", List.of())) {
            nested.add(fromWire(o));
        }
        return CommandOption.builder()
                .type(type)
                .name((String) wire.get("name"))
                .description((String) wire.get("description"))
                .nameLocalizations((Map<String, String>) wire.get("name_localizations"))
                .descriptionLocalizations((Map<String, String>) wire.get("description_localizations"))
                .required(Boolean.TRUE.equals(wire.get("required")))
                .choices(choices)
                .autocomplete(Boolean.TRUE.equals(wire.get("autocomplete")))
                .minValue((Number) wire.get("min_value"))
                .maxValue((Number) wire.get("max_value"))
                .minLength(wire.get("min_length") == null ? null : ((Number) wire.get("min_length")).intValue())
                .maxLength(wire.get("max_length") == null ? null : ((Number) wire.get("max_length")).intValue())
                .channelTypes(channelTypes)
                .options(nested)
                .build();
    }

    @Override
    public String toString() {
        return "CommandOption{type=" + type + ", name=" + name + ", required=" + required + "}";
    }

    private static void requireChoiceValueType(OptionType type, OptionChoice choice) {
        Object value = choice.value();
        boolean ok = switch (type) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte;
            case NUMBER -> value instanceof Number;
            default -> false;
        };
        if (!ok) {
            throw new CommandValidationException(String.format(
                    "The value of choice \"%s\" must match the option type %s", choice.name(), type));
        }
    }

    private static void requireLength(Integer length, String name, String what) {
        if (length != null && (length < 0 || length > CommandValidation.MAX_STRING_LENGTH)) {
            throw new CommandValidationException(String.format(
                    "%s of option %s must be between 0 and %d", what, name, CommandValidation.MAX_STRING_LENGTH));
        }
    }
}
