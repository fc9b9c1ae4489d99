package com.slashsync.core.model;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Naming and size rules shared by options and command nodes.
 */
public final class CommandValidation {

    private CommandValidation() {
    }

    public static final int MAX_NAME_LENGTH = 32;
    public static final int MAX_DESCRIPTION_LENGTH = 100;
    public static final int MAX_CHOICE_NAME_LENGTH = 100;
    public static final int MAX_CHOICES = 25;
    public static final int MAX_OPTIONS = 25;
    public static final int MAX_CHILDREN = 25;
    public static final int MAX_STRING_LENGTH = 6000;

    private static final Pattern CHAT_NAME = Pattern.compile("^[-_\\p{L}\\p{N}]{1,32}$");

    /** Locales accepted in name/description localization maps. */
    public static final Set<String> SUPPORTED_LOCALES = Set.of(
            "id", "da", "de", "en-GB", "en-US", "es-ES", "es-419", "fr", "hr", "it",
            "lt", "hu", "nl", "no", "pl", "pt-BR", "ro", "fi", "sv-SE", "vi",
            "tr", "cs", "el", "bg", "ru", "uk", "hi", "th", "zh-CN", "ja",
            "zh-TW", "ko");

    /**
     * Validate a slash command, sub-command, group or option name: 1-32
     * characters, lowercase, letters/digits/{@code -}/{@code _} only.
     */
    public static String requireChatName(String name, String what) {
        if (name == null || !CHAT_NAME.matcher(name).matches()) {
            throw new CommandValidationException(String.format(
                    "The name of the %s has to be 1-%d characters long and only contain letters, digits, _ and -. Got \"%s\"",
                    what, MAX_NAME_LENGTH, name));
        }
        if (!name.equals(name.toLowerCase(Locale.ROOT))) {
            throw new CommandValidationException(String.format(
                    "The name of the %s must be lowercase. Got \"%s\"", what, name));
        }
        return name;
    }

    /**
     * Validate a user/message command name: 1-32 characters, free text.
     */
    public static String requireContextMenuName(String name, String what) {
        if (name == null || name.isBlank() || name.length() > MAX_NAME_LENGTH) {
            throw new CommandValidationException(String.format(
                    "The name of the %s has to be 1-%d characters long. Got \"%s\"",
                    what, MAX_NAME_LENGTH, name));
        }
        return name;
    }

    public static String requireDescription(String description, String what) {
        if (description == null || description.isEmpty() || description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new CommandValidationException(String.format(
                    "The description of the %s must be 1-%d characters long, got %d",
                    what, MAX_DESCRIPTION_LENGTH, description == null ? 0 : description.length()));
        }
        return description;
    }

    /**
     * Validate and copy a name localization map. Returns an empty map for null.
     */
    public static Map<String, String> nameLocalizations(Map<String, String> localizations, String what) {
        Map<String, String> copy = copyLocalizations(localizations, what);
        copy.values().forEach(v -> requireChatName(v, what + " (localized)"));
        return copy;
    }

    /**
     * Validate and copy a context-menu name localization map.
     */
    public static Map<String, String> contextMenuNameLocalizations(Map<String, String> localizations, String what) {
        Map<String, String> copy = copyLocalizations(localizations, what);
        copy.values().forEach(v -> requireContextMenuName(v, what + " (localized)"));
        return copy;
    }

    public static Map<String, String> descriptionLocalizations(Map<String, String> localizations, String what) {
        Map<String, String> copy = copyLocalizations(localizations, what);
        copy.values().forEach(v -> requireDescription(v, what + " (localized)"));
        return copy;
    }

    /**
     * Ensure no two entries share a name.
     */
    public static void requireUniqueNames(Collection<String> names, String what) {
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                throw new CommandValidationException(String.format(
                        "Duplicate name \"%s\" in %s", name, what));
            }
        }
    }

    public static void requireAtMost(int count, int max, String what) {
        if (count > max) {
            throw new CommandValidationException(String.format(
                    "The maximum of %s is %d, got %d", what, max, count));
        }
    }

    /**
     * Validate the option list of an invocable leaf: at most 25 scalar options,
     * unique names, required options before optional ones.
     */
    public static List<CommandOption> requireLeafOptions(List<CommandOption> options, String what) {
        List<CommandOption> copy = options == null ? List.of() : List.copyOf(options);
        requireAtMost(copy.size(), MAX_OPTIONS, "options per " + what);
        requireUniqueNames(copy.stream().map(CommandOption::getName).toList(), "options of " + what);
        boolean seenOptional = false;
        for (CommandOption option : copy) {
            if (option.getType().isContainer()) {
                throw new CommandValidationException(
                        "Sub-commands must be added as nodes, not as options of " + what);
            }
            if (!option.isRequired()) {
                seenOptional = true;
            } else if (seenOptional) {
                throw new CommandValidationException(String.format(
                        "Required option \"%s\" of %s must be listed before optional ones",
                        option.getName(), what));
            }
        }
        return copy;
    }

    /**
     * Validate a parameter-name to option-name connector against the declared
     * options.
     */
    public static Map<String, String> requireConnector(Map<String, String> connector,
            List<CommandOption> options, String what) {
        if (connector == null || connector.isEmpty())
            return Map.of();
        Set<String> optionNames = new HashSet<>();
        options.forEach(o -> optionNames.add(o.getName()));
        Set<String> targets = new HashSet<>();
        for (var entry : connector.entrySet()) {
            if (!optionNames.contains(entry.getValue())) {
                throw new CommandValidationException(String.format(
                        "Connector of %s maps \"%s\" to unknown option \"%s\"",
                        what, entry.getKey(), entry.getValue()));
            }
            if (!targets.add(entry.getValue())) {
                throw new CommandValidationException(String.format(
                        "Connector of %s maps more than one parameter to option \"%s\"", what, entry.getValue()));
            }
        }
        return Map.copyOf(connector);
    }

    private static Map<String, String> copyLocalizations(Map<String, String> localizations, String what) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (localizations == null)
            return copy;
        for (var entry : localizations.entrySet()) {
            if (!SUPPORTED_LOCALES.contains(entry.getKey())) {
                throw new CommandValidationException(String.format(
                        "Unsupported locale \"%s\" in localizations of the %s", entry.getKey(), what));
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        return copy;
    }
}
