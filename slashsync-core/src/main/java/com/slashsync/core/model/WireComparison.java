package com.slashsync.core.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural comparison between a locally produced wire map and the
 * representation returned by the remote service.
 * <p>
 * The remote adds fields ({@code id}, {@code version}, {@code application_id})
 * and omits defaults ({@code required=false}, {@code autocomplete=false}, empty
 * localization maps); neither counts as a difference. Scalar options are
 * compared by slot, sub-commands and sub-command groups by name only.
 */
public final class WireComparison {

    private WireComparison() {
    }

    private static final String[] OPTION_SCALAR_KEYS = {
            "name", "type", "description", "min_value", "max_value", "min_length", "max_length" };

    /**
     * Compare two option lists (one level of a command tree).
     */
    public static boolean optionsMatch(List<Map<String, Object>> local, List<Map<String, Object>> remote) {
        List<Map<String, Object>> mine = local == null ? List.of() : local;
        List<Map<String, Object>> theirs = remote == null ? List.of() : remote;
        if (mine.isEmpty() && theirs.isEmpty())
            return true;
        if (mine.size() != theirs.size())
            return false;

        for (int index = 0; index < theirs.size(); index++) {
            Map<String, Object> remoteOption = theirs.get(index);
            int localIndex = indexOfName(mine, remoteOption.get("name"));
            if (localIndex < 0)
                return false;
            if (localIndex != index && !isContainer(remoteOption))
                return false;
        }

        for (int index = 0; index < mine.size(); index++) {
            Map<String, Object> localOption = mine.get(index);
            int remoteIndex = indexOfName(theirs, localOption.get("name"));
            if (remoteIndex < 0)
                return false;
            Map<String, Object> remoteOption = theirs.get(remoteIndex);
            if (remoteIndex != index && !isContainer(remoteOption))
                return false;
            if (isContainer(localOption)
                    && !optionsMatch(optionList(localOption), optionList(remoteOption))) {
                return false;
            }
            if (!optionFieldsMatch(localOption, remoteOption))
                return false;
        }
        return true;
    }

    static boolean optionFieldsMatch(Map<String, Object> local, Map<String, Object> remote) {
        for (String key : OPTION_SCALAR_KEYS) {
            if (!sameValue(local.get(key), remote.get(key)))
                return false;
        }
        if (flag(local, "required") != flag(remote, "required"))
            return false;
        if (flag(local, "autocomplete") != flag(remote, "autocomplete"))
            return false;
        if (!sortedNumbers(local.get("channel_types")).equals(sortedNumbers(remote.get("channel_types"))))
            return false;
        if (!choicesMatch(local.get("choices"), remote.get("choices")))
            return false;
        return localizationsMatch(local.get("name_localizations"), remote.get("name_localizations"))
                && localizationsMatch(local.get("description_localizations"),
                        remote.get("description_localizations"));
    }

    /**
     * Null, absent and empty localization maps are equivalent.
     */
    public static boolean localizationsMatch(Object local, Object remote) {
        Map<?, ?> a = local instanceof Map<?, ?> m ? m : Map.of();
        Map<?, ?> b = remote instanceof Map<?, ?> m ? m : Map.of();
        return a.equals(b);
    }

    /**
     * Value equality that treats numbers of different boxed types (1, 1L, 1.0)
     * as equal.
     */
    public static boolean sameValue(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString())) == 0;
        }
        return Objects.equals(a, b);
    }

    /**
     * Read a boolean flag, treating an absent key as {@code false}.
     */
    public static boolean flag(Map<String, Object> wire, String key) {
        return Boolean.TRUE.equals(wire.get(key));
    }

    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> optionList(Map<String, Object> wire) {
        Object options = wire.get("options");
        return options instanceof List<?> list ? (List<Map<String, Object>>) list : List.of();
    }

    @SuppressWarnings("unchecked")
    private static boolean choicesMatch(Object local, Object remote) {
        List<Map<String, Object>> a = local instanceof List<?> l ? (List<Map<String, Object>>) l : List.of();
        List<Map<String, Object>> b = remote instanceof List<?> l ? (List<Map<String, Object>>) l : List.of();
        if (a.size() != b.size())
            return false;
        for (int i = 0; i < a.size(); i++) {
            Map<String, Object> x = a.get(i);
            Map<String, Object> y = b.get(i);
            if (!Objects.equals(x.get("name"), y.get("name")) || !sameValue(x.get("value"), y.get("value"))
                    || !localizationsMatch(x.get("name_localizations"), y.get("name_localizations"))) {
                return false;
            }
        }
        return true;
    }

    private static List<Integer> sortedNumbers(Object value) {
        List<Integer> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object o : list) {
                result.add(((Number) o).intValue());
            }
        }
        result.sort(null);
        return result;
    }

    private static boolean isContainer(Map<String, Object> option) {
        Object type = option.get("type");
        if (!(type instanceof Number n))
            return false;
        OptionType resolved = OptionType.fromValue(n.intValue());
        return resolved != null && resolved.isContainer();
    }

    private static int indexOfName(List<Map<String, Object>> options, Object name) {
        for (int i = 0; i < options.size(); i++) {
            if (Objects.equals(options.get(i).get("name"), name))
                return i;
        }
        return -1;
    }
}
