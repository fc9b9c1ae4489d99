package com.slashsync.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WireComparisonTest {

    private static Map<String, Object> option(int type, String name, Object... extra) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type);
        wire.put("name", name);
        wire.put("description", "d");
        for (int i = 0; i < extra.length; i += 2) {
            wire.put((String) extra[i], extra[i + 1]);
        }
        return wire;
    }

    @Test
    void identicalListsMatch() {
        List<Map<String, Object>> options = List.of(option(3, "a"), option(4, "b"));
        assertTrue(WireComparison.optionsMatch(options, options));
        assertTrue(WireComparison.optionsMatch(null, List.of()));
    }

    @Test
    void omittedDefaultsAreEqual() {
        Map<String, Object> local = option(3, "a", "required", false, "name_localizations", null);
        Map<String, Object> remote = option(3, "a", "autocomplete", false);
        assertTrue(WireComparison.optionsMatch(List.of(local), List.of(remote)));
    }

    @Test
    void differentScalarsDoNotMatch() {
        assertFalse(WireComparison.optionsMatch(
                List.of(option(3, "a", "required", true)), List.of(option(3, "a"))));
        assertFalse(WireComparison.optionsMatch(List.of(option(3, "a")), List.of(option(4, "a"))));
        assertFalse(WireComparison.optionsMatch(List.of(option(3, "a")), List.of(option(3, "a"), option(3, "b"))));
        assertFalse(WireComparison.optionsMatch(
                List.of(option(4, "n", "max_value", 5)), List.of(option(4, "n", "max_value", 6))));
    }

    @Test
    void numbersOfDifferentBoxTypesAreEqual() {
        assertTrue(WireComparison.optionsMatch(
                List.of(option(10, "n", "min_value", 1)), List.of(option(10, "n", "min_value", 1.0))));
    }

    @Test
    void reorderedScalarOptionsDoNotMatch() {
        assertFalse(WireComparison.optionsMatch(
                List.of(option(3, "a"), option(3, "b")), List.of(option(3, "b"), option(3, "a"))));
    }

    @Test
    void reorderedSubCommandsMatchByName() {
        Map<String, Object> first = option(1, "first", "options", List.of(option(3, "x")));
        Map<String, Object> second = option(1, "second", "options", List.of(option(5, "y")));
        assertTrue(WireComparison.optionsMatch(List.of(first, second), List.of(second, first)));
    }

    @Test
    void nestedDifferencesAreFound() {
        Map<String, Object> local = option(2, "group", "options",
                List.of(option(1, "sub", "options", List.of(option(3, "x")))));
        Map<String, Object> remote = option(2, "group", "options",
                List.of(option(1, "sub", "options", List.of(option(3, "x", "required", true)))));
        assertFalse(WireComparison.optionsMatch(List.of(local), List.of(remote)));
    }

    @Test
    void channelTypesCompareUnordered() {
        assertTrue(WireComparison.optionsMatch(
                List.of(option(7, "c", "channel_types", List.of(0, 2))),
                List.of(option(7, "c", "channel_types", new ArrayList<>(List.of(2, 0))))));
    }

    @Test
    void choicesCompareInOrder() {
        List<Map<String, Object>> ab = List.of(Map.of("name", "A", "value", "a"), Map.of("name", "B", "value", "b"));
        List<Map<String, Object>> ba = List.of(ab.get(1), ab.get(0));
        assertTrue(WireComparison.optionsMatch(List.of(option(3, "c", "choices", ab)),
                List.of(option(3, "c", "choices", ab))));
        assertFalse(WireComparison.optionsMatch(List.of(option(3, "c", "choices", ab)),
                List.of(option(3, "c", "choices", ba))));
    }

    @Test
    void localizationsTreatNullAsEmpty() {
        assertTrue(WireComparison.localizationsMatch(null, Map.of()));
        assertFalse(WireComparison.localizationsMatch(Map.of("de", "x"), null));
    }
}
