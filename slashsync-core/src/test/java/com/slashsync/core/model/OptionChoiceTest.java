package com.slashsync.core.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OptionChoiceTest {

    @Test
    void valueDefaultsToName() {
        assertEquals("Red", new OptionChoice("Red", null).value());
    }

    @Test
    void nameLengthIsBounded() {
        assertNotNull(new OptionChoice("x".repeat(100), "v"));
        assertThrows(CommandValidationException.class, () -> new OptionChoice("x".repeat(101), "v"));
        assertThrows(CommandValidationException.class, () -> new OptionChoice("", "v"));
    }

    @Test
    void valueMustBeStringOrNumber() {
        assertThrows(CommandValidationException.class, () -> new OptionChoice("flag", true));
    }

    @Test
    void wireOmitsEmptyLocalizations() {
        assertEquals(Map.of("name", "Red", "value", "red"), new OptionChoice("Red", "red").toWire());
    }
}
