package com.theoremextractor;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MacroDefinitionJUnitTest {

    @Test
    void instantiate_substitutesOnce() {
        var d = new MacroDefinition("\\swap", 2, "#2/#1");
        assertEquals("b/#1", d.instantiate(List.of("#1", "b")));
    }

    @Test
    void constructor_rejectsBadShapes() {
        assertThrows(IllegalArgumentException.class, () -> new MacroDefinition("foo", 0, ""));
        assertThrows(IllegalArgumentException.class, () -> new MacroDefinition("\\foo", 10, ""));
        assertThrows(IllegalArgumentException.class, () -> new MacroDefinition("\\foo", 0, "", "x"));
    }
}
