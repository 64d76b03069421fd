package com.raditha.twx.classify;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VariableAliasTableTest {

    @Test
    void testDefaultHelpers() {
        VariableAliasTable table = new VariableAliasTable();

        assertTrue(table.isHelper("clsx"));
        assertTrue(table.isHelper("twMerge"));
        assertFalse(table.isHelper("console"));
        assertFalse(table.isHelper(null));
    }

    @Test
    void testCustomHelpersReplaceDefaults() {
        VariableAliasTable table = new VariableAliasTable(List.of("styles"));

        assertTrue(table.isHelper("styles"));
        assertFalse(table.isHelper("clsx"));
        // an empty list falls back to the defaults
        assertTrue(new VariableAliasTable(List.of()).isHelper("clsx"));
    }

    @Test
    void testMarkIsMonotonic() {
        VariableAliasTable table = new VariableAliasTable();
        assertFalse(table.isClassBearing("base"));

        table.mark("base");
        table.mark(null);
        assertTrue(table.isClassBearing("base"));
        assertFalse(table.isClassBearing(null));
    }

    @Test
    void testClassishNames() {
        assertTrue(VariableAliasTable.isClassishName("className"));
        assertTrue(VariableAliasTable.isClassishName("buttonClasses"));
        assertTrue(VariableAliasTable.isClassishName("activeClass"));
        assertTrue(VariableAliasTable.isClassishName("headerClassName"));
        assertFalse(VariableAliasTable.isClassishName("classification"));
        assertFalse(VariableAliasTable.isClassishName(""));
    }
}
