package com.lumenlang.ir.backend;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmitConfigTest {

    @Test
    void testDefaults() {
        EmitConfig config = new EmitConfig();
        assertEquals(4, config.getIndentSize());
        assertEquals("    ", config.getIndentString());
        assertEquals("", config.getNamespacePrefix());
        assertTrue(config.isVerifyNormalizedForm());
        assertTrue(config.isFoldNullComparisons());
    }

    @Test
    void testFromJsonKeepsMissingDefaults() {
        EmitConfig config = EmitConfig.fromJson("{\"indentSize\": 2, \"namespacePrefix\": \"app_\"}");
        assertEquals(2, config.getIndentSize());
        assertEquals("  ", config.getIndentString());
        assertEquals("app_", config.getNamespacePrefix());
        assertTrue(config.isUseSpaces());
        assertTrue(config.isFoldNullComparisons());
    }

    @Test
    void testFromJsonTabs() {
        EmitConfig config = EmitConfig.fromJson("{\"useSpaces\": false, \"foldNullComparisons\": false}");
        assertEquals("\t", config.getIndentString());
        assertFalse(config.isFoldNullComparisons());
    }

    @Test
    void testFromJsonEmpty() {
        assertEquals(4, EmitConfig.fromJson("").getIndentSize());
        assertEquals(4, EmitConfig.fromJson(null).getIndentSize());
        assertEquals("", EmitConfig.fromJson("{\"namespacePrefix\": null}").getNamespacePrefix());
    }

    @Test
    void testFromJsonInvalid() {
        assertThrows(IllegalArgumentException.class, () -> EmitConfig.fromJson("{\"indentSize\": -1}"));
        assertThrows(IllegalArgumentException.class, () -> EmitConfig.fromJson("{indentSize: "));
        assertThrows(IllegalArgumentException.class, () -> EmitConfig.fromJson("{\"indentSize\": \"wide\"}"));
    }
}
