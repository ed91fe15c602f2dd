package com.lumenlang.ir.backend;

import com.lumenlang.compiler.ast.LocalVar;
import com.lumenlang.compiler.types.Types;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LuaSyntaxTest {

    @Test
    void testIdentifiers() {
        assertTrue(LuaSyntax.isIdentifier("_value1"));
        assertFalse(LuaSyntax.isIdentifier("1value"));
        assertFalse(LuaSyntax.isIdentifier("my-field"));
        assertFalse(LuaSyntax.isIdentifier("função"));
        assertFalse(LuaSyntax.isIdentifier("repeat"));
        assertFalse(LuaSyntax.isIdentifier(""));
    }

    @Test
    void testLocalNames() {
        assertEquals("_hx_local", LuaSyntax.localName(LocalVar.of(1, "local", Types.INT)));
        assertEquals("count", LuaSyntax.localName(LocalVar.of(2, "count", Types.INT)));
        assertEquals("_hx_u_hx_sw_0", LuaSyntax.localName(LocalVar.of(3, "_hx_sw_0", Types.INT)));
        assertEquals("_hx_uself", LuaSyntax.localName(LocalVar.of(4, "self", Types.INT)));
        assertEquals("_hx_t7", LuaSyntax.localName(LocalVar.temp(LocalVar.TEMP_ID_BASE + 7, Types.INT)));
    }

    @Test
    void testFieldSuffixAndTableKey() {
        assertEquals(".name", LuaSyntax.fieldSuffix("name"));
        assertEquals("[\"end\"]", LuaSyntax.fieldSuffix("end"));
        assertEquals("[\"a b\"]", LuaSyntax.tableKey("a b"));
        assertEquals("ok", LuaSyntax.tableKey("ok"));
    }

    @Test
    void testQuote() {
        assertEquals("\"a\\\"b\\\\c\"", LuaSyntax.quote("a\"b\\c"));
        assertEquals("\"line\\nnext\\t\"", LuaSyntax.quote("line\nnext\t"));
        assertEquals("\"\\0x\"", LuaSyntax.quote("\0x"));
        assertEquals("\"\\0001\"", LuaSyntax.quote("\0" + "1"));
        assertEquals("\"\\027[0m\"", LuaSyntax.quote("\u001b[0m"));
        assertEquals("\"中文\"", LuaSyntax.quote("中文"));
    }

    @Test
    void testFloatLiteral() {
        assertEquals("(0/0)", LuaSyntax.floatLiteral(Double.NaN));
        assertEquals("math.huge", LuaSyntax.floatLiteral(Double.POSITIVE_INFINITY));
        assertEquals("-math.huge", LuaSyntax.floatLiteral(Double.NEGATIVE_INFINITY));
        assertEquals("1.5", LuaSyntax.floatLiteral(1.5));
    }
}
