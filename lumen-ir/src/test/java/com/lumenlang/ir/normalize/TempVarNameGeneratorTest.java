package com.lumenlang.ir.normalize;

import com.lumenlang.compiler.ast.LocalVar;
import com.lumenlang.compiler.types.Types;
import com.lumenlang.ir.InternalInvariantException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TempVarNameGeneratorTest {

    @Test
    void testFreshTempsAreDistinct() {
        TempVarNameGenerator temps = new TempVarNameGenerator();
        LocalVar a = temps.fresh(Types.INT);
        LocalVar b = temps.fresh(Types.STRING);
        assertTrue(a.isTemp());
        assertNotEquals(a.getId(), b.getId());
        assertNotEquals(a.getName(), b.getName());
        assertTrue(a.getName().startsWith("_hx_t"));
        assertEquals(Types.STRING, b.getType());
        assertEquals(2, temps.getIssuedCount());
    }

    @Test
    void testReservedTempIsSkipped() {
        TempVarNameGenerator temps = new TempVarNameGenerator();
        LocalVar existing = LocalVar.temp(LocalVar.TEMP_ID_BASE + 4, Types.INT);
        temps.reserve(existing);
        LocalVar next = temps.fresh(Types.INT);
        assertTrue(next.getId() > existing.getId());
    }

    @Test
    void testReserveTwiceFails() {
        TempVarNameGenerator temps = new TempVarNameGenerator();
        LocalVar issued = temps.fresh(Types.INT);
        assertThrows(InternalInvariantException.class, () -> temps.reserve(issued));
    }

    @Test
    void testReserveNonTempFails() {
        TempVarNameGenerator temps = new TempVarNameGenerator();
        assertThrows(IllegalArgumentException.class, () -> temps.reserve(LocalVar.of(3, "x", Types.INT)));
    }
}
