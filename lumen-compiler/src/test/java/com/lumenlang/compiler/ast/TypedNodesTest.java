package com.lumenlang.compiler.ast;

import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.stmt.BreakStmt;
import com.lumenlang.compiler.types.Types;
import com.lumenlang.compiler.types.VoidType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 节点分类与局部变量测试
 */
class TypedNodesTest {

    private static final SourceLocation LOC = SourceLocation.UNKNOWN;

    @Nested
    @DisplayName("节点分类")
    class ClassificationTests {

        @Test
        @DisplayName("块状表达式与语句")
        void testBlockLikeAndStatement() {
            BlockExpr block = new BlockExpr(LOC, VoidType.INSTANCE, Collections.<TypedNode>emptyList());
            assertTrue(TypedNodes.isBlockLike(block));
            assertFalse(TypedNodes.isStatement(block));
            assertTrue(TypedNodes.isStatement(new BreakStmt(LOC)));
            assertFalse(TypedNodes.isBlockLike(ConstantExpr.ofInt(LOC, 1)));
        }

        @Test
        @DisplayName("null 常量识别穿透括号与元数据")
        void testNullConstant() {
            TypedNode wrapped = new MetaExpr(LOC, ":keep", new ParenExpr(LOC, ConstantExpr.ofNull(LOC)));
            assertTrue(TypedNodes.isNullConstant(wrapped));
            assertFalse(TypedNodes.isNullConstant(ConstantExpr.ofInt(LOC, 0)));
        }

        @Test
        @DisplayName("调用与赋值有副作用")
        void testSideEffects() {
            LocalVar x = LocalVar.of(1, "x", Types.INT);
            LocalRefExpr ref = new LocalRefExpr(LOC, x);
            assertTrue(TypedNodes.isSideEffectFree(
                    new BinaryExpr(LOC, Types.INT, BinaryExpr.BinaryOp.ADD, ref, ConstantExpr.ofInt(LOC, 2))));
            assertFalse(TypedNodes.isSideEffectFree(BinaryExpr.assign(LOC, ref, ConstantExpr.ofInt(LOC, 2))));
            assertFalse(TypedNodes.isSideEffectFree(
                    new CallExpr(LOC, Types.INT, ref, Collections.<TypedNode>emptyList())));
            assertFalse(TypedNodes.isSideEffectFree(
                    new UnaryExpr(LOC, Types.INT, UnaryExpr.UnaryOp.INCREMENT, ref, false)));
        }
    }

    @Nested
    @DisplayName("局部变量")
    class LocalVarTests {

        @Test
        @DisplayName("临时变量名由 id 派生")
        void testTempName() {
            LocalVar t = LocalVar.temp(LocalVar.TEMP_ID_BASE + 3, Types.INT);
            assertEquals("_hx_t3", t.getName());
            assertTrue(t.isTemp());
        }

        @Test
        @DisplayName("前端变量与临时变量的 id 区间不重叠")
        void testIdRanges() {
            assertThrows(IllegalArgumentException.class,
                    () -> LocalVar.of(LocalVar.TEMP_ID_BASE, "x", Types.INT));
            assertThrows(IllegalArgumentException.class, () -> LocalVar.temp(5, Types.INT));
            assertFalse(LocalVar.of(5, "x", Types.INT).isTemp());
        }

        @Test
        @DisplayName("类型路径转为全局标识符")
        void testTypePathIdentifier() {
            assertEquals("pkg_sub_Foo", TypePath.parse("pkg.sub.Foo").toIdentifier());
            assertEquals("Foo", TypePath.parse("Foo").toIdentifier());
        }
    }
}
