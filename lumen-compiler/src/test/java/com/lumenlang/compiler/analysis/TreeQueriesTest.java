package com.lumenlang.compiler.analysis;

import com.lumenlang.compiler.ast.LocalVar;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.stmt.*;
import com.lumenlang.compiler.types.Types;
import com.lumenlang.compiler.types.VoidType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 树查询测试
 */
class TreeQueriesTest {

    private static final SourceLocation LOC = SourceLocation.UNKNOWN;

    private static BlockExpr block(TypedNode... statements) {
        return new BlockExpr(LOC, VoidType.INSTANCE, Arrays.asList(statements));
    }

    private static WhileStmt loop(TypedNode body) {
        return new WhileStmt(LOC, ConstantExpr.ofBool(LOC, true), body, true);
    }

    private static FunctionExpr lambda(TypedNode body) {
        return new FunctionExpr(LOC, Collections.<FunctionExpr.Param>emptyList(), VoidType.INSTANCE, body);
    }

    @Nested
    @DisplayName("跳转查询")
    class JumpTests {

        @Test
        @DisplayName("直接包含 continue")
        void testDirectContinue() {
            assertTrue(TreeQueries.containsContinue(block(new ContinueStmt(LOC))));
        }

        @Test
        @DisplayName("内层循环的 continue 不属于外层")
        void testNestedLoopContinue() {
            assertFalse(TreeQueries.containsContinue(block(loop(block(new ContinueStmt(LOC))))));
            assertFalse(TreeQueries.containsBreak(block(loop(block(new BreakStmt(LOC))))));
        }

        @Test
        @DisplayName("if 分支中的 break 被找到")
        void testBreakInsideIf() {
            IfExpr ifExpr = new IfExpr(LOC, VoidType.INSTANCE, ConstantExpr.ofBool(LOC, true),
                    new BreakStmt(LOC), null);
            assertTrue(TreeQueries.containsBreak(block(ifExpr)));
        }

        @Test
        @DisplayName("return 查询进入循环但不进入函数字面量")
        void testReturn() {
            assertTrue(TreeQueries.containsReturn(block(loop(new ReturnStmt(LOC, null)))));
            assertFalse(TreeQueries.containsReturn(block(lambda(new ReturnStmt(LOC, null)))));
        }
    }

    @Nested
    @DisplayName("赋值查询")
    class AssignmentTests {

        private final LocalVar x = LocalVar.of(1, "x", Types.INT);
        private final LocalVar y = LocalVar.of(2, "y", Types.INT);

        @Test
        @DisplayName("赋值与自增都算写入")
        void testAssignsVariable() {
            List<TypedNode> assign = Collections.<TypedNode>singletonList(
                    BinaryExpr.assign(LOC, new LocalRefExpr(LOC, x), ConstantExpr.ofInt(LOC, 1)));
            List<TypedNode> inc = Collections.<TypedNode>singletonList(
                    new UnaryExpr(LOC, Types.INT, UnaryExpr.UnaryOp.INCREMENT, new LocalRefExpr(LOC, x), true));
            assertTrue(TreeQueries.assignsVariable(assign, x));
            assertTrue(TreeQueries.assignsVariable(inc, x));
            assertFalse(TreeQueries.assignsVariable(assign, y));
        }

        @Test
        @DisplayName("只读取不算写入")
        void testReadIsNotAssignment() {
            List<TypedNode> read = Collections.<TypedNode>singletonList(
                    new BinaryExpr(LOC, Types.INT, BinaryExpr.BinaryOp.ADD,
                            new LocalRefExpr(LOC, x), ConstantExpr.ofInt(LOC, 1)));
            assertFalse(TreeQueries.assignsVariable(read, x));
        }
    }

    @Nested
    @DisplayName("捕获与调用查询")
    class CaptureTests {

        private final LocalVar x = LocalVar.of(1, "x", Types.INT);
        private final LocalVar y = LocalVar.of(2, "y", Types.INT);

        @Test
        @DisplayName("只收集函数字面量内部引用的变量")
        void testCapturedVariables() {
            TypedNode body = block(
                    new BinaryExpr(LOC, Types.INT, BinaryExpr.BinaryOp.ADD,
                            new LocalRefExpr(LOC, y), ConstantExpr.ofInt(LOC, 1)),
                    lambda(BinaryExpr.assign(LOC, new LocalRefExpr(LOC, x), ConstantExpr.ofInt(LOC, 2))));
            Set<LocalVar> captured = TreeQueries.capturedVariables(body);
            assertTrue(captured.contains(x));
            assertFalse(captured.contains(y));
        }

        @Test
        @DisplayName("调用与 new 算作可能执行任意代码，定义函数字面量不算")
        void testContainsInvocation() {
            CallExpr call = new CallExpr(LOC, Types.INT, new IdentExpr(LOC, "f"),
                    Collections.<TypedNode>emptyList());
            assertTrue(TreeQueries.containsInvocation(Collections.<TypedNode>singletonList(call)));
            assertFalse(TreeQueries.containsInvocation(Collections.<TypedNode>singletonList(lambda(call))));
            assertFalse(TreeQueries.containsInvocation(Collections.<TypedNode>singletonList(
                    BinaryExpr.assign(LOC, new LocalRefExpr(LOC, x), ConstantExpr.ofInt(LOC, 2)))));
        }
    }
}
