package com.lumenlang.compiler.analysis;

import com.lumenlang.compiler.ast.LocalVar;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypePath;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.decl.ClassDecl;
import com.lumenlang.compiler.ast.decl.FieldDecl;
import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.stmt.ReturnStmt;
import com.lumenlang.compiler.ast.stmt.VarDeclStmt;
import com.lumenlang.compiler.diagnostics.Diagnostic;
import com.lumenlang.compiler.diagnostics.DiagnosticCollector;
import com.lumenlang.compiler.types.FunctionType;
import com.lumenlang.compiler.types.LumenType;
import com.lumenlang.compiler.types.NullabilityResolver;
import com.lumenlang.compiler.types.Types;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * null 安全检查测试
 */
class NullabilityCheckerTest {

    private static final SourceLocation LOC = new SourceLocation("Test.lm", 3, 7);

    private DiagnosticCollector diagnostics;
    private NullabilityChecker checker;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticCollector();
        checker = new NullabilityChecker(NullabilityResolver.DEFAULT, diagnostics);
    }

    private static ConstantExpr nil() {
        return ConstantExpr.ofNull(LOC);
    }

    private static LocalRefExpr ref(LocalVar v) {
        return new LocalRefExpr(LOC, v);
    }

    // ============ 赋值与初始化 ============

    @Nested
    @DisplayName("赋值与初始化")
    class AssignmentTests {

        @Test
        @DisplayName("null 赋给非空变量报错")
        void testAssignNullToNonNullable() {
            LocalVar x = LocalVar.of(1, "x", Types.INT);
            checker.check(BinaryExpr.assign(LOC, ref(x), nil()), null);

            assertEquals(1, diagnostics.size());
            Diagnostic d = diagnostics.getDiagnostics().get(0);
            assertEquals(Diagnostic.NULL_SAFETY, d.getCode());
            assertTrue(d.isError());
            assertEquals(LOC, d.getLocation());
        }

        @Test
        @DisplayName("null 赋给可空变量不报错")
        void testAssignNullToNullable() {
            LocalVar s = LocalVar.of(1, "s", Types.NULLABLE_STRING);
            checker.check(BinaryExpr.assign(LOC, ref(s), nil()), null);
            assertEquals(0, diagnostics.size());
        }

        @Test
        @DisplayName("括号包裹的 null 也被识别")
        void testParenthesizedNull() {
            LocalVar x = LocalVar.of(1, "x", Types.STRING);
            checker.check(new VarDeclStmt(LOC, x, new ParenExpr(LOC, nil())), null);
            assertEquals(1, diagnostics.size());
        }

        @Test
        @DisplayName("非 null 初始化不报错")
        void testNonNullInitializer() {
            LocalVar x = LocalVar.of(1, "x", Types.INT);
            checker.check(new VarDeclStmt(LOC, x, ConstantExpr.ofInt(LOC, 1)), null);
            assertFalse(diagnostics.hasErrors());
        }
    }

    // ============ 调用与返回 ============

    @Nested
    @DisplayName("调用与返回")
    class CallAndReturnTests {

        @Test
        @DisplayName("null 作为必选参数报错")
        void testNullArgument() {
            LocalVar f = LocalVar.of(9, "f", new FunctionType(
                    Collections.singletonList(new FunctionType.Param("a", Types.INT, false)), Types.INT));
            checker.check(new CallExpr(LOC, Types.INT, ref(f), Collections.<TypedNode>singletonList(nil())), null);
            assertEquals(1, diagnostics.size());
        }

        @Test
        @DisplayName("null 作为可选参数不报错")
        void testNullOptionalArgument() {
            LocalVar f = LocalVar.of(9, "f", new FunctionType(
                    Collections.singletonList(new FunctionType.Param("a", Types.INT, true)), Types.INT));
            checker.check(new CallExpr(LOC, Types.INT, ref(f), Collections.<TypedNode>singletonList(nil())), null);
            assertEquals(0, diagnostics.size());
        }

        @Test
        @DisplayName("内建调用不检查参数")
        void testIntrinsicCallSkipped() {
            checker.check(new CallExpr(LOC, Types.INT, new IdentExpr(LOC, "__lua__"),
                    Collections.<TypedNode>singletonList(nil())), null);
            assertEquals(0, diagnostics.size());
        }

        @Test
        @DisplayName("从非空返回类型的函数返回 null 报错")
        void testReturnNull() {
            FunctionExpr fn = new FunctionExpr(LOC, Collections.<FunctionExpr.Param>emptyList(), Types.INT,
                    new BlockExpr(LOC, Types.INT, Collections.<TypedNode>singletonList(new ReturnStmt(LOC, nil()))));
            checker.check(fn, null);
            assertEquals(1, diagnostics.size());
        }

        @Test
        @DisplayName("嵌套函数使用自己的返回类型")
        void testNestedFunctionReturnType() {
            LumenType nullableInt = Types.INT.withNullable(true);
            FunctionExpr inner = new FunctionExpr(LOC, Collections.<FunctionExpr.Param>emptyList(), nullableInt,
                    new BlockExpr(LOC, nullableInt, Collections.<TypedNode>singletonList(new ReturnStmt(LOC, nil()))));
            checker.check(new BlockExpr(LOC, Types.INT, Collections.<TypedNode>singletonList(inner)), Types.INT);
            assertEquals(0, diagnostics.size());
        }
    }

    // ============ 声明 ============

    @Nested
    @DisplayName("声明")
    class DeclarationTests {

        @Test
        @DisplayName("非空字段初始化为 null 报错")
        void testFieldInitializer() {
            FieldDecl field = FieldDecl.var(LOC, "count", Types.INT, nil());
            ClassDecl cls = new ClassDecl(LOC, TypePath.parse("pkg.Counter"), null, null, null,
                    Collections.singletonList(field), null, false, false);
            checker.checkDeclaration(cls);
            assertEquals(1, diagnostics.size());
            assertTrue(diagnostics.getDiagnostics().get(0).getMessage().contains("count"));
        }

        @Test
        @DisplayName("检查只报告，不修改树")
        void testCheckDoesNotRewrite() {
            LocalVar x = LocalVar.of(1, "x", Types.INT);
            BinaryExpr assign = BinaryExpr.assign(LOC, ref(x), nil());
            TypedNode right = assign.getRight();
            checker.check(assign, null);
            assertSame(right, assign.getRight());
            assertEquals(1, diagnostics.size());
        }
    }
}
