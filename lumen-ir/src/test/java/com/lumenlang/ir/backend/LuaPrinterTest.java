package com.lumenlang.ir.backend;

import com.lumenlang.compiler.ast.LocalVar;
import com.lumenlang.compiler.ast.TypePath;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.decl.*;
import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.types.ClassType;
import com.lumenlang.compiler.types.DynamicType;
import com.lumenlang.compiler.types.FunctionType;
import com.lumenlang.compiler.types.Types;
import com.lumenlang.compiler.types.VoidType;
import com.lumenlang.ir.normalize.Normalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.lumenlang.ir.TypedTrees.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Lua 输出测试，输入均为已规范化的树。
 */
class LuaPrinterTest {

    private final LuaPrinter printer = new LuaPrinter();

    private String statements(TypedNode body) {
        return printer.printStatements(body, new EmissionContext(new EmitConfig()));
    }

    private String expression(TypedNode node) {
        return printer.printExpression(node, new EmitConfig());
    }

    private String declaration(Declaration decl) {
        return printer.printDeclaration(decl, new EmitConfig(), BodyLowering.IDENTITY);
    }

    private static String lines(String... lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) sb.append(line).append('\n');
        return sb.toString();
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("数组字面量从 0 开始编号")
        void testArrayLiteral() {
            assertEquals("_hx_tab_array({[0]=1, 2}, 2)", expression(array(i(1), i(2))));
            assertEquals("_hx_tab_array({}, 0)", expression(array()));
        }

        @Test
        @DisplayName("匿名对象带字段表")
        void testObjectLiteral() {
            ObjectLiteralExpr obj = new ObjectLiteralExpr(LOC, DynamicType.INSTANCE, Arrays.asList(
                    new ObjectLiteralExpr.Field("a", i(1)),
                    new ObjectLiteralExpr.Field("b c", b(true))));
            assertEquals("_hx_o({__fields__={a=true,[\"b c\"]=true},a=1,[\"b c\"]=true})", expression(obj));
            assertEquals("_hx_e()", expression(new ObjectLiteralExpr(LOC, DynamicType.INSTANCE,
                    Collections.<ObjectLiteralExpr.Field>emptyList())));
        }

        @Test
        @DisplayName("运算符映射")
        void testOperators() {
            LocalVar x = intVar("x");
            assertEquals("x ~= nil", expression(ne(ref(x), nil())));
            assertEquals("_hx_bit.band(x, 3)",
                    expression(bin(BinaryExpr.BinaryOp.BIT_AND, Types.INT, ref(x), i(3))));
            assertEquals("(x + 1) * 2", expression(mul(add(ref(x), i(1)), i(2))));
            assertEquals("not (x < 1)", expression(not(lt(ref(x), i(1)))));
        }

        @Test
        @DisplayName("字符串拼接对非字符串操作数调用 Std.string")
        void testConcatenation() {
            LocalVar x = intVar("x");
            LocalVar name = var("name", Types.NULLABLE_STRING);
            TypedNode concat = bin(BinaryExpr.BinaryOp.ADD, Types.STRING, s("n="), ref(x));
            assertEquals("\"n=\" .. Std.string(x)", expression(concat));
            TypedNode nullable = bin(BinaryExpr.BinaryOp.ADD, Types.STRING, s("hi "), ref(name));
            assertEquals("\"hi \" .. Std.string(name)", expression(nullable));
        }

        @Test
        @DisplayName("方法调用使用冒号语法")
        void testMethodCall() {
            LocalVar o = var("o", DynamicType.INSTANCE);
            TypedNode call = call(method(ref(o), "push", DynamicType.INSTANCE, FieldAccessKind.INSTANCE),
                    DynamicType.INSTANCE, i(1));
            assertEquals("o:push(1)", expression(call));
        }

        @Test
        @DisplayName("非法字段名使用下标")
        void testFieldNames() {
            LocalVar o = var("o", DynamicType.INSTANCE);
            assertEquals("o[\"my-field\"]", expression(field(ref(o), "my-field", DynamicType.INSTANCE)));
            assertEquals("o.size", expression(field(ref(o), "size", Types.INT)));
        }

        @Test
        @DisplayName("new 与命名空间前缀")
        void testNewWithPrefix() {
            NewExpr node = new NewExpr(LOC, new ClassType(TypePath.parse("demo.Point")),
                    TypePath.parse("demo.Point"), Arrays.<TypedNode>asList(i(1), i(2)));
            assertEquals("demo_Point.new(1, 2)", expression(node));

            EmitConfig config = new EmitConfig();
            config.setNamespacePrefix("pkg_");
            assertEquals("pkg_demo_Point.new(1, 2)", printer.printExpression(node, config));
        }

        @Test
        @DisplayName("与关键字同名的局部变量加前缀")
        void testKeywordLocal() {
            assertEquals("_hx_end", expression(ref(var("end", Types.INT))));
        }

        @Test
        @DisplayName("__lua__ 原样输出")
        void testRawCode() {
            assertEquals("os.time()", expression(intrinsic("__lua__", s("os.time()"))));
        }

        @Test
        @DisplayName("以保留前缀开头的用户变量与 self 被改名，不与临时变量冲突")
        void testReservedPrefixLocal() {
            assertEquals("_hx_u_hx_t0", expression(ref(var("_hx_t0", Types.INT))));
            assertEquals("_hx_uself", expression(ref(var("self", DynamicType.INSTANCE))));

            LocalVar user = var("_hx_t0", Types.INT);
            TypedNode body = new Normalizer().normalize(stmts(
                    decl(user, i(1)),
                    ret(add(ref(user), ifElse(Types.INT, b(true), i(2), i(3))))));
            String out = statements(body);
            assertTrue(out.startsWith("local _hx_u_hx_t0 = 1\nlocal _hx_t0\n"), out);
            assertTrue(out.endsWith("return _hx_u_hx_t0 + _hx_t0\n"), out);
        }

        @Test
        @DisplayName("方法闭包通过 _hx_bind 绑定接收者")
        void testClosureBind() {
            LocalVar o = var("o", DynamicType.INSTANCE);
            assertEquals("_hx_bind(o, o.m)",
                    expression(method(ref(o), "m", DynamicType.INSTANCE, FieldAccessKind.CLOSURE)));
        }

        @Test
        @DisplayName("super 的方法作为值与调用")
        void testSuperMethod() {
            TypedNode sup = ConstantExpr.ofSuper(LOC, new ClassType(TypePath.parse("demo.Base")));
            assertEquals("_hx_bind(self, demo_Base.prototype.m)",
                    inSubclass(method(sup, "m", DynamicType.INSTANCE, FieldAccessKind.CLOSURE)));
            assertEquals("_hx_bind(self, demo_Base.prototype.m)",
                    inSubclass(method(sup, "m", DynamicType.INSTANCE, FieldAccessKind.INSTANCE)));
            assertEquals("demo_Base.prototype.m(self, 1)", inSubclass(call(
                    method(sup, "m", DynamicType.INSTANCE, FieldAccessKind.INSTANCE), DynamicType.INSTANCE, i(1))));
        }

        private String inSubclass(TypedNode node) {
            EmissionContext ctx = new EmissionContext(new EmitConfig());
            ctx.setCurrentClass(TypePath.parse("demo.Child"));
            ctx.setSuperClass(TypePath.parse("demo.Base"));
            ctx.setInstanceContext(true);
            return printer.printExpression(node, ctx);
        }

        @Test
        @DisplayName("__global__、__call__ 与 __reinterpret__")
        void testIntrinsics() {
            LocalVar f = var("f", DynamicType.INSTANCE);
            LocalVar x = intVar("x");
            assertEquals("print(1, \"a\")", expression(intrinsic("__global__", s("print"), i(1), s("a"))));
            assertEquals("f(2)", expression(intrinsic("__call__", ref(f), i(2))));
            assertEquals("x", expression(intrinsic("__reinterpret__", ref(x))));
            // 语句位置的 __reinterpret__ 按其参数处理，纯值被丢弃
            assertEquals("", statements(stmts(intrinsic("__reinterpret__", ref(x)))));
        }

        @Test
        @DisplayName("移位与异或使用位运算库")
        void testShiftAndXor() {
            LocalVar x = intVar("x");
            assertEquals("_hx_bit.lshift(x, 2)",
                    expression(bin(BinaryExpr.BinaryOp.SHL, Types.INT, ref(x), i(2))));
            assertEquals("_hx_bit.arshift(x, 2)",
                    expression(bin(BinaryExpr.BinaryOp.SHR, Types.INT, ref(x), i(2))));
            assertEquals("_hx_bit.rshift(x, 2)",
                    expression(bin(BinaryExpr.BinaryOp.USHR, Types.INT, ref(x), i(2))));
            assertEquals("_hx_bit.bxor(x, 3)",
                    expression(bin(BinaryExpr.BinaryOp.BIT_XOR, Types.INT, ref(x), i(3))));
        }

        @Test
        @DisplayName("值位置的块输出为立即调用的函数")
        void testBlockArgument() {
            LocalVar f = var("f", DynamicType.INSTANCE);
            TypedNode node = call(ref(f), DynamicType.INSTANCE, block(Types.INT, trace(i(1)), i(2)));
            assertEquals("f((function()\n    trace(1)\n    return 2\nend)())", expression(node));
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        private final LocalVar x = intVar("x");

        @Test
        @DisplayName("变量声明、调用与复合赋值")
        void testSimpleStatements() {
            TypedNode body = stmts(decl(x, i(1)), addAssign(ref(x), i(2)), trace(ref(x)), raise(s("boom")));
            assertEquals(lines(
                    "local x = 1",
                    "x = x + 2",
                    "trace(x)",
                    "error(\"boom\", 0)"), statements(body));
        }

        @Test
        @DisplayName("非末尾的 return 包在 do ... end 中")
        void testReturnPosition() {
            assertEquals(lines("do return 1 end", "trace(2)"), statements(stmts(ret(i(1)), trace(i(2)))));
            assertEquals(lines("return 1"), statements(stmts(ret(i(1)))));
        }

        @Test
        @DisplayName("只有 else 分支时条件取反")
        void testIfWithOnlyElse() {
            LocalVar flag = var("flag", Types.BOOL);
            TypedNode body = stmts(ifElse(VoidType.INSTANCE, ref(flag), stmts(), stmts(trace(i(1)))));
            assertEquals(lines("if not flag then", "    trace(1)", "end"), statements(body));
        }

        @Test
        @DisplayName("else 中的 if 合并为 elseif")
        void testElseIfChain() {
            TypedNode body = stmts(ifElse(VoidType.INSTANCE, lt(ref(x), i(1)), stmts(trace(i(1))),
                    ifElse(VoidType.INSTANCE, lt(ref(x), i(2)), stmts(trace(i(2))), stmts(trace(i(3))))));
            assertEquals(lines(
                    "if x < 1 then",
                    "    trace(1)",
                    "elseif x < 2 then",
                    "    trace(2)",
                    "else",
                    "    trace(3)",
                    "end"), statements(body));
        }

        @Test
        @DisplayName("switch 主体不是局部变量时先存入局部变量")
        void testSwitch() {
            TypedNode body = stmts(switchOf(VoidType.INSTANCE, trace(i(1)), stmts(trace(s("d"))),
                    caseOf(stmts(trace(s("a"))), i(1), i(2))));
            assertEquals(lines(
                    "do",
                    "    local _hx_sw_0 = trace(1)",
                    "    if _hx_sw_0 == 1 or _hx_sw_0 == 2 then",
                    "        trace(\"a\")",
                    "    else",
                    "        trace(\"d\")",
                    "    end",
                    "end"), statements(body));
        }

        @Test
        @DisplayName("while 中的 continue 跳到体末尾的标签")
        void testWhileWithContinue() {
            TypedNode body = stmts(whileLoop(lt(ref(x), i(3)), stmts(
                    assign(ref(x), add(ref(x), i(1))),
                    ifElse(VoidType.INSTANCE, eq(ref(x), i(2)), stmts(cont()), null),
                    trace(ref(x)))));
            assertEquals(lines(
                    "while x < 3 do",
                    "    do",
                    "        x = x + 1",
                    "        if x == 2 then",
                    "            goto continue_0",
                    "        end",
                    "        trace(x)",
                    "    end",
                    "    ::continue_0::",
                    "end"), statements(body));
        }

        @Test
        @DisplayName("do-while 输出为 repeat ... until")
        void testRepeat() {
            TypedNode body = stmts(doWhile(lt(ref(x), i(3)), stmts(trace(ref(x)))));
            assertEquals(lines(
                    "repeat",
                    "    do",
                    "        trace(x)",
                    "    end",
                    "until not (x < 3)"), statements(body));
        }

        @Test
        @DisplayName("for 使用迭代器协议")
        void testFor() {
            LocalVar it = var("it", DynamicType.INSTANCE);
            LocalVar v = var("v", DynamicType.INSTANCE);
            TypedNode body = stmts(forEach(v, ref(it), stmts(trace(ref(v)))));
            assertEquals(lines(
                    "do",
                    "    local _hx_it_0 = it",
                    "    while _hx_it_0:hasNext() do",
                    "        local v = _hx_it_0:next()",
                    "        trace(v)",
                    "    end",
                    "end"), statements(body));
        }

        @Test
        @DisplayName("try 中的 break 通过哨兵值传出")
        void testTryWithBreak() {
            LocalVar e = var("e", DynamicType.INSTANCE);
            TypedNode body = stmts(whileLoop(b(true), stmts(
                    tryCatch(VoidType.INSTANCE, stmts(trace(i(1)), brk()), e, stmts(trace(ref(e)))))));
            assertEquals(lines(
                    "while true do",
                    "    local _hx_status, _hx_result = pcall(function()",
                    "        trace(1)",
                    "        do return _hx_pcall_break end",
                    "        return _hx_pcall_default",
                    "    end)",
                    "    if not _hx_status then",
                    "        local e = _hx_result",
                    "        trace(e)",
                    "    elseif _hx_result == _hx_pcall_break then",
                    "        break",
                    "    end",
                    "end"), statements(body));
        }

        @Test
        @DisplayName("try 中的 return 通过结果值传出")
        void testTryWithReturn() {
            LocalVar e = var("e", DynamicType.INSTANCE);
            TypedNode body = stmts(tryCatch(VoidType.INSTANCE, stmts(trace(i(1)), ret(i(1))),
                    e, stmts(trace(ref(e)))));
            assertEquals(lines(
                    "local _hx_status, _hx_result = pcall(function()",
                    "    trace(1)",
                    "    do return 1 end",
                    "    return _hx_pcall_default",
                    "end)",
                    "if not _hx_status then",
                    "    local e = _hx_result",
                    "    trace(e)",
                    "elseif _hx_result ~= _hx_pcall_default then",
                    "    return _hx_result",
                    "end"), statements(body));
        }

        @Test
        @DisplayName("try 中的 continue 通过哨兵值传出后跳到标签")
        void testTryWithContinue() {
            LocalVar e = var("e", DynamicType.INSTANCE);
            TypedNode body = stmts(whileLoop(b(true), stmts(
                    tryCatch(VoidType.INSTANCE, stmts(trace(i(1)), cont()), e, stmts()),
                    trace(i(2)))));
            assertEquals(lines(
                    "while true do",
                    "    do",
                    "        local _hx_status, _hx_result = pcall(function()",
                    "            trace(1)",
                    "            do return _hx_pcall_continue end",
                    "            return _hx_pcall_default",
                    "        end)",
                    "        if not _hx_status then",
                    "            local e = _hx_result",
                    "        elseif _hx_result == _hx_pcall_continue then",
                    "            goto continue_0",
                    "        end",
                    "        trace(2)",
                    "    end",
                    "    ::continue_0::",
                    "end"), statements(body));
        }

        @Test
        @DisplayName("多个线程共用一个输出器时 return 位置互不干扰")
        void testSharedPrinterAcrossThreads() throws Exception {
            TypedNode body = stmts(
                    ifElse(VoidType.INSTANCE, b(true), stmts(ret(i(1)), trace(i(0))), null),
                    ret(i(2)));
            String expected = statements(body);
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<String>> results = new ArrayList<>();
                for (int n = 0; n < 200; n++) {
                    results.add(pool.submit(() -> statements(body)));
                }
                for (Future<String> r : results) {
                    assertEquals(expected, r.get());
                }
            } finally {
                pool.shutdownNow();
            }
            assertEquals(lines(
                    "if true then",
                    "    do return 1 end",
                    "    trace(0)",
                    "end",
                    "return 2"), expected);
        }

        @Test
        @DisplayName("没有 catch 时重新抛出")
        void testTryWithoutCatch() {
            TypedNode body = stmts(tryCatch(VoidType.INSTANCE, stmts(trace(i(1))), null, null));
            assertEquals(lines(
                    "local _hx_status, _hx_result = pcall(function()",
                    "    trace(1)",
                    "end)",
                    "if not _hx_status then",
                    "    error(_hx_result, 0)",
                    "end"), statements(body));
        }

        @Test
        @DisplayName("缩进可配置")
        void testTabIndent() {
            EmitConfig config = new EmitConfig();
            config.setUseSpaces(false);
            String out = printer.printStatements(
                    stmts(whileLoop(b(true), stmts(brk()))), new EmissionContext(config));
            assertEquals(lines("while true do", "\tbreak", "end"), out);
        }
    }

    // ============ 不支持的构造 ============

    @Nested
    @DisplayName("不支持的构造")
    class UnsupportedTests {

        @Test
        @DisplayName("实例上下文之外的 this")
        void testThisOutsideInstance() {
            TypedNode self = ConstantExpr.ofThis(LOC, new ClassType(TypePath.parse("A")));
            assertThrows(UnsupportedConstructException.class, () -> expression(self));
        }

        @Test
        @DisplayName("未解析的标识符")
        void testUnresolvedIdentifier() {
            UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class,
                    () -> expression(new IdentExpr(LOC, "foo")));
            assertTrue(e.getMessage().contains("foo"));
        }

        @Test
        @DisplayName("构造函数之外的 super(...)")
        void testSuperCallOutsideConstructor() {
            TypedNode superCall = call(ConstantExpr.ofSuper(LOC, new ClassType(TypePath.parse("A"))),
                    VoidType.INSTANCE);
            assertThrows(UnsupportedConstructException.class, () -> statements(stmts(superCall)));
        }

        @Test
        @DisplayName("循环之外的 break 与 continue")
        void testJumpOutsideLoop() {
            assertThrows(UnsupportedConstructException.class, () -> statements(stmts(brk())));
            assertThrows(UnsupportedConstructException.class, () -> statements(stmts(cont())));
        }

        @Test
        @DisplayName("try 内的 break 外层没有循环")
        void testBreakInTryWithoutLoop() {
            TypedNode body = stmts(tryCatch(VoidType.INSTANCE, stmts(brk()), null, null));
            assertThrows(UnsupportedConstructException.class, () -> statements(body));
        }

        @Test
        @DisplayName("try 内的 continue 外层没有循环")
        void testContinueInTryWithoutLoop() {
            LocalVar e = var("e", DynamicType.INSTANCE);
            TypedNode body = stmts(tryCatch(VoidType.INSTANCE, stmts(cont()), e, stmts()));
            assertThrows(UnsupportedConstructException.class, () -> statements(body));
        }
    }

    // ============ 声明 ============

    @Nested
    @DisplayName("声明")
    class DeclarationTests {

        private final TypePath point = TypePath.parse("demo.Point");

        private ClassDecl pointClass() {
            LocalVar px = intVar("px");
            TypedNode self = ConstantExpr.ofThis(LOC, new ClassType(point));
            FieldDecl ctor = FieldDecl.method(LOC, "new", fn(VoidType.INSTANCE,
                    stmts(assign(field(self, "x", Types.INT), ref(px))), px));
            FieldDecl x = FieldDecl.var(LOC, "x", Types.INT, i(0));
            FieldDecl getX = FieldDecl.method(LOC, "getX", fn(Types.INT, stmts(ret(field(self, "x", Types.INT)))));
            FieldDecl count = FieldDecl.var(LOC, "count", Types.INT, i(0));
            return new ClassDecl(LOC, point, null, null, ctor, Arrays.asList(x, getX),
                    Collections.singletonList(count), false, false);
        }

        @Test
        @DisplayName("类的完整骨架")
        void testClass() {
            assertEquals(lines(
                    "demo_Point = _hx_e()",
                    "demo_Point.__name__ = \"demo.Point\"",
                    "demo_Point.new = function(px)",
                    "    local self = _hx_new(demo_Point.prototype)",
                    "    demo_Point.super(self, px)",
                    "    return self",
                    "end",
                    "demo_Point.super = function(self, px)",
                    "    self.x = 0",
                    "    self.x = px",
                    "end",
                    "demo_Point.prototype = _hx_e()",
                    "demo_Point.prototype.getX = function(self)",
                    "    return self.x",
                    "end",
                    "demo_Point.prototype.__class__ = demo_Point",
                    "demo_Point.count = 0"), declaration(pointClass()));
        }

        @Test
        @DisplayName("子类链接父类原型")
        void testSubclass() {
            ClassDecl child = new ClassDecl(LOC, TypePath.parse("demo.Child"), point, null, null,
                    null, null, false, false);
            String out = declaration(child);
            assertTrue(out.contains("demo_Child.super = function(self, ...)\n    demo_Point.super(self, ...)\nend\n"));
            assertTrue(out.contains("demo_Child.__super__ = demo_Point\n"));
            assertTrue(out.endsWith("setmetatable(demo_Child.prototype, {__index = demo_Point.prototype})\n"));
        }

        @Test
        @DisplayName("枚举构造器")
        void testEnum() {
            EnumDecl color = new EnumDecl(LOC, TypePath.parse("Color"), Arrays.asList(
                    new EnumConstructor("Red", 0, null),
                    new EnumConstructor("Rgb", 1, Arrays.asList(
                            new FunctionType.Param("r", Types.INT, false),
                            new FunctionType.Param("end", Types.INT, false)))));
            assertEquals(lines(
                    "Color = _hx_e()",
                    "Color.__name__ = \"Color\"",
                    "Color.__constructs__ = _hx_tab_array({[0]=\"Red\", \"Rgb\"}, 2)",
                    "Color.Red = _hx_tab_array({[0]=\"Red\", 0, __enum__=Color}, 2)",
                    "Color.Rgb = function(r, _hx_end)",
                    "    return _hx_tab_array({[0]=\"Rgb\", 1, r, _hx_end, __enum__=Color}, 4)",
                    "end"), declaration(color));
        }

        @Test
        @DisplayName("extern 类与 typedef 不产生输出")
        void testNoOutput() {
            ClassDecl extern = new ClassDecl(LOC, TypePath.parse("Math"), null, null, null,
                    null, null, false, true);
            assertEquals("", declaration(extern));
            assertEquals("", declaration(new TypedefDecl(LOC, TypePath.parse("Alias"), Types.INT)));
        }

        @Test
        @DisplayName("静态方法中使用 this")
        void testThisInStaticMethod() {
            TypedNode self = ConstantExpr.ofThis(LOC, new ClassType(point));
            FieldDecl bad = FieldDecl.method(LOC, "make", fn(DynamicType.INSTANCE, stmts(ret(self))));
            ClassDecl decl = new ClassDecl(LOC, point, null, null, null, null,
                    Collections.singletonList(bad), false, false);
            assertThrows(UnsupportedConstructException.class, () -> declaration(decl));
        }
    }
}
