package com.lumenlang.ir.backend;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypePath;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.decl.*;
import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.types.ClassType;
import com.lumenlang.compiler.types.FunctionType;
import com.lumenlang.compiler.types.VoidType;
import com.lumenlang.ir.InternalInvariantException;

import java.util.ArrayList;
import java.util.List;

/**
 * 顶层声明的 Lua 骨架：类表、构造函数、静态成员、原型与继承关系，以及枚举构造器。
 */
final class LuaDeclarationPrinter implements DeclarationVisitor<Void, EmissionContext> {

    private final LuaExpressionPrinter expressions;
    private final LuaStatementPrinter statements;
    private final BodyLowering lowering;

    LuaDeclarationPrinter(LuaExpressionPrinter expressions, LuaStatementPrinter statements, BodyLowering lowering) {
        this.expressions = expressions;
        this.statements = statements;
        this.lowering = lowering != null ? lowering : BodyLowering.IDENTITY;
    }

    // ============ 类 ============

    @Override
    public Void visitClass(ClassDecl decl, EmissionContext ctx) {
        if (decl.isExtern()) return null;

        String name = ctx.typeName(decl.getPath());
        ctx.setCurrentClass(decl.getPath());
        ctx.setSuperClass(decl.getSuperClass());

        ctx.line(name + " = " + LuaRuntime.EMPTY + "()");
        ctx.line(name + ".__name__ = " + LuaSyntax.quote(decl.getPath().toString()));
        if (decl.isInterface()) {
            ctx.line(name + ".prototype = " + LuaRuntime.EMPTY + "()");
            return null;
        }
        if (!decl.getInterfaces().isEmpty()) {
            List<String> names = new ArrayList<>();
            for (TypePath i : decl.getInterfaces()) names.add(ctx.typeName(i));
            ctx.line(name + ".__interfaces__ = {" + String.join(", ", names) + "}");
        }

        printConstructor(decl, name, ctx);

        for (FieldDecl f : decl.getStaticFields()) {
            if (f.isMethod()) printMethod(name, f, false, ctx);
        }

        ctx.line(name + ".prototype = " + LuaRuntime.EMPTY + "()");
        for (FieldDecl f : decl.getFields()) {
            if (f.isMethod()) printMethod(name + ".prototype", f, true, ctx);
        }
        ctx.line(name + ".prototype.__class__ = " + name);

        if (decl.hasSuperClass()) {
            String sup = ctx.typeName(decl.getSuperClass());
            ctx.line(name + ".__super__ = " + sup);
            ctx.line("setmetatable(" + name + ".prototype, {__index = " + sup + ".prototype})");
        }

        // 静态变量在所有方法就绪后初始化
        for (FieldDecl f : decl.getStaticFields()) {
            if (!f.isMethod() && f.getExpression() != null) {
                FieldAccessExpr target = new FieldAccessExpr(f.getLocation(), f.getType(),
                        new TypeRefExpr(f.getLocation(), decl.getPath()), f.toRef(), FieldAccessKind.STATIC);
                printLowered(BinaryExpr.assign(f.getLocation(), target, f.getExpression()), ctx);
            }
        }
        return null;
    }

    private void printMethod(String owner, FieldDecl f, boolean instance, EmissionContext ctx) {
        FunctionExpr fn = lowerFunction(f.getExpression(), f);
        boolean saved = ctx.isInstanceContext();
        ctx.setInstanceContext(instance);
        try {
            ctx.append(owner + LuaSyntax.fieldSuffix(f.getTargetName()) + " = ");
            expressions.printFunction(fn, ctx, instance);
            ctx.newLine();
        } finally {
            ctx.setInstanceContext(saved);
        }
    }

    private FunctionExpr lowerFunction(TypedNode expression, FieldDecl f) {
        if (!(expression instanceof FunctionExpr)) {
            throw new InternalInvariantException("Method '" + f.getName() + "' has no function body", f.getLocation());
        }
        TypedNode lowered = lowering.lower(expression);
        if (!(lowered instanceof FunctionExpr)) {
            throw new InternalInvariantException("Lowering changed the shape of method '" + f.getName() + "'",
                    f.getLocation());
        }
        return (FunctionExpr) lowered;
    }

    /**
     * new 负责分配与返回 self；super 执行字段初始化与构造函数体，供子类复用。
     */
    private void printConstructor(ClassDecl decl, String name, EmissionContext ctx) {
        List<FieldDecl> initialized = new ArrayList<>();
        for (FieldDecl f : decl.getFields()) {
            if (!f.isMethod() && f.getExpression() != null) initialized.add(f);
        }
        FieldDecl ctor = decl.getConstructor();
        if (ctor == null && initialized.isEmpty() && !decl.hasSuperClass()) return;

        FunctionExpr fn = ctor != null ? lowerFunction(ctor.getExpression(), ctor) : null;
        String params = fn != null ? paramList(fn) : "...";

        ctx.line(name + ".new = function(" + params + ")");
        ctx.indent();
        ctx.line("local self = " + LuaRuntime.NEW + "(" + name + ".prototype)");
        ctx.line(name + ".super(self" + (params.isEmpty() ? "" : ", " + params) + ")");
        ctx.line("return self");
        ctx.dedent();
        ctx.line("end");

        ctx.line(name + ".super = function(self" + (params.isEmpty() ? "" : ", " + params) + ")");
        ctx.indent();
        boolean savedInstance = ctx.isInstanceContext();
        ctx.setInstanceContext(true);
        ctx.setInConstructor(true);
        ctx.pushFrame(ControlFrame.function());
        try {
            if (fn != null) expressions.printDefaults(fn, ctx);
            for (FieldDecl f : initialized) {
                SourceLocation loc = f.getLocation();
                FieldAccessExpr target = new FieldAccessExpr(loc, f.getType(),
                        ConstantExpr.ofThis(loc, new ClassType(decl.getPath())), f.toRef(), FieldAccessKind.INSTANCE);
                printLowered(BinaryExpr.assign(loc, target, f.getExpression()), ctx);
            }
            if (fn != null) {
                statements.printFunctionBody(fn.getBody(), VoidType.INSTANCE, ctx);
            } else if (decl.hasSuperClass()) {
                ctx.line(ctx.typeName(decl.getSuperClass()) + ".super(self, ...)");
            }
        } finally {
            ctx.popFrame();
            ctx.setInConstructor(false);
            ctx.setInstanceContext(savedInstance);
        }
        ctx.dedent();
        ctx.line("end");
    }

    private static String paramList(FunctionExpr fn) {
        List<String> names = new ArrayList<>();
        for (FunctionExpr.Param p : fn.getParams()) names.add(LuaSyntax.localName(p.getVariable()));
        return String.join(", ", names);
    }

    /**
     * 变换并输出一条初始化语句；多条语句时包在 do ... end 中。
     */
    private void printLowered(TypedNode statement, EmissionContext ctx) {
        TypedNode lowered = lowering.lower(statement);
        statements.printStatement(lowered, ctx, false);
    }

    // ============ 枚举 ============

    @Override
    public Void visitEnum(EnumDecl decl, EmissionContext ctx) {
        String name = ctx.typeName(decl.getPath());
        List<EnumConstructor> ctors = decl.getConstructors();

        ctx.line(name + " = " + LuaRuntime.EMPTY + "()");
        ctx.line(name + ".__name__ = " + LuaSyntax.quote(decl.getPath().toString()));
        if (ctors.isEmpty()) {
            ctx.line(name + ".__constructs__ = " + LuaRuntime.TAB_ARRAY + "({}, 0)");
            return null;
        }
        List<String> quoted = new ArrayList<>();
        for (EnumConstructor c : ctors) quoted.add(LuaSyntax.quote(c.getName()));
        ctx.line(name + ".__constructs__ = " + LuaRuntime.TAB_ARRAY + "({[0]=" + String.join(", ", quoted)
                + "}, " + ctors.size() + ")");

        for (EnumConstructor c : ctors) {
            String member = name + LuaSyntax.fieldSuffix(c.getName());
            if (!c.hasParams()) {
                ctx.line(member + " = " + enumValue(name, c, new ArrayList<String>()));
                continue;
            }
            List<String> params = new ArrayList<>();
            for (FunctionType.Param p : c.getParams()) {
                params.add(LuaSyntax.isKeyword(p.getName()) ? "_hx_" + p.getName() : p.getName());
            }
            ctx.line(member + " = function(" + String.join(", ", params) + ")");
            ctx.indent();
            ctx.line("return " + enumValue(name, c, params));
            ctx.dedent();
            ctx.line("end");
        }
        return null;
    }

    /**
     * 枚举值布局：[0] 构造器名，[1] 序号，其后依次为参数。
     */
    private static String enumValue(String enumName, EnumConstructor c, List<String> args) {
        StringBuilder sb = new StringBuilder();
        sb.append(LuaRuntime.TAB_ARRAY).append("({[0]=").append(LuaSyntax.quote(c.getName()))
                .append(", ").append(c.getIndex());
        for (String a : args) sb.append(", ").append(a);
        sb.append(", __enum__=").append(enumName).append("}, ").append(args.size() + 2).append(")");
        return sb.toString();
    }

    // ============ typedef / abstract ============

    @Override
    public Void visitTypedef(TypedefDecl decl, EmissionContext ctx) {
        return null;
    }

    @Override
    public Void visitAbstract(AbstractDecl decl, EmissionContext ctx) {
        ClassDecl impl = decl.getImplementation();
        if (impl != null) visitClass(impl, ctx);
        return null;
    }
}
