package com.lumenlang.ir.backend;

import com.lumenlang.compiler.ast.TypePath;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.ast.TypedNodes;
import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.lumenlang.compiler.ast.stmt.*;
import com.lumenlang.compiler.types.LumenType;
import com.lumenlang.compiler.types.Types;
import com.lumenlang.ir.InternalInvariantException;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * 值位置的 Lua 输出。输入应为规范化后的树；块状表达式在值位置时退化为立即调用的函数。
 */
final class LuaExpressionPrinter implements TypedNodeVisitor<Void, EmissionContext> {

    private LuaStatementPrinter statements;

    void setStatementPrinter(LuaStatementPrinter statements) {
        this.statements = statements;
    }

    void print(TypedNode node, EmissionContext ctx) {
        node.accept(this, ctx);
    }

    // ============ 辅助方法 ============

    /**
     * 作为运算符操作数输出，复合表达式加括号。
     */
    void printOperand(TypedNode node, EmissionContext ctx) {
        if (needsParens(node)) {
            ctx.append("(");
            print(node, ctx);
            ctx.append(")");
        } else {
            print(node, ctx);
        }
    }

    /**
     * 作为前缀表达式输出（字段访问、索引、调用的目标）。
     */
    void printPrefix(TypedNode node, EmissionContext ctx) {
        if (isPrefixExpression(node)) {
            print(node, ctx);
        } else {
            ctx.append("(");
            print(node, ctx);
            ctx.append(")");
        }
    }

    private <T> void printJoined(List<T> items, EmissionContext ctx, BiConsumer<T, EmissionContext> printer) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) ctx.append(", ");
            printer.accept(items.get(i), ctx);
        }
    }

    void printArgs(List<TypedNode> args, EmissionContext ctx) {
        ctx.append("(");
        printJoined(args, ctx, this::print);
        ctx.append(")");
    }

    private static boolean needsParens(TypedNode node) {
        if (node instanceof MetaExpr) return needsParens(((MetaExpr) node).getInner());
        if (node instanceof CastExpr && !((CastExpr) node).isChecked()) {
            return needsParens(((CastExpr) node).getInner());
        }
        if (node instanceof BinaryExpr || node instanceof UnaryExpr) return true;
        if (node instanceof ConstantExpr) {
            Object v = ((ConstantExpr) node).getValue();
            return v instanceof Number && ((Number) v).doubleValue() < 0;
        }
        return false;
    }

    private static boolean isPrefixExpression(TypedNode node) {
        if (node instanceof MetaExpr) return isPrefixExpression(((MetaExpr) node).getInner());
        if (node instanceof CastExpr && !((CastExpr) node).isChecked()) {
            return isPrefixExpression(((CastExpr) node).getInner());
        }
        if (node instanceof CallExpr) {
            CallExpr call = (CallExpr) node;
            Intrinsic intrinsic = Intrinsic.forName(call.getIntrinsicName());
            if (intrinsic == Intrinsic.RAW_CODE) return false;
            if (intrinsic == Intrinsic.REINTERPRET && !call.getArgs().isEmpty()) {
                return isPrefixExpression(call.getArgs().get(0));
            }
            return true;
        }
        if (node instanceof ConstantExpr) {
            return ((ConstantExpr) node).getKind() == ConstantExpr.ConstantKind.THIS;
        }
        return node instanceof LocalRefExpr || node instanceof FieldAccessExpr
                || node instanceof ArrayIndexExpr || node instanceof ParenExpr
                || node instanceof TypeRefExpr || node instanceof NewExpr
                || node instanceof ObjectLiteralExpr || node instanceof ArrayLiteralExpr
                || node instanceof CastExpr || node instanceof EnumParameterExpr
                || node instanceof EnumIndexExpr;
    }

    private static UnsupportedConstructException unsupported(String message, TypedNode node) {
        return new UnsupportedConstructException(message, node.getTag(), node.getLocation());
    }

    private static InternalInvariantException notNormalized(TypedNode node) {
        return new InternalInvariantException("'" + node.getTag() + "' reached value position", node.getLocation());
    }

    private String superName(TypedNode node, EmissionContext ctx) {
        TypePath sup = ctx.getSuperClass();
        if (sup == null) {
            throw unsupported("super used in a class without superclass", node);
        }
        if (!ctx.isInstanceContext()) {
            throw unsupported("super used outside an instance context", node);
        }
        return ctx.typeName(sup);
    }

    private static boolean isSuper(TypedNode node) {
        return node instanceof ConstantExpr && ((ConstantExpr) node).getKind() == ConstantExpr.ConstantKind.SUPER;
    }

    // ============ 字面量与引用 ============

    @Override
    public Void visitConstant(ConstantExpr node, EmissionContext ctx) {
        Object v = node.getValue();
        switch (node.getKind()) {
            case INT:
                ctx.append(Long.toString(((Number) v).longValue()));
                break;
            case FLOAT:
                ctx.append(LuaSyntax.floatLiteral(((Number) v).doubleValue()));
                break;
            case STRING:
                ctx.append(LuaSyntax.quote((String) v));
                break;
            case BOOL:
                ctx.append(Boolean.TRUE.equals(v) ? "true" : "false");
                break;
            case NULL:
                ctx.append("nil");
                break;
            case THIS:
                if (!ctx.isInstanceContext()) {
                    throw unsupported("'this' used outside an instance context", node);
                }
                ctx.append("self");
                break;
            case SUPER:
                throw unsupported("'super' is only valid as a call or member target", node);
            default:
                throw new IllegalStateException("Unknown constant kind: " + node.getKind());
        }
        return null;
    }

    @Override
    public Void visitLocalRef(LocalRefExpr node, EmissionContext ctx) {
        ctx.append(LuaSyntax.localName(node.getVariable()));
        return null;
    }

    @Override
    public Void visitTypeRef(TypeRefExpr node, EmissionContext ctx) {
        ctx.append(ctx.typeName(node.getPath()));
        return null;
    }

    @Override
    public Void visitIdent(IdentExpr node, EmissionContext ctx) {
        throw unsupported("Unresolved identifier '" + node.getName() + "'", node);
    }

    // ============ 成员访问 ============

    @Override
    public Void visitFieldAccess(FieldAccessExpr node, EmissionContext ctx) {
        String name = node.getField().getTargetName();
        TypedNode target = node.getTarget();
        switch (node.getKind()) {
            case STATIC:
            case ENUM_CONSTRUCTOR:
                if (node.getOwnerPath() != null) {
                    ctx.append(ctx.typeName(node.getOwnerPath()));
                } else {
                    printPrefix(target, ctx);
                }
                ctx.append(LuaSyntax.fieldSuffix(name));
                return null;
            case CLOSURE:
                if (isSuper(target)) {
                    ctx.append(LuaRuntime.BIND + "(self, " + superName(target, ctx) + ".prototype"
                            + LuaSyntax.fieldSuffix(name) + ")");
                    return null;
                }
                ctx.append(LuaRuntime.BIND + "(");
                print(target, ctx);
                ctx.append(", ");
                printPrefix(target, ctx);
                ctx.append(LuaSyntax.fieldSuffix(name));
                ctx.append(")");
                return null;
            default:
                if (isSuper(target)) {
                    String sup = superName(target, ctx);
                    if (node.getField().isMethod()) {
                        ctx.append(LuaRuntime.BIND + "(self, " + sup + ".prototype" + LuaSyntax.fieldSuffix(name) + ")");
                    } else {
                        ctx.append("self" + LuaSyntax.fieldSuffix(name));
                    }
                    return null;
                }
                printPrefix(target, ctx);
                ctx.append(LuaSyntax.fieldSuffix(name));
                return null;
        }
    }

    @Override
    public Void visitArrayIndex(ArrayIndexExpr node, EmissionContext ctx) {
        printPrefix(node.getTarget(), ctx);
        ctx.append("[");
        print(node.getIndex(), ctx);
        ctx.append("]");
        return null;
    }

    @Override
    public Void visitEnumParameter(EnumParameterExpr node, EmissionContext ctx) {
        // 布局：[0] 名字，[1] 序号，[2..] 参数
        printPrefix(node.getTarget(), ctx);
        ctx.append("[" + (node.getIndex() + 2) + "]");
        return null;
    }

    @Override
    public Void visitEnumIndex(EnumIndexExpr node, EmissionContext ctx) {
        printPrefix(node.getTarget(), ctx);
        ctx.append("[1]");
        return null;
    }

    @Override
    public Void visitParen(ParenExpr node, EmissionContext ctx) {
        ctx.append("(");
        print(node.getInner(), ctx);
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitMeta(MetaExpr node, EmissionContext ctx) {
        print(node.getInner(), ctx);
        return null;
    }

    @Override
    public Void visitCast(CastExpr node, EmissionContext ctx) {
        if (!node.isChecked()) {
            print(node.getInner(), ctx);
            return null;
        }
        ctx.append(LuaRuntime.CAST + "(");
        print(node.getInner(), ctx);
        ctx.append(", " + ctx.typeName(node.getTargetPath()) + ")");
        return null;
    }

    // ============ 字面量集合 ============

    @Override
    public Void visitObjectLiteral(ObjectLiteralExpr node, EmissionContext ctx) {
        List<ObjectLiteralExpr.Field> fields = node.getFields();
        if (fields.isEmpty()) {
            ctx.append(LuaRuntime.EMPTY + "()");
            return null;
        }
        ctx.append(LuaRuntime.OBJECT + "({__fields__={");
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) ctx.append(",");
            ctx.append(LuaSyntax.tableKey(fields.get(i).getName()) + "=true");
        }
        ctx.append("}");
        for (ObjectLiteralExpr.Field f : fields) {
            ctx.append("," + LuaSyntax.tableKey(f.getName()) + "=");
            print(f.getValue(), ctx);
        }
        ctx.append("})");
        return null;
    }

    @Override
    public Void visitArrayLiteral(ArrayLiteralExpr node, EmissionContext ctx) {
        List<TypedNode> elements = node.getElements();
        if (elements.isEmpty()) {
            ctx.append(LuaRuntime.TAB_ARRAY + "({}, 0)");
            return null;
        }
        ctx.append(LuaRuntime.TAB_ARRAY + "({[0]=");
        printJoined(elements, ctx, this::print);
        ctx.append("}, " + elements.size() + ")");
        return null;
    }

    // ============ 调用 ============

    @Override
    public Void visitCall(CallExpr node, EmissionContext ctx) {
        TypedNode callee = node.getCallee();
        if (callee instanceof IdentExpr) {
            printIntrinsic(node, (IdentExpr) callee, ctx);
            return null;
        }
        if (isSuper(callee)) {
            // super(...) 只允许出现在构造函数内
            if (!ctx.isInConstructor()) {
                throw unsupported("super(...) outside a constructor", node);
            }
            ctx.append(superName(callee, ctx) + ".super(self");
            for (TypedNode arg : node.getArgs()) {
                ctx.append(", ");
                print(arg, ctx);
            }
            ctx.append(")");
            return null;
        }
        if (callee instanceof FieldAccessExpr && isMethodCall((FieldAccessExpr) callee)) {
            printMethodCall((FieldAccessExpr) callee, node.getArgs(), ctx);
            return null;
        }
        printPrefix(callee, ctx);
        printArgs(node.getArgs(), ctx);
        return null;
    }

    private static boolean isMethodCall(FieldAccessExpr fa) {
        return fa.getField().isMethod()
                && (fa.getKind() == FieldAccessKind.INSTANCE || fa.getKind() == FieldAccessKind.CLOSURE);
    }

    private void printMethodCall(FieldAccessExpr fa, List<TypedNode> args, EmissionContext ctx) {
        String name = fa.getField().getTargetName();
        TypedNode target = fa.getTarget();
        if (isSuper(target)) {
            ctx.append(superName(target, ctx) + ".prototype" + LuaSyntax.fieldSuffix(name) + "(self");
            for (TypedNode arg : args) {
                ctx.append(", ");
                print(arg, ctx);
            }
            ctx.append(")");
            return;
        }
        if (LuaSyntax.isIdentifier(name)) {
            printPrefix(target, ctx);
            ctx.append(":" + name);
            printArgs(args, ctx);
            return;
        }
        // 非法名字无法用冒号语法，接收者需输出两次
        if (!TypedNodes.isSideEffectFree(target)) {
            throw unsupported("Method '" + name + "' needs a pure receiver", fa);
        }
        printPrefix(target, ctx);
        ctx.append(LuaSyntax.fieldSuffix(name) + "(");
        print(target, ctx);
        for (TypedNode arg : args) {
            ctx.append(", ");
            print(arg, ctx);
        }
        ctx.append(")");
    }

    private void printIntrinsic(CallExpr node, IdentExpr callee, EmissionContext ctx) {
        Intrinsic intrinsic = Intrinsic.forName(callee.getName());
        if (intrinsic == null) {
            throw unsupported("Unresolved identifier '" + callee.getName() + "'", callee);
        }
        List<TypedNode> args = node.getArgs();
        switch (intrinsic) {
            case RAW_CODE:
                ctx.append(stringArgument(node, args));
                return;
            case GLOBAL:
                ctx.append(stringArgument(node, args));
                printArgs(args.subList(1, args.size()), ctx);
                return;
            case REINTERPRET:
                if (args.size() != 1) throw unsupported("__reinterpret__ takes one argument", node);
                print(args.get(0), ctx);
                return;
            case CALL:
                if (args.isEmpty()) throw unsupported("__call__ needs a function argument", node);
                printPrefix(args.get(0), ctx);
                printArgs(args.subList(1, args.size()), ctx);
                return;
            default:
                throw new IllegalStateException("Unknown intrinsic: " + intrinsic);
        }
    }

    private static String stringArgument(CallExpr node, List<TypedNode> args) {
        if (args.isEmpty() || !(args.get(0) instanceof ConstantExpr)
                || ((ConstantExpr) args.get(0)).getKind() != ConstantExpr.ConstantKind.STRING) {
            throw unsupported(node.getIntrinsicName() + " expects a string constant", node);
        }
        return (String) ((ConstantExpr) args.get(0)).getValue();
    }

    @Override
    public Void visitNew(NewExpr node, EmissionContext ctx) {
        ctx.append(ctx.typeName(node.getClassPath()) + ".new");
        printArgs(node.getArgs(), ctx);
        return null;
    }

    // ============ 运算符 ============

    @Override
    public Void visitBinary(BinaryExpr node, EmissionContext ctx) {
        BinaryOp op = node.getOperator();
        if (node.isAssignment() || op == BinaryOp.NULL_COALESCE) {
            throw notNormalized(node);
        }
        if (op.isBitwise()) {
            ctx.append(LuaRuntime.BIT + "." + bitFunction(op) + "(");
            print(node.getLeft(), ctx);
            ctx.append(", ");
            print(node.getRight(), ctx);
            ctx.append(")");
            return null;
        }
        if (op == BinaryOp.ADD && (Types.isString(node.getLeft().getType())
                || Types.isString(node.getRight().getType()))) {
            printConcatOperand(node.getLeft(), ctx);
            ctx.append(" .. ");
            printConcatOperand(node.getRight(), ctx);
            return null;
        }
        printOperand(node.getLeft(), ctx);
        ctx.append(" " + luaOperator(op) + " ");
        printOperand(node.getRight(), ctx);
        return null;
    }

    private void printConcatOperand(TypedNode operand, EmissionContext ctx) {
        LumenType type = operand.getType();
        boolean plainString = Types.isString(type) && !type.isNullable();
        if (plainString) {
            printOperand(operand, ctx);
        } else {
            ctx.append(LuaRuntime.STD_STRING + "(");
            print(operand, ctx);
            ctx.append(")");
        }
    }

    private static String bitFunction(BinaryOp op) {
        switch (op) {
            case BIT_AND: return "band";
            case BIT_OR: return "bor";
            case BIT_XOR: return "bxor";
            case SHL: return "lshift";
            case SHR: return "arshift";
            case USHR: return "rshift";
            default: throw new IllegalArgumentException("Not a bitwise operator: " + op);
        }
    }

    static String luaOperator(BinaryOp op) {
        switch (op) {
            case NE: return "~=";
            case AND: return "and";
            case OR: return "or";
            default: return op.toSourceString();
        }
    }

    @Override
    public Void visitUnary(UnaryExpr node, EmissionContext ctx) {
        switch (node.getOperator()) {
            case NOT:
                ctx.append("not ");
                printOperand(node.getOperand(), ctx);
                return null;
            case NEG:
                ctx.append("-");
                printOperand(node.getOperand(), ctx);
                return null;
            case BIT_NOT:
                ctx.append(LuaRuntime.BIT + ".bnot(");
                print(node.getOperand(), ctx);
                ctx.append(")");
                return null;
            default:
                throw notNormalized(node);
        }
    }

    // ============ 函数 ============

    @Override
    public Void visitFunction(FunctionExpr node, EmissionContext ctx) {
        printFunction(node, ctx, false);
        return null;
    }

    /**
     * 输出函数字面量；withSelf 为 true 时第一个参数为 self（实例方法）。
     */
    void printFunction(FunctionExpr fn, EmissionContext ctx, boolean withSelf) {
        ctx.append("function(");
        boolean first = true;
        if (withSelf) {
            ctx.append("self");
            first = false;
        }
        for (FunctionExpr.Param p : fn.getParams()) {
            if (!first) ctx.append(", ");
            ctx.append(LuaSyntax.localName(p.getVariable()));
            first = false;
        }
        ctx.append(")");
        ctx.newLine();
        ctx.indent();

        boolean savedInstance = ctx.isInstanceContext();
        boolean savedConstructor = ctx.isInConstructor();
        if (withSelf) ctx.setInstanceContext(true);
        ctx.setInConstructor(false);
        ctx.pushFrame(ControlFrame.function());
        try {
            printDefaults(fn, ctx);
            statements.printFunctionBody(fn.getBody(), fn.getReturnType(), ctx);
        } finally {
            ctx.popFrame();
            ctx.setInConstructor(savedConstructor);
            ctx.setInstanceContext(savedInstance);
        }

        ctx.dedent();
        ctx.append("end");
    }

    /**
     * 默认参数：if p == nil then p = v end
     */
    void printDefaults(FunctionExpr fn, EmissionContext ctx) {
        for (FunctionExpr.Param p : fn.getParams()) {
            if (p.getDefaultValue() == null) continue;
            String name = LuaSyntax.localName(p.getVariable());
            ctx.append("if " + name + " == nil then " + name + " = ");
            print(p.getDefaultValue(), ctx);
            ctx.line(" end");
        }
    }

    // ============ 块状表达式：立即调用的函数 ============

    private Void immediatelyInvoked(TypedNode node, EmissionContext ctx) {
        ctx.append("(function()");
        ctx.newLine();
        ctx.indent();
        ctx.pushFrame(ControlFrame.function());
        try {
            statements.printResult(node, ctx);
        } finally {
            ctx.popFrame();
        }
        ctx.dedent();
        ctx.append("end)()");
        return null;
    }

    @Override
    public Void visitBlock(BlockExpr node, EmissionContext ctx) {
        return immediatelyInvoked(node, ctx);
    }

    @Override
    public Void visitIf(IfExpr node, EmissionContext ctx) {
        return immediatelyInvoked(node, ctx);
    }

    @Override
    public Void visitSwitch(SwitchExpr node, EmissionContext ctx) {
        return immediatelyInvoked(node, ctx);
    }

    @Override
    public Void visitTry(TryExpr node, EmissionContext ctx) {
        return immediatelyInvoked(node, ctx);
    }

    // ============ 语句节点不应出现在值位置 ============

    @Override
    public Void visitVarDecl(VarDeclStmt node, EmissionContext ctx) {
        throw notNormalized(node);
    }

    @Override
    public Void visitFor(ForStmt node, EmissionContext ctx) {
        throw notNormalized(node);
    }

    @Override
    public Void visitWhile(WhileStmt node, EmissionContext ctx) {
        throw notNormalized(node);
    }

    @Override
    public Void visitReturn(ReturnStmt node, EmissionContext ctx) {
        throw notNormalized(node);
    }

    @Override
    public Void visitBreak(BreakStmt node, EmissionContext ctx) {
        throw notNormalized(node);
    }

    @Override
    public Void visitContinue(ContinueStmt node, EmissionContext ctx) {
        throw notNormalized(node);
    }

    @Override
    public Void visitThrow(ThrowStmt node, EmissionContext ctx) {
        throw notNormalized(node);
    }
}
