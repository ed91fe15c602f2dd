package com.lumenlang.compiler.analysis;

import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeScanner;
import com.lumenlang.compiler.ast.TypedNodes;
import com.lumenlang.compiler.ast.decl.*;
import com.lumenlang.compiler.ast.expr.BinaryExpr;
import com.lumenlang.compiler.ast.expr.CallExpr;
import com.lumenlang.compiler.ast.expr.FunctionExpr;
import com.lumenlang.compiler.ast.stmt.ReturnStmt;
import com.lumenlang.compiler.ast.stmt.VarDeclStmt;
import com.lumenlang.compiler.diagnostics.Diagnostic;
import com.lumenlang.compiler.diagnostics.DiagnosticCollector;
import com.lumenlang.compiler.types.FunctionType;
import com.lumenlang.compiler.types.LumenType;
import com.lumenlang.compiler.types.NullabilityResolver;
import com.lumenlang.compiler.types.VoidType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * null 安全验证：在原始类型化树上查找"把 null 常量写入非空位置"的情形。
 * <p>
 * 只报告，不改写；检查的位置：赋值、变量初始化、调用参数（可选参数除外）、返回值。
 */
public final class NullabilityChecker extends TypedNodeScanner<Void> {

    private final NullabilityResolver resolver;
    private final DiagnosticCollector diagnostics;
    /** 当前所在函数的声明返回类型 */
    private final Deque<LumenType> returnTypes = new ArrayDeque<>();

    public NullabilityChecker(NullabilityResolver resolver, DiagnosticCollector diagnostics) {
        this.resolver = resolver != null ? resolver : NullabilityResolver.DEFAULT;
        this.diagnostics = diagnostics;
    }

    /**
     * 检查一个顶层声明的所有表达式体。
     */
    public void checkDeclaration(Declaration decl) {
        if (decl instanceof ClassDecl) {
            checkClass((ClassDecl) decl);
        } else if (decl instanceof AbstractDecl) {
            ClassDecl impl = ((AbstractDecl) decl).getImplementation();
            if (impl != null) checkClass(impl);
        }
    }

    private void checkClass(ClassDecl cls) {
        if (cls.getConstructor() != null) checkField(cls.getConstructor());
        for (FieldDecl f : cls.getFields()) checkField(f);
        for (FieldDecl f : cls.getStaticFields()) checkField(f);
    }

    private void checkField(FieldDecl field) {
        TypedNode expr = field.getExpression();
        if (expr == null) return;
        if (!field.isMethod() && TypedNodes.isNullConstant(expr) && !resolver.isNullable(field.getType())) {
            report(expr, "字段 '" + field.getName() + "' 的类型 " + field.getType() + " 不可为 null");
        }
        scan(expr, null);
    }

    /**
     * 检查单个表达式体；returnType 为该体所属函数的返回类型，可为 null。
     */
    public void check(TypedNode body, LumenType returnType) {
        if (returnType != null) returnTypes.push(returnType);
        try {
            scan(body, null);
        } finally {
            if (returnType != null) returnTypes.pop();
        }
    }

    @Override
    public Void visitBinary(BinaryExpr node, Void ctx) {
        if (node.getOperator() == BinaryExpr.BinaryOp.ASSIGN
                && TypedNodes.isNullConstant(node.getRight())
                && !resolver.isNullable(node.getLeft().getType())) {
            report(node.getRight(), "不能将 null 赋给类型为 " + node.getLeft().getType() + " 的目标");
        }
        return super.visitBinary(node, ctx);
    }

    @Override
    public Void visitVarDecl(VarDeclStmt node, Void ctx) {
        if (node.hasInitializer() && TypedNodes.isNullConstant(node.getInitializer())
                && !resolver.isNullable(node.getVariable().getType())) {
            report(node.getInitializer(), "变量 '" + node.getVariable().getName() + "' 的类型 "
                    + node.getVariable().getType() + " 不可为 null");
        }
        return super.visitVarDecl(node, ctx);
    }

    @Override
    public Void visitCall(CallExpr node, Void ctx) {
        LumenType calleeType = node.getCallee().getType();
        if (node.getIntrinsicName() == null && calleeType instanceof FunctionType) {
            List<FunctionType.Param> params = ((FunctionType) calleeType).getParams();
            List<TypedNode> args = node.getArgs();
            int n = Math.min(params.size(), args.size());
            for (int i = 0; i < n; i++) {
                FunctionType.Param p = params.get(i);
                if (!p.isOptional() && TypedNodes.isNullConstant(args.get(i))
                        && !resolver.isNullable(p.getType())) {
                    report(args.get(i), "参数 '" + p.getName() + "' 的类型 " + p.getType() + " 不可为 null");
                }
            }
        }
        return super.visitCall(node, ctx);
    }

    @Override
    public Void visitReturn(ReturnStmt node, Void ctx) {
        LumenType expected = returnTypes.peek();
        if (node.hasValue() && expected != null && !(expected instanceof VoidType)
                && TypedNodes.isNullConstant(node.getValue())
                && !resolver.isNullable(expected)) {
            report(node.getValue(), "返回类型 " + expected + " 不可为 null");
        }
        return super.visitReturn(node, ctx);
    }

    @Override
    public Void visitFunction(FunctionExpr node, Void ctx) {
        returnTypes.push(node.getReturnType() != null ? node.getReturnType() : VoidType.INSTANCE);
        try {
            return super.visitFunction(node, ctx);
        } finally {
            returnTypes.pop();
        }
    }

    private void report(TypedNode at, String message) {
        diagnostics.report(Diagnostic.error(Diagnostic.NULL_SAFETY, message, at.getLocation()));
    }
}
