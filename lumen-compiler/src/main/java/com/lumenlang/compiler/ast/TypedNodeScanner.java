package com.lumenlang.compiler.ast;

import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.stmt.*;

import java.util.List;

/**
 * 只读遍历基类：按求值顺序访问所有子节点。
 * 子类覆盖感兴趣的 visit 方法，需要继续深入时调用 super。
 */
public class TypedNodeScanner<C> implements TypedNodeVisitor<Void, C> {

    public void scan(TypedNode node, C ctx) {
        if (node != null) node.accept(this, ctx);
    }

    protected void scanAll(List<TypedNode> nodes, C ctx) {
        if (nodes == null) return;
        for (TypedNode n : nodes) scan(n, ctx);
    }

    // ==================== 叶节点 ====================

    @Override
    public Void visitConstant(ConstantExpr node, C ctx) {
        return null;
    }

    @Override
    public Void visitLocalRef(LocalRefExpr node, C ctx) {
        return null;
    }

    @Override
    public Void visitTypeRef(TypeRefExpr node, C ctx) {
        return null;
    }

    @Override
    public Void visitIdent(IdentExpr node, C ctx) {
        return null;
    }

    @Override
    public Void visitBreak(BreakStmt node, C ctx) {
        return null;
    }

    @Override
    public Void visitContinue(ContinueStmt node, C ctx) {
        return null;
    }

    // ==================== 值 ====================

    @Override
    public Void visitFieldAccess(FieldAccessExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        return null;
    }

    @Override
    public Void visitArrayIndex(ArrayIndexExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        scan(node.getIndex(), ctx);
        return null;
    }

    @Override
    public Void visitParen(ParenExpr node, C ctx) {
        scan(node.getInner(), ctx);
        return null;
    }

    @Override
    public Void visitObjectLiteral(ObjectLiteralExpr node, C ctx) {
        scanAll(node.getValues(), ctx);
        return null;
    }

    @Override
    public Void visitArrayLiteral(ArrayLiteralExpr node, C ctx) {
        scanAll(node.getElements(), ctx);
        return null;
    }

    @Override
    public Void visitCall(CallExpr node, C ctx) {
        scan(node.getCallee(), ctx);
        scanAll(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitNew(NewExpr node, C ctx) {
        scanAll(node.getArgs(), ctx);
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr node, C ctx) {
        scan(node.getLeft(), ctx);
        scan(node.getRight(), ctx);
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr node, C ctx) {
        scan(node.getOperand(), ctx);
        return null;
    }

    @Override
    public Void visitFunction(FunctionExpr node, C ctx) {
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitCast(CastExpr node, C ctx) {
        scan(node.getInner(), ctx);
        return null;
    }

    @Override
    public Void visitMeta(MetaExpr node, C ctx) {
        scan(node.getInner(), ctx);
        return null;
    }

    @Override
    public Void visitEnumParameter(EnumParameterExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        return null;
    }

    @Override
    public Void visitEnumIndex(EnumIndexExpr node, C ctx) {
        scan(node.getTarget(), ctx);
        return null;
    }

    // ==================== 块状表达式 ====================

    @Override
    public Void visitBlock(BlockExpr node, C ctx) {
        scanAll(node.getStatements(), ctx);
        return null;
    }

    @Override
    public Void visitIf(IfExpr node, C ctx) {
        scan(node.getCondition(), ctx);
        scan(node.getThenBranch(), ctx);
        scan(node.getElseBranch(), ctx);
        return null;
    }

    @Override
    public Void visitSwitch(SwitchExpr node, C ctx) {
        scan(node.getSubject(), ctx);
        for (SwitchExpr.Case c : node.getCases()) {
            scanAll(c.getValues(), ctx);
            scan(c.getBody(), ctx);
        }
        scan(node.getDefaultBody(), ctx);
        return null;
    }

    @Override
    public Void visitTry(TryExpr node, C ctx) {
        scan(node.getBody(), ctx);
        for (TryExpr.Catch c : node.getCatches()) {
            scan(c.getBody(), ctx);
        }
        return null;
    }

    // ==================== 语句 ====================

    @Override
    public Void visitVarDecl(VarDeclStmt node, C ctx) {
        scan(node.getInitializer(), ctx);
        return null;
    }

    @Override
    public Void visitFor(ForStmt node, C ctx) {
        scan(node.getIterator(), ctx);
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitWhile(WhileStmt node, C ctx) {
        scan(node.getCondition(), ctx);
        scan(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitReturn(ReturnStmt node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }

    @Override
    public Void visitThrow(ThrowStmt node, C ctx) {
        scan(node.getValue(), ctx);
        return null;
    }
}
