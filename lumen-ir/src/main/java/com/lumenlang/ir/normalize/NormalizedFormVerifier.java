package com.lumenlang.ir.normalize;

import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeScanner;
import com.lumenlang.compiler.ast.TypedNodes;
import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.stmt.*;
import com.lumenlang.ir.InternalInvariantException;

/**
 * 检查规范化输出：值位置上不得出现块状表达式、赋值、自增自减、null 合并或语句节点。
 * 发现违例即抛出 {@link InternalInvariantException}。
 */
public final class NormalizedFormVerifier extends TypedNodeScanner<Void> {

    public static void verify(TypedNode body) {
        new NormalizedFormVerifier().scan(body, null);
    }

    private void checkValue(TypedNode node) {
        if (node == null) return;
        String violation = violation(node);
        if (violation != null) {
            throw new InternalInvariantException("Not in normalized form: " + violation
                    + " '" + node.getTag() + "' in value position", node.getLocation());
        }
    }

    private static String violation(TypedNode node) {
        if (TypedNodes.isBlockLike(node)) return "block-like";
        if (node instanceof BinaryExpr) {
            BinaryExpr bin = (BinaryExpr) node;
            if (bin.isAssignment()) return "assignment";
            if (bin.getOperator() == BinaryExpr.BinaryOp.NULL_COALESCE) return "null coalescing";
        }
        if (node instanceof UnaryExpr && ((UnaryExpr) node).isMutation()) return "increment/decrement";
        if (TypedNodes.isStatement(node)) return "statement";
        return null;
    }

    private void checkValues(Iterable<TypedNode> nodes) {
        for (TypedNode n : nodes) checkValue(n);
    }

    @Override
    public Void visitFieldAccess(FieldAccessExpr node, Void ctx) {
        checkValue(node.getTarget());
        return super.visitFieldAccess(node, ctx);
    }

    @Override
    public Void visitArrayIndex(ArrayIndexExpr node, Void ctx) {
        checkValue(node.getTarget());
        checkValue(node.getIndex());
        return super.visitArrayIndex(node, ctx);
    }

    @Override
    public Void visitParen(ParenExpr node, Void ctx) {
        checkValue(node.getInner());
        return super.visitParen(node, ctx);
    }

    @Override
    public Void visitObjectLiteral(ObjectLiteralExpr node, Void ctx) {
        checkValues(node.getValues());
        return super.visitObjectLiteral(node, ctx);
    }

    @Override
    public Void visitArrayLiteral(ArrayLiteralExpr node, Void ctx) {
        checkValues(node.getElements());
        return super.visitArrayLiteral(node, ctx);
    }

    @Override
    public Void visitCall(CallExpr node, Void ctx) {
        checkValue(node.getCallee());
        checkValues(node.getArgs());
        return super.visitCall(node, ctx);
    }

    @Override
    public Void visitNew(NewExpr node, Void ctx) {
        checkValues(node.getArgs());
        return super.visitNew(node, ctx);
    }

    @Override
    public Void visitBinary(BinaryExpr node, Void ctx) {
        if (!node.isAssignment()) checkValue(node.getLeft());
        checkValue(node.getRight());
        return super.visitBinary(node, ctx);
    }

    @Override
    public Void visitUnary(UnaryExpr node, Void ctx) {
        checkValue(node.getOperand());
        return super.visitUnary(node, ctx);
    }

    @Override
    public Void visitCast(CastExpr node, Void ctx) {
        checkValue(node.getInner());
        return super.visitCast(node, ctx);
    }

    @Override
    public Void visitMeta(MetaExpr node, Void ctx) {
        checkValue(node.getInner());
        return super.visitMeta(node, ctx);
    }

    @Override
    public Void visitEnumParameter(EnumParameterExpr node, Void ctx) {
        checkValue(node.getTarget());
        return super.visitEnumParameter(node, ctx);
    }

    @Override
    public Void visitEnumIndex(EnumIndexExpr node, Void ctx) {
        checkValue(node.getTarget());
        return super.visitEnumIndex(node, ctx);
    }

    @Override
    public Void visitIf(IfExpr node, Void ctx) {
        checkValue(node.getCondition());
        return super.visitIf(node, ctx);
    }

    @Override
    public Void visitSwitch(SwitchExpr node, Void ctx) {
        checkValue(node.getSubject());
        for (SwitchExpr.Case c : node.getCases()) checkValues(c.getValues());
        return super.visitSwitch(node, ctx);
    }

    @Override
    public Void visitVarDecl(VarDeclStmt node, Void ctx) {
        checkValue(node.getInitializer());
        return super.visitVarDecl(node, ctx);
    }

    @Override
    public Void visitFor(ForStmt node, Void ctx) {
        checkValue(node.getIterator());
        return super.visitFor(node, ctx);
    }

    @Override
    public Void visitWhile(WhileStmt node, Void ctx) {
        checkValue(node.getCondition());
        return super.visitWhile(node, ctx);
    }

    @Override
    public Void visitReturn(ReturnStmt node, Void ctx) {
        checkValue(node.getValue());
        return super.visitReturn(node, ctx);
    }

    @Override
    public Void visitThrow(ThrowStmt node, Void ctx) {
        checkValue(node.getValue());
        return super.visitThrow(node, ctx);
    }
}
