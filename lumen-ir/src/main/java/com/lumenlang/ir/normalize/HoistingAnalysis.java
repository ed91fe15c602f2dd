package com.lumenlang.ir.normalize;

import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeScanner;
import com.lumenlang.compiler.ast.TypedNodes;
import com.lumenlang.compiler.ast.expr.BinaryExpr;
import com.lumenlang.compiler.ast.expr.FunctionExpr;
import com.lumenlang.compiler.ast.expr.UnaryExpr;
import com.lumenlang.compiler.ast.stmt.*;

/**
 * 判断一个值位置的表达式规范化后是否会产生前置语句。
 * 不进入函数字面量（其体在自己的作用域内规范化）。
 */
final class HoistingAnalysis extends TypedNodeScanner<Void> {

    private boolean found;

    private HoistingAnalysis() {
    }

    static boolean requiresHoisting(TypedNode node) {
        HoistingAnalysis analysis = new HoistingAnalysis();
        analysis.scan(node, null);
        return analysis.found;
    }

    @Override
    public void scan(TypedNode node, Void ctx) {
        if (found || node == null) return;
        if (TypedNodes.isBlockLike(node)) {
            found = true;
            return;
        }
        super.scan(node, ctx);
    }

    @Override
    public Void visitBinary(BinaryExpr node, Void ctx) {
        if (node.isAssignment() || node.getOperator() == BinaryExpr.BinaryOp.NULL_COALESCE) {
            found = true;
            return null;
        }
        return super.visitBinary(node, ctx);
    }

    @Override
    public Void visitUnary(UnaryExpr node, Void ctx) {
        if (node.isMutation()) {
            found = true;
            return null;
        }
        return super.visitUnary(node, ctx);
    }

    @Override
    public Void visitFunction(FunctionExpr node, Void ctx) {
        return null;
    }

    @Override
    public Void visitVarDecl(VarDeclStmt node, Void ctx) {
        found = true;
        return null;
    }

    @Override
    public Void visitWhile(WhileStmt node, Void ctx) {
        found = true;
        return null;
    }

    @Override
    public Void visitFor(ForStmt node, Void ctx) {
        found = true;
        return null;
    }

    @Override
    public Void visitReturn(ReturnStmt node, Void ctx) {
        found = true;
        return null;
    }

    @Override
    public Void visitBreak(BreakStmt node, Void ctx) {
        found = true;
        return null;
    }

    @Override
    public Void visitContinue(ContinueStmt node, Void ctx) {
        found = true;
        return null;
    }

    @Override
    public Void visitThrow(ThrowStmt node, Void ctx) {
        found = true;
        return null;
    }
}
