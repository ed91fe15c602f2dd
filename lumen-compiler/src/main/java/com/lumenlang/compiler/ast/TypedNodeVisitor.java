package com.lumenlang.compiler.ast;

import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.stmt.*;

/**
 * 类型化语法树访问者，29 个 visit 方法，均无默认实现。
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface TypedNodeVisitor<R, C> {

    // ===== 值 (18) =====
    R visitConstant(ConstantExpr node, C context);
    R visitLocalRef(LocalRefExpr node, C context);
    R visitFieldAccess(FieldAccessExpr node, C context);
    R visitArrayIndex(ArrayIndexExpr node, C context);
    R visitParen(ParenExpr node, C context);
    R visitObjectLiteral(ObjectLiteralExpr node, C context);
    R visitArrayLiteral(ArrayLiteralExpr node, C context);
    R visitTypeRef(TypeRefExpr node, C context);
    R visitCall(CallExpr node, C context);
    R visitNew(NewExpr node, C context);
    R visitBinary(BinaryExpr node, C context);
    R visitUnary(UnaryExpr node, C context);
    R visitFunction(FunctionExpr node, C context);
    R visitCast(CastExpr node, C context);
    R visitMeta(MetaExpr node, C context);
    R visitEnumParameter(EnumParameterExpr node, C context);
    R visitEnumIndex(EnumIndexExpr node, C context);
    R visitIdent(IdentExpr node, C context);

    // ===== 块状表达式 (4) =====
    R visitBlock(BlockExpr node, C context);
    R visitIf(IfExpr node, C context);
    R visitSwitch(SwitchExpr node, C context);
    R visitTry(TryExpr node, C context);

    // ===== 语句 (7) =====
    R visitVarDecl(VarDeclStmt node, C context);
    R visitFor(ForStmt node, C context);
    R visitWhile(WhileStmt node, C context);
    R visitReturn(ReturnStmt node, C context);
    R visitBreak(BreakStmt node, C context);
    R visitContinue(ContinueStmt node, C context);
    R visitThrow(ThrowStmt node, C context);
}
