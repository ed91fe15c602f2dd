package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.LumenType;

/**
 * 一元表达式（前缀/后缀）
 */
public final class UnaryExpr extends TypedNode {

    private final UnaryOp operator;
    private final TypedNode operand;
    private final boolean postfix;

    public UnaryExpr(SourceLocation location, LumenType type, UnaryOp operator,
                     TypedNode operand, boolean postfix) {
        super(location, type);
        this.operator = operator;
        this.operand = operand;
        this.postfix = postfix;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public TypedNode getOperand() {
        return operand;
    }

    public boolean isPostfix() {
        return postfix;
    }

    public boolean isPrefix() {
        return !postfix;
    }

    public boolean isMutation() {
        return operator == UnaryOp.INCREMENT || operator == UnaryOp.DECREMENT;
    }

    public UnaryExpr withOperand(TypedNode newOperand) {
        if (newOperand == operand) return this;
        return new UnaryExpr(location, type, operator, newOperand, postfix);
    }

    @Override
    public String getTag() {
        return "unop";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitUnary(this, context);
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        INCREMENT("++"),
        DECREMENT("--"),
        NOT("!"),
        NEG("-"),
        BIT_NOT("~");

        private final String source;

        UnaryOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }
    }
}
