package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.LumenType;

/**
 * 二元表达式，包括赋值、复合赋值（compoundOp 为内层运算符）和 null 合并。
 */
public final class BinaryExpr extends TypedNode {

    private final BinaryOp operator;
    private final TypedNode left;
    private final TypedNode right;
    private final BinaryOp compoundOp;

    public BinaryExpr(SourceLocation location, LumenType type, BinaryOp operator,
                      TypedNode left, TypedNode right) {
        this(location, type, operator, left, right, null);
    }

    public BinaryExpr(SourceLocation location, LumenType type, BinaryOp operator,
                      TypedNode left, TypedNode right, BinaryOp compoundOp) {
        super(location, type);
        if (operator == BinaryOp.ASSIGN_OP && compoundOp == null) {
            throw new IllegalArgumentException("Compound assignment requires an inner operator");
        }
        this.operator = operator;
        this.left = left;
        this.right = right;
        this.compoundOp = compoundOp;
    }

    /** 简单赋值 */
    public static BinaryExpr assign(SourceLocation loc, TypedNode target, TypedNode value) {
        return new BinaryExpr(loc, target.getType(), BinaryOp.ASSIGN, target, value);
    }

    /** 复合赋值 target op= value */
    public static BinaryExpr assignOp(SourceLocation loc, BinaryOp op, TypedNode target, TypedNode value) {
        return new BinaryExpr(loc, target.getType(), BinaryOp.ASSIGN_OP, target, value, op);
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public TypedNode getLeft() {
        return left;
    }

    public TypedNode getRight() {
        return right;
    }

    public BinaryOp getCompoundOp() {
        return compoundOp;
    }

    public boolean isAssignment() {
        return operator == BinaryOp.ASSIGN || operator == BinaryOp.ASSIGN_OP;
    }

    public BinaryExpr withOperands(TypedNode newLeft, TypedNode newRight) {
        if (newLeft == left && newRight == right) return this;
        return new BinaryExpr(location, type, operator, newLeft, newRight, compoundOp);
    }

    @Override
    public String getTag() {
        return "binop";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitBinary(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),

        // 比较
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),

        // 逻辑
        AND("&&"),
        OR("||"),

        // 位运算
        BIT_AND("&"),
        BIT_OR("|"),
        BIT_XOR("^"),
        SHL("<<"),
        SHR(">>"),
        USHR(">>>"),

        // 赋值
        ASSIGN("="),
        ASSIGN_OP("op="),

        // null 合并
        NULL_COALESCE("??");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回源语言中的运算符 */
        public String toSourceString() {
            return source;
        }

        public boolean isBitwise() {
            switch (this) {
                case BIT_AND: case BIT_OR: case BIT_XOR:
                case SHL: case SHR: case USHR:
                    return true;
                default:
                    return false;
            }
        }

        public boolean isEquality() {
            return this == EQ || this == NE;
        }
    }
}
