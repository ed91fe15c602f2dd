package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.LumenType;

/**
 * if/else，可出现在值位置。
 */
public final class IfExpr extends TypedNode {

    private final TypedNode condition;
    private final TypedNode thenBranch;
    private final TypedNode elseBranch;  // nullable

    public IfExpr(SourceLocation location, LumenType type, TypedNode condition,
                  TypedNode thenBranch, TypedNode elseBranch) {
        super(location, type);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public TypedNode getCondition() {
        return condition;
    }

    public TypedNode getThenBranch() {
        return thenBranch;
    }

    public TypedNode getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public String getTag() {
        return "if";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitIf(this, context);
    }
}
