package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;

/**
 * 括号表达式
 */
public final class ParenExpr extends TypedNode {

    private final TypedNode inner;

    public ParenExpr(SourceLocation location, TypedNode inner) {
        super(location, inner.getType());
        this.inner = inner;
    }

    public TypedNode getInner() {
        return inner;
    }

    @Override
    public String getTag() {
        return "paren";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitParen(this, context);
    }
}
