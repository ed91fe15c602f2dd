package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.LocalVar;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;

/**
 * 局部变量引用
 */
public final class LocalRefExpr extends TypedNode {

    private final LocalVar variable;

    public LocalRefExpr(SourceLocation location, LocalVar variable) {
        super(location, variable.getType());
        this.variable = variable;
    }

    public LocalVar getVariable() {
        return variable;
    }

    @Override
    public String getTag() {
        return "local";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitLocalRef(this, context);
    }
}
