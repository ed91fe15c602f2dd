package com.lumenlang.compiler.ast.stmt;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.VoidType;

/**
 * throw value
 */
public final class ThrowStmt extends TypedNode {

    private final TypedNode value;

    public ThrowStmt(SourceLocation location, TypedNode value) {
        super(location, VoidType.INSTANCE);
        this.value = value;
    }

    public TypedNode getValue() {
        return value;
    }

    @Override
    public String getTag() {
        return "throw";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitThrow(this, context);
    }
}
