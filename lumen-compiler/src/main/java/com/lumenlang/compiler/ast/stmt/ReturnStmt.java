package com.lumenlang.compiler.ast.stmt;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.VoidType;

/**
 * return [value]
 */
public final class ReturnStmt extends TypedNode {

    private final TypedNode value;  // nullable

    public ReturnStmt(SourceLocation location, TypedNode value) {
        super(location, VoidType.INSTANCE);
        this.value = value;
    }

    public TypedNode getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public String getTag() {
        return "return";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitReturn(this, context);
    }
}
