package com.lumenlang.compiler.ast.stmt;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.VoidType;

public final class BreakStmt extends TypedNode {

    public BreakStmt(SourceLocation location) {
        super(location, VoidType.INSTANCE);
    }

    @Override
    public String getTag() {
        return "break";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitBreak(this, context);
    }
}
