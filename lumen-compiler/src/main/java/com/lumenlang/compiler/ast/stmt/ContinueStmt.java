package com.lumenlang.compiler.ast.stmt;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.VoidType;

public final class ContinueStmt extends TypedNode {

    public ContinueStmt(SourceLocation location) {
        super(location, VoidType.INSTANCE);
    }

    @Override
    public String getTag() {
        return "continue";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitContinue(this, context);
    }
}
