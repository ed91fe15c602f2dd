package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.LumenType;

/**
 * 数组下标访问 a[i]
 */
public final class ArrayIndexExpr extends TypedNode {

    private final TypedNode target;
    private final TypedNode index;

    public ArrayIndexExpr(SourceLocation location, LumenType type, TypedNode target, TypedNode index) {
        super(location, type);
        this.target = target;
        this.index = index;
    }

    public TypedNode getTarget() {
        return target;
    }

    public TypedNode getIndex() {
        return index;
    }

    @Override
    public String getTag() {
        return "array";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitArrayIndex(this, context);
    }
}
