package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.Types;

/**
 * 取枚举值的构造器序号。
 */
public final class EnumIndexExpr extends TypedNode {

    private final TypedNode target;

    public EnumIndexExpr(SourceLocation location, TypedNode target) {
        super(location, Types.INT);
        this.target = target;
    }

    public TypedNode getTarget() {
        return target;
    }

    @Override
    public String getTag() {
        return "enumIndex";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitEnumIndex(this, context);
    }
}
