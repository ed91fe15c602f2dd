package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.ast.decl.EnumConstructor;
import com.lumenlang.compiler.types.LumenType;

/**
 * 取枚举值第 index 个构造参数。
 */
public final class EnumParameterExpr extends TypedNode {

    private final TypedNode target;
    private final EnumConstructor constructor;
    private final int index;

    public EnumParameterExpr(SourceLocation location, LumenType type, TypedNode target,
                             EnumConstructor constructor, int index) {
        super(location, type);
        this.target = target;
        this.constructor = constructor;
        this.index = index;
    }

    public TypedNode getTarget() {
        return target;
    }

    public EnumConstructor getConstructor() {
        return constructor;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public String getTag() {
        return "enumParameter";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitEnumParameter(this, context);
    }
}
