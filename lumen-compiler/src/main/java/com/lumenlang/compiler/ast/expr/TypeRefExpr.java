package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypePath;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.DynamicType;

/**
 * 类型引用（作为值使用的类/枚举）。
 */
public final class TypeRefExpr extends TypedNode {

    private final TypePath path;

    public TypeRefExpr(SourceLocation location, TypePath path) {
        super(location, DynamicType.INSTANCE);
        this.path = path;
    }

    public TypePath getPath() {
        return path;
    }

    @Override
    public String getTag() {
        return "typeExpr";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitTypeRef(this, context);
    }
}
