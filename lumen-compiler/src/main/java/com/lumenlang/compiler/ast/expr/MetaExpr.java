package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;

/**
 * 附带元数据的节点，元数据不影响生成代码。
 */
public final class MetaExpr extends TypedNode {

    private final String name;
    private final TypedNode inner;

    public MetaExpr(SourceLocation location, String name, TypedNode inner) {
        super(location, inner.getType());
        this.name = name;
        this.inner = inner;
    }

    public String getName() {
        return name;
    }

    public TypedNode getInner() {
        return inner;
    }

    @Override
    public String getTag() {
        return "meta";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitMeta(this, context);
    }
}
