package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.DynamicType;

/**
 * 未解析标识符。只在前端内部出现；作为调用目标时表示编译器内建标记（如 {@code __lua__}），
 * 其他位置没有目标代码形式。
 */
public final class IdentExpr extends TypedNode {

    private final String name;

    public IdentExpr(SourceLocation location, String name) {
        super(location, DynamicType.INSTANCE);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String getTag() {
        return "ident";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitIdent(this, context);
    }
}
