package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypePath;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.LumenType;

/**
 * 类型转换。targetPath 为 null 时是不检查的静态转换。
 */
public final class CastExpr extends TypedNode {

    private final TypedNode inner;
    private final TypePath targetPath;

    public CastExpr(SourceLocation location, LumenType type, TypedNode inner, TypePath targetPath) {
        super(location, type);
        this.inner = inner;
        this.targetPath = targetPath;
    }

    public TypedNode getInner() {
        return inner;
    }

    public TypePath getTargetPath() {
        return targetPath;
    }

    public boolean isChecked() {
        return targetPath != null;
    }

    @Override
    public String getTag() {
        return "cast";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitCast(this, context);
    }
}
