package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.FieldRef;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypePath;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.LumenType;

/**
 * 字段访问。STATIC / ENUM_CONSTRUCTOR 访问的 target 是 {@link TypeRefExpr}。
 */
public final class FieldAccessExpr extends TypedNode {

    private final TypedNode target;
    private final FieldRef field;
    private final FieldAccessKind kind;

    public FieldAccessExpr(SourceLocation location, LumenType type, TypedNode target,
                           FieldRef field, FieldAccessKind kind) {
        super(location, type);
        this.target = target;
        this.field = field;
        this.kind = kind;
    }

    public TypedNode getTarget() {
        return target;
    }

    public FieldRef getField() {
        return field;
    }

    public FieldAccessKind getKind() {
        return kind;
    }

    /**
     * 静态访问时所属类型的路径，否则为 null。
     */
    public TypePath getOwnerPath() {
        return target instanceof TypeRefExpr ? ((TypeRefExpr) target).getPath() : null;
    }

    public FieldAccessExpr withTarget(TypedNode newTarget) {
        if (newTarget == target) return this;
        return new FieldAccessExpr(location, type, newTarget, field, kind);
    }

    @Override
    public String getTag() {
        return "field";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitFieldAccess(this, context);
    }
}
