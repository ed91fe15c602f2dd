package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.DynamicType;
import com.lumenlang.compiler.types.LumenType;
import com.lumenlang.compiler.types.Types;

/**
 * 常量：字面量、null、this、super。
 */
public final class ConstantExpr extends TypedNode {

    private final Object value;
    private final ConstantKind kind;

    public ConstantExpr(SourceLocation location, LumenType type, Object value, ConstantKind kind) {
        super(location, type);
        this.value = value;
        this.kind = kind;
    }

    public static ConstantExpr ofInt(SourceLocation loc, long value) {
        return new ConstantExpr(loc, Types.INT, value, ConstantKind.INT);
    }

    public static ConstantExpr ofFloat(SourceLocation loc, double value) {
        return new ConstantExpr(loc, Types.FLOAT, value, ConstantKind.FLOAT);
    }

    public static ConstantExpr ofString(SourceLocation loc, String value) {
        return new ConstantExpr(loc, Types.STRING, value, ConstantKind.STRING);
    }

    public static ConstantExpr ofBool(SourceLocation loc, boolean value) {
        return new ConstantExpr(loc, Types.BOOL, value, ConstantKind.BOOL);
    }

    public static ConstantExpr ofNull(SourceLocation loc) {
        return new ConstantExpr(loc, DynamicType.INSTANCE, null, ConstantKind.NULL);
    }

    public static ConstantExpr ofThis(SourceLocation loc, LumenType type) {
        return new ConstantExpr(loc, type, null, ConstantKind.THIS);
    }

    public static ConstantExpr ofSuper(SourceLocation loc, LumenType type) {
        return new ConstantExpr(loc, type, null, ConstantKind.SUPER);
    }

    public Object getValue() {
        return value;
    }

    public ConstantKind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == ConstantKind.NULL;
    }

    @Override
    public String getTag() {
        return "constant";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitConstant(this, context);
    }

    /**
     * 常量种类
     */
    public enum ConstantKind {
        INT,
        FLOAT,
        STRING,
        BOOL,
        NULL,
        THIS,
        SUPER
    }
}
