package com.lumenlang.compiler.ast.decl;

import com.lumenlang.compiler.ast.FieldRef;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.expr.FunctionExpr;
import com.lumenlang.compiler.types.LumenType;

/**
 * 类成员（字段或方法）。方法的 expression 是 {@link FunctionExpr}。
 */
public final class FieldDecl {

    public enum FieldKind {
        VAR, METHOD
    }

    private final SourceLocation location;
    private final String name;
    private final FieldKind kind;
    private final LumenType type;
    private final TypedNode expression;  // nullable
    private final String nativeName;     // nullable

    public FieldDecl(SourceLocation location, String name, FieldKind kind, LumenType type,
                     TypedNode expression, String nativeName) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.expression = expression;
        this.nativeName = nativeName;
    }

    public static FieldDecl var(SourceLocation loc, String name, LumenType type, TypedNode init) {
        return new FieldDecl(loc, name, FieldKind.VAR, type, init, null);
    }

    public static FieldDecl method(SourceLocation loc, String name, FunctionExpr function) {
        return new FieldDecl(loc, name, FieldKind.METHOD, function.getType(), function, null);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public FieldKind getKind() {
        return kind;
    }

    public boolean isMethod() {
        return kind == FieldKind.METHOD;
    }

    public LumenType getType() {
        return type;
    }

    public TypedNode getExpression() {
        return expression;
    }

    public String getNativeName() {
        return nativeName;
    }

    /**
     * 目标代码中的成员名。
     */
    public String getTargetName() {
        return nativeName != null ? nativeName : name;
    }

    public FieldRef toRef() {
        return new FieldRef(name, isMethod(), nativeName);
    }
}
