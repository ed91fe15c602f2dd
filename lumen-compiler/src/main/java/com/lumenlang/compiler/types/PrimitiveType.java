package com.lumenlang.compiler.types;

/**
 * 基本类型：INT, FLOAT, BOOL, STRING。
 */
public class PrimitiveType extends LumenType {

    public enum Kind {
        INT, FLOAT, BOOL, STRING
    }

    private final Kind kind;

    public PrimitiveType(Kind kind, boolean nullable) {
        super(nullable);
        this.kind = kind;
    }

    public PrimitiveType(Kind kind) {
        this(kind, false);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    @Override
    public LumenType withNullable(boolean nullable) {
        return new PrimitiveType(kind, nullable);
    }

    @Override
    public String toString() {
        return kind.name() + (nullable ? "?" : "");
    }
}
