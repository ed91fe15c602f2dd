package com.lumenlang.compiler.types;

/**
 * 常用类型实例。
 */
public final class Types {

    public static final PrimitiveType INT = new PrimitiveType(PrimitiveType.Kind.INT);
    public static final PrimitiveType FLOAT = new PrimitiveType(PrimitiveType.Kind.FLOAT);
    public static final PrimitiveType BOOL = new PrimitiveType(PrimitiveType.Kind.BOOL);
    public static final PrimitiveType STRING = new PrimitiveType(PrimitiveType.Kind.STRING);
    public static final PrimitiveType NULLABLE_STRING = new PrimitiveType(PrimitiveType.Kind.STRING, true);

    private Types() {
    }

    public static boolean isString(LumenType type) {
        return type instanceof PrimitiveType && ((PrimitiveType) type).isString();
    }

    public static boolean isVoid(LumenType type) {
        return type instanceof VoidType;
    }
}
