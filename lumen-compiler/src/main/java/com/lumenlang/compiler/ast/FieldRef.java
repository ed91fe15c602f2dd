package com.lumenlang.compiler.ast;

/**
 * 字段访问所引用的成员。
 * nativeName 非空时，成员在目标代码中必须保持该名字（外部互操作）。
 */
public final class FieldRef {

    private final String name;
    private final boolean method;
    private final String nativeName;

    public FieldRef(String name, boolean method, String nativeName) {
        this.name = name;
        this.method = method;
        this.nativeName = nativeName;
    }

    public static FieldRef var(String name) {
        return new FieldRef(name, false, null);
    }

    public static FieldRef method(String name) {
        return new FieldRef(name, true, null);
    }

    public static FieldRef nativeMethod(String name, String nativeName) {
        return new FieldRef(name, true, nativeName);
    }

    public String getName() {
        return name;
    }

    public boolean isMethod() {
        return method;
    }

    public String getNativeName() {
        return nativeName;
    }

    public boolean isNative() {
        return nativeName != null;
    }

    /**
     * 目标代码中使用的名字。
     */
    public String getTargetName() {
        return nativeName != null ? nativeName : name;
    }

    @Override
    public String toString() {
        return name;
    }
}
