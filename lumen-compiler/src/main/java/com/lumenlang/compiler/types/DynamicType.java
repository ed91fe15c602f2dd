package com.lumenlang.compiler.types;

/**
 * 动态类型，总是可空。
 */
public class DynamicType extends LumenType {

    public static final DynamicType INSTANCE = new DynamicType();

    private DynamicType() {
        super(true);
    }

    @Override
    public LumenType withNullable(boolean nullable) {
        return this;
    }

    @Override
    public String toString() {
        return "Dynamic";
    }
}
