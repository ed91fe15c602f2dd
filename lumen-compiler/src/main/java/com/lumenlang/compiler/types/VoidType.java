package com.lumenlang.compiler.types;

/**
 * 无值类型（语句、循环、跳转）。
 */
public class VoidType extends LumenType {

    public static final VoidType INSTANCE = new VoidType();

    private VoidType() {
        super(false);
    }

    @Override
    public LumenType withNullable(boolean nullable) {
        return this;
    }

    @Override
    public String toString() {
        return "Void";
    }
}
