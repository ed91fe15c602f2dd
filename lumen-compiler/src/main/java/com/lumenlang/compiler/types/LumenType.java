package com.lumenlang.compiler.types;

/**
 * 静态类型标签基类。
 * 由前端解析完毕后交给后端，后端只读取，不做推断。
 */
public abstract class LumenType {

    protected final boolean nullable;

    protected LumenType(boolean nullable) {
        this.nullable = nullable;
    }

    public boolean isNullable() {
        return nullable;
    }

    /**
     * 返回指定可空性的同一类型。
     */
    public abstract LumenType withNullable(boolean nullable);
}
