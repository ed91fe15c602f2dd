package com.lumenlang.ir.backend;

/**
 * 前端以标识符调用形式传入的目标语言内建操作。
 */
public enum Intrinsic {
    /** 原样输出 Lua 代码 */
    RAW_CODE("__lua__"),
    /** 按名字调用全局函数 */
    GLOBAL("__global__"),
    /** 重新解释类型，输出参数本身 */
    REINTERPRET("__reinterpret__"),
    /** 调用第一个参数 */
    CALL("__call__");

    private final String identifier;

    Intrinsic(String identifier) {
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }

    /**
     * 按标识符查找，未知返回 null。
     */
    public static Intrinsic forName(String name) {
        for (Intrinsic i : values()) {
            if (i.identifier.equals(name)) return i;
        }
        return null;
    }
}
