package com.lumenlang.compiler.ast;

import com.lumenlang.compiler.types.LumenType;

/**
 * 局部变量。id 由前端分配，必须小于 {@link #TEMP_ID_BASE}；
 * 该值以上的 id 保留给后端生成的临时变量。
 */
public final class LocalVar {

    /** 临时变量 id 命名空间起点 */
    public static final int TEMP_ID_BASE = 1_000_000_000;

    private final int id;
    private final String name;
    private final LumenType type;

    private LocalVar(int id, String name, LumenType type) {
        this.id = id;
        this.name = name;
        this.type = type;
    }

    /**
     * 前端变量。
     */
    public static LocalVar of(int id, String name, LumenType type) {
        if (id < 0 || id >= TEMP_ID_BASE) {
            throw new IllegalArgumentException("Front-end variable id out of range: " + id + " (" + name + ")");
        }
        return new LocalVar(id, name, type);
    }

    /**
     * 后端临时变量，名字由 id 派生。
     */
    public static LocalVar temp(int id, LumenType type) {
        if (id < TEMP_ID_BASE) {
            throw new IllegalArgumentException("Temp variable id below reserved range: " + id);
        }
        return new LocalVar(id, "_hx_t" + (id - TEMP_ID_BASE), type);
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public LumenType getType() {
        return type;
    }

    public boolean isTemp() {
        return id >= TEMP_ID_BASE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LocalVar && ((LocalVar) o).id == id;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
