package com.lumenlang.compiler.ast.decl;

import com.lumenlang.compiler.types.FunctionType;

import java.util.Collections;
import java.util.List;

/**
 * 枚举构造器。params 为空表示无参构造器（常量值）。
 */
public final class EnumConstructor {

    private final String name;
    private final int index;
    private final List<FunctionType.Param> params;

    public EnumConstructor(String name, int index, List<FunctionType.Param> params) {
        this.name = name;
        this.index = index;
        this.params = params != null ? params : Collections.<FunctionType.Param>emptyList();
    }

    public String getName() {
        return name;
    }

    public int getIndex() {
        return index;
    }

    public List<FunctionType.Param> getParams() {
        return params;
    }

    public boolean hasParams() {
        return !params.isEmpty();
    }

    @Override
    public String toString() {
        return name;
    }
}
