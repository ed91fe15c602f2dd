package com.lumenlang.compiler.types;

import java.util.Collections;
import java.util.List;

/**
 * 函数类型：(params) -> returnType。
 * 参数保留可选标记，null 安全检查需要区分可省略的参数。
 */
public class FunctionType extends LumenType {

    private final List<Param> params;
    private final LumenType returnType;

    public FunctionType(List<Param> params, LumenType returnType, boolean nullable) {
        super(nullable);
        this.params = params != null ? params : Collections.<Param>emptyList();
        this.returnType = returnType;
    }

    public FunctionType(List<Param> params, LumenType returnType) {
        this(params, returnType, false);
    }

    public List<Param> getParams() {
        return params;
    }

    public int getArity() {
        return params.size();
    }

    public LumenType getReturnType() {
        return returnType;
    }

    @Override
    public LumenType withNullable(boolean nullable) {
        return new FunctionType(params, returnType, nullable);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(params.get(i));
        }
        sb.append(") -> ").append(returnType);
        if (nullable) sb.append('?');
        return sb.toString();
    }

    /**
     * 函数参数描述。
     */
    public static final class Param {
        private final String name;
        private final LumenType type;
        private final boolean optional;

        public Param(String name, LumenType type, boolean optional) {
            this.name = name;
            this.type = type;
            this.optional = optional;
        }

        public String getName() {
            return name;
        }

        public LumenType getType() {
            return type;
        }

        public boolean isOptional() {
            return optional;
        }

        @Override
        public String toString() {
            return (optional ? "?" : "") + name + ": " + type;
        }
    }
}
