package com.lumenlang.compiler.types;

/**
 * 前端提供的"类型是否可空"判定。
 */
public interface NullabilityResolver {

    boolean isNullable(LumenType type);

    /**
     * 默认判定：读取类型自身的可空标记，未知类型视为可空。
     */
    NullabilityResolver DEFAULT = new NullabilityResolver() {
        @Override
        public boolean isNullable(LumenType type) {
            return type == null || type.isNullable();
        }
    };
}
