package com.lumenlang.ir;

import com.lumenlang.compiler.ast.SourceLocation;

/**
 * 后端内部不变量被破坏：规范化形式不成立、临时变量 id 冲突等。
 * 出现即说明后端自身有 bug，而不是输入有误。
 */
public class InternalInvariantException extends RuntimeException {
    private final SourceLocation location;

    public InternalInvariantException(String message) {
        this(message, null);
    }

    public InternalInvariantException(String message, SourceLocation location) {
        super(message);
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        if (location == null) return super.getMessage();
        return super.getMessage() + " at " + location;
    }
}
