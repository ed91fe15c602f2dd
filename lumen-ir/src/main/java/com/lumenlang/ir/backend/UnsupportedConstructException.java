package com.lumenlang.ir.backend;

import com.lumenlang.compiler.ast.SourceLocation;

/**
 * 输入树中出现目标语言无法表达的构造。
 */
public class UnsupportedConstructException extends RuntimeException {
    private final SourceLocation location;
    private final String construct;

    public UnsupportedConstructException(String message, String construct, SourceLocation location) {
        super(message);
        this.construct = construct;
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /**
     * 出错节点的标签，如 "ident"、"super"。
     */
    public String getConstruct() {
        return construct;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (construct != null) {
            sb.append(" (").append(construct).append(')');
        }
        if (location != null) {
            sb.append(" at ").append(location);
        }
        return sb.toString();
    }
}
