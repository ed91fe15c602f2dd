package com.lumenlang.compiler.ast;

import com.lumenlang.compiler.types.LumenType;

/**
 * 类型化语法树节点基类。
 * <p>
 * 节点集合是封闭的：每个标签对应 {@link TypedNodeVisitor} 中的一个方法，没有默认实现，
 * 新增标签会让所有遍历（规范化、打印、null 检查）在编译期出现缺口。
 * 节点不可变，所有 pass 都返回新树。
 */
public abstract class TypedNode {

    protected final SourceLocation location;
    protected final LumenType type;

    protected TypedNode(SourceLocation location, LumenType type) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.type = type;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public LumenType getType() {
        return type;
    }

    /**
     * 诊断中使用的节点标签名。
     */
    public abstract String getTag();

    public abstract <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context);
}
