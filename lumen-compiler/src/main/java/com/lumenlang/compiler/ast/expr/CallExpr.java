package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.LumenType;

import java.util.List;

/**
 * 函数/方法调用
 */
public final class CallExpr extends TypedNode {

    private final TypedNode callee;
    private final List<TypedNode> args;

    public CallExpr(SourceLocation location, LumenType type, TypedNode callee, List<TypedNode> args) {
        super(location, type);
        this.callee = callee;
        this.args = args;
    }

    public TypedNode getCallee() {
        return callee;
    }

    public List<TypedNode> getArgs() {
        return args;
    }

    /**
     * callee 为未解析标识符时返回其名字（编译器内建标记），否则 null。
     */
    public String getIntrinsicName() {
        return callee instanceof IdentExpr ? ((IdentExpr) callee).getName() : null;
    }

    @Override
    public String getTag() {
        return "call";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }
}
