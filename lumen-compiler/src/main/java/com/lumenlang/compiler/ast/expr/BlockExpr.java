package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.LumenType;

import java.util.List;

/**
 * 块：按顺序执行的节点序列，值为最后一个节点的值。
 */
public final class BlockExpr extends TypedNode {

    private final List<TypedNode> statements;

    public BlockExpr(SourceLocation location, LumenType type, List<TypedNode> statements) {
        super(location, type);
        this.statements = statements;
    }

    public List<TypedNode> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public String getTag() {
        return "block";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
