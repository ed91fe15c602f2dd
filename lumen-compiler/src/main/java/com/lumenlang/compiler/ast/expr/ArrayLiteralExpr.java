package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.LumenType;

import java.util.List;

/**
 * 数组字面量
 */
public final class ArrayLiteralExpr extends TypedNode {

    private final List<TypedNode> elements;

    public ArrayLiteralExpr(SourceLocation location, LumenType type, List<TypedNode> elements) {
        super(location, type);
        this.elements = elements;
    }

    public List<TypedNode> getElements() {
        return elements;
    }

    @Override
    public String getTag() {
        return "arrayDecl";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitArrayLiteral(this, context);
    }
}
