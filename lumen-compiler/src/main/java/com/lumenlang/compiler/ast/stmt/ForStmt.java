package com.lumenlang.compiler.ast.stmt;

import com.lumenlang.compiler.ast.LocalVar;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.VoidType;

/**
 * for (v in iterator) body，iterator 遵循 hasNext()/next() 协议。
 */
public final class ForStmt extends TypedNode {

    private final LocalVar variable;
    private final TypedNode iterator;
    private final TypedNode body;

    public ForStmt(SourceLocation location, LocalVar variable, TypedNode iterator, TypedNode body) {
        super(location, VoidType.INSTANCE);
        this.variable = variable;
        this.iterator = iterator;
        this.body = body;
    }

    public LocalVar getVariable() {
        return variable;
    }

    public TypedNode getIterator() {
        return iterator;
    }

    public TypedNode getBody() {
        return body;
    }

    @Override
    public String getTag() {
        return "for";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitFor(this, context);
    }
}
