package com.lumenlang.compiler.ast.stmt;

import com.lumenlang.compiler.ast.LocalVar;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.VoidType;

/**
 * 局部变量声明 var v [= init]
 */
public final class VarDeclStmt extends TypedNode {

    private final LocalVar variable;
    private final TypedNode initializer;  // nullable

    public VarDeclStmt(SourceLocation location, LocalVar variable, TypedNode initializer) {
        super(location, VoidType.INSTANCE);
        this.variable = variable;
        this.initializer = initializer;
    }

    public LocalVar getVariable() {
        return variable;
    }

    public TypedNode getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override
    public String getTag() {
        return "var";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitVarDecl(this, context);
    }
}
