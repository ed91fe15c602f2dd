package com.lumenlang.compiler.ast.stmt;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.VoidType;

/**
 * while 循环。testBefore 为 false 时是 do-while（先执行后判断）。
 */
public final class WhileStmt extends TypedNode {

    private final TypedNode condition;
    private final TypedNode body;
    private final boolean testBefore;

    public WhileStmt(SourceLocation location, TypedNode condition, TypedNode body, boolean testBefore) {
        super(location, VoidType.INSTANCE);
        this.condition = condition;
        this.body = body;
        this.testBefore = testBefore;
    }

    public TypedNode getCondition() {
        return condition;
    }

    public TypedNode getBody() {
        return body;
    }

    public boolean isTestBefore() {
        return testBefore;
    }

    @Override
    public String getTag() {
        return "while";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitWhile(this, context);
    }
}
