package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypePath;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.LumenType;

import java.util.List;

/**
 * 构造器调用 new T(args)
 */
public final class NewExpr extends TypedNode {

    private final TypePath classPath;
    private final List<TypedNode> args;

    public NewExpr(SourceLocation location, LumenType type, TypePath classPath, List<TypedNode> args) {
        super(location, type);
        this.classPath = classPath;
        this.args = args;
    }

    public TypePath getClassPath() {
        return classPath;
    }

    public List<TypedNode> getArgs() {
        return args;
    }

    @Override
    public String getTag() {
        return "new";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitNew(this, context);
    }
}
