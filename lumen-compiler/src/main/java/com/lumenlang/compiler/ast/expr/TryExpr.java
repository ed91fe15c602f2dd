package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.LocalVar;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.LumenType;

import java.util.List;

/**
 * try/catch。最后一个 catch 子句约定为兜底处理器，绑定任意错误值。
 */
public final class TryExpr extends TypedNode {

    private final TypedNode body;
    private final List<Catch> catches;

    public TryExpr(SourceLocation location, LumenType type, TypedNode body, List<Catch> catches) {
        super(location, type);
        this.body = body;
        this.catches = catches;
    }

    public TypedNode getBody() {
        return body;
    }

    public List<Catch> getCatches() {
        return catches;
    }

    /**
     * 兜底 catch 子句，没有 catch 时为 null。
     */
    public Catch getCatchAll() {
        return catches.isEmpty() ? null : catches.get(catches.size() - 1);
    }

    @Override
    public String getTag() {
        return "try";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitTry(this, context);
    }

    public static final class Catch {
        private final LocalVar variable;
        private final TypedNode body;

        public Catch(LocalVar variable, TypedNode body) {
            this.variable = variable;
            this.body = body;
        }

        public LocalVar getVariable() {
            return variable;
        }

        public TypedNode getBody() {
            return body;
        }
    }
}
