package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.LumenType;

import java.util.List;

/**
 * switch：按顺序匹配，第一个命中的分支生效；同一分支的多个值互为备选。
 */
public final class SwitchExpr extends TypedNode {

    private final TypedNode subject;
    private final List<Case> cases;
    private final TypedNode defaultBody;  // nullable

    public SwitchExpr(SourceLocation location, LumenType type, TypedNode subject,
                      List<Case> cases, TypedNode defaultBody) {
        super(location, type);
        this.subject = subject;
        this.cases = cases;
        this.defaultBody = defaultBody;
    }

    public TypedNode getSubject() {
        return subject;
    }

    public List<Case> getCases() {
        return cases;
    }

    public TypedNode getDefaultBody() {
        return defaultBody;
    }

    public boolean hasDefault() {
        return defaultBody != null;
    }

    @Override
    public String getTag() {
        return "switch";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitSwitch(this, context);
    }

    public static final class Case {
        private final List<TypedNode> values;
        private final TypedNode body;

        public Case(List<TypedNode> values, TypedNode body) {
            this.values = values;
            this.body = body;
        }

        public List<TypedNode> getValues() {
            return values;
        }

        public TypedNode getBody() {
            return body;
        }
    }
}
