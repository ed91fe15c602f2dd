package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.LocalVar;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.FunctionType;
import com.lumenlang.compiler.types.LumenType;

import java.util.ArrayList;
import java.util.List;

/**
 * 函数字面量（方法体同样以此表示）。
 */
public final class FunctionExpr extends TypedNode {

    private final List<Param> params;
    private final LumenType returnType;
    private final TypedNode body;

    public FunctionExpr(SourceLocation location, List<Param> params, LumenType returnType, TypedNode body) {
        super(location, functionType(params, returnType));
        this.params = params;
        this.returnType = returnType;
        this.body = body;
    }

    private static FunctionType functionType(List<Param> params, LumenType returnType) {
        List<FunctionType.Param> types = new ArrayList<>(params.size());
        for (Param p : params) {
            types.add(new FunctionType.Param(p.getVariable().getName(),
                    p.getVariable().getType(), p.getDefaultValue() != null));
        }
        return new FunctionType(types, returnType);
    }

    public List<Param> getParams() {
        return params;
    }

    public LumenType getReturnType() {
        return returnType;
    }

    public TypedNode getBody() {
        return body;
    }

    public FunctionExpr withBody(TypedNode newBody) {
        if (newBody == body) return this;
        return new FunctionExpr(location, params, returnType, newBody);
    }

    @Override
    public String getTag() {
        return "function";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitFunction(this, context);
    }

    /**
     * 参数：变量 + 可选的常量默认值。
     */
    public static final class Param {
        private final LocalVar variable;
        private final ConstantExpr defaultValue;

        public Param(LocalVar variable, ConstantExpr defaultValue) {
            this.variable = variable;
            this.defaultValue = defaultValue;
        }

        public Param(LocalVar variable) {
            this(variable, null);
        }

        public LocalVar getVariable() {
            return variable;
        }

        public ConstantExpr getDefaultValue() {
            return defaultValue;
        }
    }
}
