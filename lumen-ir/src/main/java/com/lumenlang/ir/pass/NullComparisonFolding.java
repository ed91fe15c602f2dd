package com.lumenlang.ir.pass;

import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeTransformer;
import com.lumenlang.compiler.ast.TypedNodes;
import com.lumenlang.compiler.ast.expr.BinaryExpr;
import com.lumenlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.lumenlang.compiler.ast.expr.ConstantExpr;
import com.lumenlang.compiler.types.NullabilityResolver;

/**
 * null 比较折叠：
 * <ul>
 *   <li>{@code null == null} → true，{@code null != null} → false</li>
 *   <li>一侧为 null、另一侧类型不可为 null 且求值无副作用 → {@code ==} 为 false，{@code !=} 为 true</li>
 * </ul>
 * 折叠结果是布尔常量，再次运行不会改变，因此幂等。
 */
public class NullComparisonFolding extends TypedNodeTransformer implements BodyPass {

    private final NullabilityResolver resolver;

    public NullComparisonFolding() {
        this(NullabilityResolver.DEFAULT);
    }

    public NullComparisonFolding(NullabilityResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public String getName() {
        return "NullComparisonFolding";
    }

    @Override
    public TypedNode run(TypedNode body, PassContext context) {
        NullabilityResolver r = context != null ? context.getNullability() : resolver;
        if (r == resolver) return transform(body);
        return new NullComparisonFolding(r).transform(body);
    }

    @Override
    public TypedNode visitBinary(BinaryExpr node, Void ctx) {
        TypedNode result = super.visitBinary(node, ctx);
        if (result instanceof BinaryExpr) {
            TypedNode folded = tryFold((BinaryExpr) result);
            if (folded != null) return folded;
        }
        return result;
    }

    private TypedNode tryFold(BinaryExpr expr) {
        BinaryOp op = expr.getOperator();
        if (op != BinaryOp.EQ && op != BinaryOp.NE) return null;

        boolean leftNull = TypedNodes.isNullConstant(expr.getLeft());
        boolean rightNull = TypedNodes.isNullConstant(expr.getRight());
        boolean equal;
        if (leftNull && rightNull) {
            equal = true;
        } else if (leftNull || rightNull) {
            TypedNode other = leftNull ? expr.getRight() : expr.getLeft();
            // 丢弃的操作数不能有可观察副作用
            if (resolver.isNullable(other.getType()) || !TypedNodes.isSideEffectFree(other)) {
                return null;
            }
            equal = false;
        } else {
            return null;
        }
        return ConstantExpr.ofBool(expr.getLocation(), op == BinaryOp.EQ ? equal : !equal);
    }
}
