package com.lumenlang.ir.normalize;

import com.lumenlang.compiler.analysis.TreeQueries;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeScanner;
import com.lumenlang.compiler.ast.expr.FunctionExpr;
import com.lumenlang.compiler.ast.stmt.VarDeclStmt;
import com.lumenlang.ir.pass.BodyPass;
import com.lumenlang.ir.pass.PassContext;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 规范化 pass：把面向表达式的树改写为面向语句的树。
 * <p>
 * 输出满足：值位置上不出现块状表达式、赋值、复合赋值、自增自减、null 合并和控制转移，
 * 每个子表达式的求值次数与顺序与输入相同。每次运行使用独立的临时变量分配器。
 */
public final class Normalizer implements BodyPass {

    private static final Logger LOG = Logger.getLogger(Normalizer.class.getName());

    @Override
    public String getName() {
        return "Normalizer";
    }

    @Override
    public TypedNode run(TypedNode body, PassContext context) {
        return normalize(body);
    }

    /**
     * 规范化一个体。函数字面量保留为函数字面量，其余作为语句序列处理。
     */
    public TypedNode normalize(TypedNode body) {
        if (body == null) return null;
        TempVarNameGenerator temps = new TempVarNameGenerator();
        reserveExistingTemps(body, temps);
        SequenceNormalizer normalizer = new SequenceNormalizer(temps, TreeQueries.capturedVariables(body));
        TypedNode result = body instanceof FunctionExpr
                ? normalizer.function((FunctionExpr) body)
                : normalizer.body(body);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("规范化 " + body.getTag() + " " + body.getLocation()
                    + ", 临时变量 " + temps.getIssuedCount() + " 个");
        }
        return result;
    }

    // 再次规范化已规范化的树时，避免与已有临时变量重名
    private static void reserveExistingTemps(TypedNode body, TempVarNameGenerator temps) {
        new TypedNodeScanner<Void>() {
            @Override
            public Void visitVarDecl(VarDeclStmt node, Void ctx) {
                if (node.getVariable().isTemp()) temps.reserve(node.getVariable());
                return super.visitVarDecl(node, ctx);
            }

            @Override
            public Void visitFunction(FunctionExpr node, Void ctx) {
                for (FunctionExpr.Param p : node.getParams()) {
                    if (p.getVariable().isTemp()) temps.reserve(p.getVariable());
                }
                return super.visitFunction(node, ctx);
            }
        }.scan(body, null);
    }
}
