package com.lumenlang.ir.backend;

import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.decl.Declaration;
import com.lumenlang.compiler.ast.expr.BlockExpr;

/**
 * Lua 代码打印器
 *
 * <p>输入为规范化后的树，输出只由节点与上下文决定；未支持的构造抛出
 * {@link UnsupportedConstructException}，不产生部分输出。</p>
 */
public class LuaPrinter {

    private final LuaExpressionPrinter expressions = new LuaExpressionPrinter();
    private final LuaStatementPrinter statements = new LuaStatementPrinter(expressions);

    public LuaPrinter() {
        expressions.setStatementPrinter(statements);
    }

    /**
     * 输出一个顶层声明。lowering 作用于其中每个体。
     */
    public String printDeclaration(Declaration decl, EmitConfig config, BodyLowering lowering) {
        EmissionContext ctx = new EmissionContext(config);
        decl.accept(new LuaDeclarationPrinter(expressions, statements, lowering), ctx);
        return ctx.getOutput();
    }

    /**
     * 把体作为顶层语句序列输出。
     */
    public String printStatements(TypedNode body, EmissionContext ctx) {
        if (body instanceof BlockExpr) {
            statements.printStatements(((BlockExpr) body).getStatements(), ctx, true);
        } else if (body != null) {
            statements.printStatement(body, ctx, true);
        }
        return ctx.getOutput();
    }

    /**
     * 输出单个值表达式（不换行）。
     */
    public String printExpression(TypedNode node, EmissionContext ctx) {
        expressions.print(node, ctx);
        return ctx.getOutput();
    }

    public String printExpression(TypedNode node, EmitConfig config) {
        return printExpression(node, new EmissionContext(config));
    }
}
