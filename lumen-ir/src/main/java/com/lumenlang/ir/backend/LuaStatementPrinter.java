package com.lumenlang.ir.backend;

import com.lumenlang.compiler.analysis.TreeQueries;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.ast.TypedNodes;
import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.stmt.*;
import com.lumenlang.compiler.types.LumenType;
import com.lumenlang.compiler.types.Types;
import com.lumenlang.ir.InternalInvariantException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Logger;

/**
 * 语句位置的 Lua 输出。每条语句独占一行（或多行），结尾换行。
 */
final class LuaStatementPrinter implements TypedNodeVisitor<Void, EmissionContext> {

    private static final Logger LOG = Logger.getLogger(LuaStatementPrinter.class.getName());

    private final LuaExpressionPrinter expressions;

    LuaStatementPrinter(LuaExpressionPrinter expressions) {
        this.expressions = expressions;
    }

    // ============ 入口 ============

    void printStatement(TypedNode node, EmissionContext ctx, boolean tail) {
        ctx.setTailPosition(tail);
        node.accept(this, ctx);
    }

    void printStatements(List<TypedNode> statements, EmissionContext ctx, boolean tail) {
        for (int i = 0; i < statements.size(); i++) {
            printStatement(statements.get(i), ctx, tail && i == statements.size() - 1);
        }
    }

    /**
     * 分支体：块直接展开为语句（分支本身就是 Lua 块）。
     */
    private void printBranch(TypedNode branch, EmissionContext ctx) {
        ctx.indent();
        if (branch instanceof BlockExpr) {
            printStatements(((BlockExpr) branch).getStatements(), ctx, true);
        } else if (branch != null) {
            printStatement(branch, ctx, true);
        }
        ctx.dedent();
    }

    /**
     * 函数体：块体展开为语句；表达式体在有返回类型时返回其值。
     */
    void printFunctionBody(TypedNode body, LumenType returnType, EmissionContext ctx) {
        if (body == null) return;
        if (body instanceof BlockExpr) {
            printStatements(((BlockExpr) body).getStatements(), ctx, true);
        } else if (returnType != null && !Types.isVoid(returnType)) {
            printResult(body, ctx);
        } else {
            printStatement(body, ctx, true);
        }
    }

    /**
     * 输出"返回 node 的值"的语句，用于值位置的块状表达式。
     */
    void printResult(TypedNode node, EmissionContext ctx) {
        TypedNode n = TypedNodes.unwrap(node);
        if (n instanceof BlockExpr) {
            List<TypedNode> stmts = ((BlockExpr) n).getStatements();
            if (stmts.isEmpty()) return;
            printStatements(stmts.subList(0, stmts.size() - 1), ctx, false);
            printResult(stmts.get(stmts.size() - 1), ctx);
        } else if (n instanceof IfExpr) {
            IfExpr ifExpr = (IfExpr) n;
            ctx.append("if ");
            expressions.print(ifExpr.getCondition(), ctx);
            ctx.line(" then");
            printResultBranch(ifExpr.getThenBranch(), ctx);
            if (ifExpr.hasElse()) {
                ctx.line("else");
                printResultBranch(ifExpr.getElseBranch(), ctx);
            }
            ctx.line("end");
        } else if (n instanceof SwitchExpr) {
            printSwitch((SwitchExpr) n, ctx, true);
        } else if (n instanceof TryExpr) {
            printTry((TryExpr) n, ctx, true);
        } else if (isStatementOnly(n)) {
            printStatement(n, ctx, true);
        } else {
            ctx.append("return ");
            expressions.print(n, ctx);
            ctx.newLine();
        }
    }

    private void printResultBranch(TypedNode branch, EmissionContext ctx) {
        ctx.indent();
        printResult(branch, ctx);
        ctx.dedent();
    }

    private static boolean isStatementOnly(TypedNode node) {
        return node instanceof VarDeclStmt || node instanceof WhileStmt || node instanceof ForStmt
                || node instanceof ReturnStmt || node instanceof BreakStmt
                || node instanceof ContinueStmt || node instanceof ThrowStmt;
    }

    private static boolean isEmpty(TypedNode branch) {
        return branch == null || (branch instanceof BlockExpr && ((BlockExpr) branch).isEmpty());
    }

    private static UnsupportedConstructException unsupported(String message, TypedNode node) {
        return new UnsupportedConstructException(message, node.getTag(), node.getLocation());
    }

    // ============ 表达式语句 ============

    /**
     * 无副作用的表达式直接丢弃；调用原样输出；其余写成 local _ = x。
     */
    private Void expressionStatement(TypedNode node, EmissionContext ctx) {
        if (TypedNodes.isSideEffectFree(node)) return null;
        ctx.append("local _ = ");
        expressions.print(node, ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitConstant(ConstantExpr node, EmissionContext ctx) {
        if (node.getKind() == ConstantExpr.ConstantKind.THIS && !ctx.isInstanceContext()) {
            throw unsupported("'this' used outside an instance context", node);
        }
        return null;
    }

    @Override
    public Void visitLocalRef(LocalRefExpr node, EmissionContext ctx) {
        return null;
    }

    @Override
    public Void visitFieldAccess(FieldAccessExpr node, EmissionContext ctx) {
        return expressionStatement(node, ctx);
    }

    @Override
    public Void visitArrayIndex(ArrayIndexExpr node, EmissionContext ctx) {
        return expressionStatement(node, ctx);
    }

    @Override
    public Void visitParen(ParenExpr node, EmissionContext ctx) {
        printStatement(node.getInner(), ctx, ctx.isTailPosition());
        return null;
    }

    @Override
    public Void visitObjectLiteral(ObjectLiteralExpr node, EmissionContext ctx) {
        return expressionStatement(node, ctx);
    }

    @Override
    public Void visitArrayLiteral(ArrayLiteralExpr node, EmissionContext ctx) {
        return expressionStatement(node, ctx);
    }

    @Override
    public Void visitTypeRef(TypeRefExpr node, EmissionContext ctx) {
        return null;
    }

    @Override
    public Void visitCall(CallExpr node, EmissionContext ctx) {
        Intrinsic intrinsic = Intrinsic.forName(node.getIntrinsicName());
        if (intrinsic == Intrinsic.REINTERPRET && node.getArgs().size() == 1) {
            return expressionStatement(node.getArgs().get(0), ctx);
        }
        expressions.print(node, ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitNew(NewExpr node, EmissionContext ctx) {
        expressions.print(node, ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr node, EmissionContext ctx) {
        switch (node.getOperator()) {
            case ASSIGN:
                expressions.print(node.getLeft(), ctx);
                ctx.append(" = ");
                expressions.print(node.getRight(), ctx);
                ctx.newLine();
                return null;
            case ASSIGN_OP: {
                // a op= b  →  a = a op b
                BinaryExpr expanded = new BinaryExpr(node.getLocation(), node.getType(),
                        node.getCompoundOp(), node.getLeft(), node.getRight());
                expressions.print(node.getLeft(), ctx);
                ctx.append(" = ");
                expressions.print(expanded, ctx);
                ctx.newLine();
                return null;
            }
            case NULL_COALESCE:
                throw new InternalInvariantException("Null coalescing was not normalized", node.getLocation());
            default:
                return expressionStatement(node, ctx);
        }
    }

    @Override
    public Void visitUnary(UnaryExpr node, EmissionContext ctx) {
        if (!node.isMutation()) return expressionStatement(node, ctx);
        BinaryExpr.BinaryOp op = node.getOperator() == UnaryExpr.UnaryOp.INCREMENT
                ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB;
        BinaryExpr expanded = new BinaryExpr(node.getLocation(), node.getType(), op,
                node.getOperand(), ConstantExpr.ofInt(node.getLocation(), 1));
        expressions.print(node.getOperand(), ctx);
        ctx.append(" = ");
        expressions.print(expanded, ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitFunction(FunctionExpr node, EmissionContext ctx) {
        return null;
    }

    @Override
    public Void visitCast(CastExpr node, EmissionContext ctx) {
        return expressionStatement(node, ctx);
    }

    @Override
    public Void visitMeta(MetaExpr node, EmissionContext ctx) {
        printStatement(node.getInner(), ctx, ctx.isTailPosition());
        return null;
    }

    @Override
    public Void visitEnumParameter(EnumParameterExpr node, EmissionContext ctx) {
        return expressionStatement(node, ctx);
    }

    @Override
    public Void visitEnumIndex(EnumIndexExpr node, EmissionContext ctx) {
        return expressionStatement(node, ctx);
    }

    @Override
    public Void visitIdent(IdentExpr node, EmissionContext ctx) {
        throw unsupported("Unresolved identifier '" + node.getName() + "'", node);
    }

    // ============ 块与条件 ============

    @Override
    public Void visitBlock(BlockExpr node, EmissionContext ctx) {
        if (node.isEmpty()) return null;
        ctx.line("do");
        ctx.indent();
        printStatements(node.getStatements(), ctx, true);
        ctx.dedent();
        ctx.line("end");
        return null;
    }

    @Override
    public Void visitIf(IfExpr node, EmissionContext ctx) {
        boolean thenEmpty = isEmpty(node.getThenBranch());
        boolean elseEmpty = isEmpty(node.getElseBranch());

        if (thenEmpty && !elseEmpty) {
            ctx.append("if not ");
            expressions.printOperand(node.getCondition(), ctx);
            ctx.line(" then");
            printBranch(node.getElseBranch(), ctx);
            ctx.line("end");
            return null;
        }

        ctx.append("if ");
        expressions.print(node.getCondition(), ctx);
        ctx.line(" then");
        printBranch(node.getThenBranch(), ctx);

        TypedNode rest = elseEmpty ? null : node.getElseBranch();
        while (rest != null) {
            TypedNode elseIf = singleIf(rest);
            if (elseIf == null) {
                ctx.line("else");
                printBranch(rest, ctx);
                break;
            }
            IfExpr chained = (IfExpr) elseIf;
            ctx.append("elseif ");
            expressions.print(chained.getCondition(), ctx);
            ctx.line(" then");
            printBranch(chained.getThenBranch(), ctx);
            rest = isEmpty(chained.getElseBranch()) ? null : chained.getElseBranch();
        }
        ctx.line("end");
        return null;
    }

    /**
     * else 分支若只有一个 if，返回它以便输出 elseif。
     */
    private static TypedNode singleIf(TypedNode branch) {
        if (branch instanceof IfExpr) return branch;
        if (branch instanceof BlockExpr) {
            List<TypedNode> stmts = ((BlockExpr) branch).getStatements();
            if (stmts.size() == 1 && stmts.get(0) instanceof IfExpr) return stmts.get(0);
        }
        return null;
    }

    @Override
    public Void visitSwitch(SwitchExpr node, EmissionContext ctx) {
        printSwitch(node, ctx, false);
        return null;
    }

    /**
     * switch → if/elseif 级联，第一个匹配的 case 生效。
     */
    private void printSwitch(SwitchExpr node, EmissionContext ctx, boolean asResult) {
        List<SwitchExpr.Case> cases = new ArrayList<>();
        for (SwitchExpr.Case c : node.getCases()) {
            if (!c.getValues().isEmpty()) cases.add(c);
        }

        TypedNode subject = node.getSubject();
        boolean reuseSubject = subject instanceof LocalRefExpr || subject instanceof ConstantExpr;
        String subjectName = null;
        boolean scoped = !reuseSubject || cases.isEmpty();
        if (scoped) {
            ctx.line("do");
            ctx.indent();
        }
        if (!reuseSubject) {
            subjectName = "_hx_sw_" + ctx.nextLabel();
            ctx.append("local " + subjectName + " = ");
            expressions.print(subject, ctx);
            ctx.newLine();
        }

        if (cases.isEmpty()) {
            if (node.hasDefault()) {
                printCaseBody(node.getDefaultBody(), ctx, asResult, false);
            }
        } else {
            for (int i = 0; i < cases.size(); i++) {
                ctx.append(i == 0 ? "if " : "elseif ");
                List<TypedNode> values = cases.get(i).getValues();
                for (int j = 0; j < values.size(); j++) {
                    if (j > 0) ctx.append(" or ");
                    if (subjectName != null) {
                        ctx.append(subjectName);
                    } else {
                        expressions.printOperand(subject, ctx);
                    }
                    ctx.append(" == ");
                    expressions.printOperand(values.get(j), ctx);
                }
                ctx.line(" then");
                printCaseBody(cases.get(i).getBody(), ctx, asResult, true);
            }
            if (node.hasDefault()) {
                ctx.line("else");
                printCaseBody(node.getDefaultBody(), ctx, asResult, true);
            }
            ctx.line("end");
        }

        if (scoped) {
            ctx.dedent();
            ctx.line("end");
        }
    }

    private void printCaseBody(TypedNode body, EmissionContext ctx, boolean asResult, boolean indented) {
        if (indented) ctx.indent();
        if (asResult) {
            printResult(body, ctx);
        } else if (body instanceof BlockExpr) {
            printStatements(((BlockExpr) body).getStatements(), ctx, true);
        } else if (body != null) {
            printStatement(body, ctx, true);
        }
        if (indented) ctx.dedent();
    }

    // ============ try / catch ============

    @Override
    public Void visitTry(TryExpr node, EmissionContext ctx) {
        printTry(node, ctx, false);
        return null;
    }

    /**
     * try → pcall。最后一个 catch 作为兜底，绑定错误值；体内 return/break/continue 通过哨兵值传出。
     */
    private void printTry(TryExpr node, EmissionContext ctx, boolean asResult) {
        List<TryExpr.Catch> catches = node.getCatches();
        if (catches.size() > 1) {
            LOG.warning("只输出最后一个 catch 子句 " + node.getLocation()
                    + ", 丢弃前面 " + (catches.size() - 1) + " 个");
        }
        boolean returns = asResult || TreeQueries.containsReturn(node.getBody());
        boolean breaks = TreeQueries.containsBreak(node.getBody()) && hasEnclosingLoop(ctx);
        boolean continues = TreeQueries.containsContinue(node.getBody()) && hasEnclosingLoop(ctx);
        boolean sentinel = returns || breaks || continues;

        String status = LuaRuntime.PCALL_STATUS;
        String result = LuaRuntime.PCALL_RESULT;
        ctx.line("local " + status + ", " + result + " = pcall(function()");
        ctx.indent();
        ctx.pushFrame(ControlFrame.protectedCall());
        try {
            if (asResult) {
                printResult(node.getBody(), ctx);
            } else {
                TypedNode body = node.getBody();
                List<TypedNode> stmts = body instanceof BlockExpr
                        ? ((BlockExpr) body).getStatements() : Collections.singletonList(body);
                printStatements(stmts, ctx, !sentinel);
            }
            if (sentinel) {
                ctx.line("return " + LuaRuntime.PCALL_DEFAULT);
            }
        } finally {
            ctx.popFrame();
        }
        ctx.dedent();
        ctx.line("end)");

        TryExpr.Catch catchAll = node.getCatchAll();
        ctx.line("if not " + status + " then");
        ctx.indent();
        if (catchAll != null) {
            ctx.line("local " + LuaSyntax.localName(catchAll.getVariable()) + " = " + result);
            if (asResult) {
                printResult(catchAll.getBody(), ctx);
            } else {
                TypedNode body = catchAll.getBody();
                if (body instanceof BlockExpr) {
                    printStatements(((BlockExpr) body).getStatements(), ctx, true);
                } else {
                    printStatement(body, ctx, true);
                }
            }
        } else {
            ctx.line("error(" + result + ", 0)");
        }
        ctx.dedent();
        if (breaks) {
            ctx.line("elseif " + result + " == " + LuaRuntime.PCALL_BREAK + " then");
            ctx.indent();
            printBreak(node, ctx, true);
            ctx.dedent();
        }
        if (continues) {
            ctx.line("elseif " + result + " == " + LuaRuntime.PCALL_CONTINUE + " then");
            ctx.indent();
            printContinue(node, ctx, true);
            ctx.dedent();
        }
        if (returns) {
            ctx.line("elseif " + result + " ~= " + LuaRuntime.PCALL_DEFAULT + " then");
            ctx.indent();
            ctx.line("return " + result);
            ctx.dedent();
        }
        ctx.line("end");
    }

    private static boolean hasEnclosingLoop(EmissionContext ctx) {
        return hasLoopOutside(ctx.frames());
    }

    // ============ 循环与跳转 ============

    private String continueLabelFor(TypedNode body, EmissionContext ctx) {
        return TreeQueries.containsContinue(body) ? "continue_" + ctx.nextLabel() : null;
    }

    /**
     * 循环体；有 continue 时体包在 do ... end 中，其后是标签。
     */
    private void printLoopBody(TypedNode body, String label, EmissionContext ctx) {
        ctx.indent();
        ctx.pushFrame(ControlFrame.loop(label));
        try {
            if (label != null) {
                ctx.line("do");
                ctx.indent();
            }
            if (body instanceof BlockExpr) {
                printStatements(((BlockExpr) body).getStatements(), ctx, true);
            } else if (body != null) {
                printStatement(body, ctx, true);
            }
            if (label != null) {
                ctx.dedent();
                ctx.line("end");
                ctx.line("::" + label + "::");
            }
        } finally {
            ctx.popFrame();
        }
        ctx.dedent();
    }

    @Override
    public Void visitWhile(WhileStmt node, EmissionContext ctx) {
        String label = continueLabelFor(node.getBody(), ctx);
        if (node.isTestBefore()) {
            ctx.append("while ");
            expressions.print(node.getCondition(), ctx);
            ctx.line(" do");
            printLoopBody(node.getBody(), label, ctx);
            ctx.line("end");
        } else {
            // 体内的 local 不能遮蔽 until 条件中的同名变量
            ctx.line("repeat");
            if (label == null) {
                ctx.indent();
                ctx.line("do");
                printLoopBody(node.getBody(), null, ctx);
                ctx.line("end");
                ctx.dedent();
            } else {
                printLoopBody(node.getBody(), label, ctx);
            }
            ctx.append("until not ");
            expressions.printOperand(node.getCondition(), ctx);
            ctx.newLine();
        }
        return null;
    }

    @Override
    public Void visitFor(ForStmt node, EmissionContext ctx) {
        String label = continueLabelFor(node.getBody(), ctx);
        String iterator = "_hx_it_" + ctx.nextLabel();
        ctx.line("do");
        ctx.indent();
        ctx.append("local " + iterator + " = ");
        expressions.print(node.getIterator(), ctx);
        ctx.newLine();
        ctx.line("while " + iterator + ":hasNext() do");
        ctx.indent();
        ctx.line("local " + LuaSyntax.localName(node.getVariable()) + " = " + iterator + ":next()");
        ctx.dedent();
        printLoopBody(node.getBody(), label, ctx);
        ctx.line("end");
        ctx.dedent();
        ctx.line("end");
        return null;
    }

    @Override
    public Void visitBreak(BreakStmt node, EmissionContext ctx) {
        printBreak(node, ctx, ctx.isTailPosition());
        return null;
    }

    private void printBreak(TypedNode node, EmissionContext ctx, boolean tail) {
        for (Iterator<ControlFrame> it = ctx.frames(); it.hasNext(); ) {
            switch (it.next().getKind()) {
                case LOOP:
                    ctx.line("break");
                    return;
                case PROTECTED_CALL:
                    if (!hasLoopOutside(it)) {
                        throw unsupported("break outside a loop", node);
                    }
                    ctx.line(tail ? "return " + LuaRuntime.PCALL_BREAK
                            : "do return " + LuaRuntime.PCALL_BREAK + " end");
                    return;
                default:
                    throw unsupported("break outside a loop", node);
            }
        }
        throw unsupported("break outside a loop", node);
    }

    private static boolean hasLoopOutside(Iterator<ControlFrame> outer) {
        while (outer.hasNext()) {
            ControlFrame.Kind kind = outer.next().getKind();
            if (kind == ControlFrame.Kind.LOOP) return true;
            if (kind == ControlFrame.Kind.FUNCTION) return false;
        }
        return false;
    }

    @Override
    public Void visitContinue(ContinueStmt node, EmissionContext ctx) {
        printContinue(node, ctx, ctx.isTailPosition());
        return null;
    }

    private void printContinue(TypedNode node, EmissionContext ctx, boolean tail) {
        for (Iterator<ControlFrame> it = ctx.frames(); it.hasNext(); ) {
            ControlFrame frame = it.next();
            switch (frame.getKind()) {
                case LOOP:
                    if (frame.getContinueLabel() == null) {
                        throw new InternalInvariantException("Loop has no continue label", node.getLocation());
                    }
                    ctx.line("goto " + frame.getContinueLabel());
                    return;
                case PROTECTED_CALL:
                    if (!hasLoopOutside(it)) {
                        throw unsupported("continue outside a loop", node);
                    }
                    ctx.line(tail ? "return " + LuaRuntime.PCALL_CONTINUE
                            : "do return " + LuaRuntime.PCALL_CONTINUE + " end");
                    return;
                default:
                    throw unsupported("continue outside a loop", node);
            }
        }
        throw unsupported("continue outside a loop", node);
    }

    @Override
    public Void visitReturn(ReturnStmt node, EmissionContext ctx) {
        boolean tail = ctx.isTailPosition();
        ctx.append(tail ? "return" : "do return");
        if (node.hasValue()) {
            ctx.append(" ");
            expressions.print(node.getValue(), ctx);
        }
        ctx.line(tail ? "" : " end");
        return null;
    }

    @Override
    public Void visitThrow(ThrowStmt node, EmissionContext ctx) {
        ctx.append("error(");
        expressions.print(node.getValue(), ctx);
        ctx.line(", 0)");
        return null;
    }

    @Override
    public Void visitVarDecl(VarDeclStmt node, EmissionContext ctx) {
        ctx.append("local " + LuaSyntax.localName(node.getVariable()));
        if (node.hasInitializer()) {
            ctx.append(" = ");
            expressions.print(node.getInitializer(), ctx);
        }
        ctx.newLine();
        return null;
    }
}
