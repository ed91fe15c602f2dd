package com.lumenlang.compiler.analysis;

import com.lumenlang.compiler.ast.LocalVar;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeScanner;
import com.lumenlang.compiler.ast.expr.BinaryExpr;
import com.lumenlang.compiler.ast.expr.CallExpr;
import com.lumenlang.compiler.ast.expr.FunctionExpr;
import com.lumenlang.compiler.ast.expr.LocalRefExpr;
import com.lumenlang.compiler.ast.expr.NewExpr;
import com.lumenlang.compiler.ast.expr.UnaryExpr;
import com.lumenlang.compiler.ast.stmt.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 控制流与赋值查询。除 {@link #capturedVariables} 外，所有查询都不进入嵌套的函数字面量。
 */
public final class TreeQueries {

    private TreeQueries() {
    }

    /**
     * body 中是否有作用于外层循环的 continue（不进入嵌套循环）。
     */
    public static boolean containsContinue(TypedNode body) {
        JumpFinder finder = new JumpFinder(false, true, false);
        finder.scan(body, null);
        return finder.found;
    }

    /**
     * body 中是否有作用于外层循环的 break（不进入嵌套循环）。
     */
    public static boolean containsBreak(TypedNode body) {
        JumpFinder finder = new JumpFinder(true, false, false);
        finder.scan(body, null);
        return finder.found;
    }

    /**
     * body 中是否有 return。
     */
    public static boolean containsReturn(TypedNode body) {
        JumpFinder finder = new JumpFinder(false, false, true);
        finder.scan(body, null);
        return finder.found;
    }

    /**
     * statements 中是否可能给变量 v 赋值（赋值、复合赋值、自增自减）。
     */
    public static boolean assignsVariable(List<TypedNode> statements, LocalVar v) {
        AssignmentFinder finder = new AssignmentFinder(v);
        for (TypedNode stmt : statements) {
            finder.scan(stmt, null);
            if (finder.found) return true;
        }
        return false;
    }

    /**
     * statements 中是否有调用或 new，即是否可能执行任意代码（函数字面量的定义本身不算）。
     */
    public static boolean containsInvocation(List<TypedNode> statements) {
        InvocationFinder finder = new InvocationFinder();
        for (TypedNode stmt : statements) {
            finder.scan(stmt, null);
            if (finder.found) return true;
        }
        return false;
    }

    /**
     * body 中被函数字面量引用（读或写）的局部变量。
     * 这些变量可能在任何一次调用中被改写。
     */
    public static Set<LocalVar> capturedVariables(TypedNode body) {
        CaptureCollector collector = new CaptureCollector();
        collector.scan(body, null);
        return collector.captured;
    }

    private static final class JumpFinder extends TypedNodeScanner<Void> {
        private final boolean breaks;
        private final boolean continues;
        private final boolean returns;
        boolean found;

        JumpFinder(boolean breaks, boolean continues, boolean returns) {
            this.breaks = breaks;
            this.continues = continues;
            this.returns = returns;
        }

        @Override
        public void scan(TypedNode node, Void ctx) {
            if (!found) super.scan(node, ctx);
        }

        @Override
        public Void visitBreak(BreakStmt node, Void ctx) {
            if (breaks) found = true;
            return null;
        }

        @Override
        public Void visitContinue(ContinueStmt node, Void ctx) {
            if (continues) found = true;
            return null;
        }

        @Override
        public Void visitReturn(ReturnStmt node, Void ctx) {
            if (returns) found = true;
            return super.visitReturn(node, ctx);
        }

        @Override
        public Void visitWhile(WhileStmt node, Void ctx) {
            scan(node.getCondition(), ctx);
            // 嵌套循环的 break/continue 属于它自己
            if (returns) scan(node.getBody(), ctx);
            return null;
        }

        @Override
        public Void visitFor(ForStmt node, Void ctx) {
            scan(node.getIterator(), ctx);
            if (returns) scan(node.getBody(), ctx);
            return null;
        }

        @Override
        public Void visitFunction(FunctionExpr node, Void ctx) {
            return null;
        }
    }

    private static final class AssignmentFinder extends TypedNodeScanner<Void> {
        private final LocalVar target;
        boolean found;

        AssignmentFinder(LocalVar target) {
            this.target = target;
        }

        private boolean isTarget(TypedNode node) {
            return node instanceof LocalRefExpr && ((LocalRefExpr) node).getVariable().equals(target);
        }

        @Override
        public Void visitBinary(BinaryExpr node, Void ctx) {
            if (node.isAssignment() && isTarget(node.getLeft())) found = true;
            return super.visitBinary(node, ctx);
        }

        @Override
        public Void visitUnary(UnaryExpr node, Void ctx) {
            if (node.isMutation() && isTarget(node.getOperand())) found = true;
            return super.visitUnary(node, ctx);
        }

        @Override
        public Void visitFunction(FunctionExpr node, Void ctx) {
            return null;
        }
    }

    private static final class InvocationFinder extends TypedNodeScanner<Void> {
        boolean found;

        @Override
        public void scan(TypedNode node, Void ctx) {
            if (!found) super.scan(node, ctx);
        }

        @Override
        public Void visitCall(CallExpr node, Void ctx) {
            found = true;
            return null;
        }

        @Override
        public Void visitNew(NewExpr node, Void ctx) {
            found = true;
            return null;
        }

        @Override
        public Void visitFunction(FunctionExpr node, Void ctx) {
            return null;
        }
    }

    private static final class CaptureCollector extends TypedNodeScanner<Void> {
        final Set<LocalVar> captured = new HashSet<>();
        private int depth;

        @Override
        public Void visitLocalRef(LocalRefExpr node, Void ctx) {
            if (depth > 0) captured.add(node.getVariable());
            return null;
        }

        @Override
        public Void visitFunction(FunctionExpr node, Void ctx) {
            depth++;
            try {
                return super.visitFunction(node, ctx);
            } finally {
                depth--;
            }
        }
    }
}
