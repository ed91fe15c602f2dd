package com.lumenlang.compiler.ast;

import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.stmt.*;

/**
 * 节点分类工具方法。
 */
public final class TypedNodes {

    private TypedNodes() {
    }

    /**
     * 块状表达式：block / if / switch / try，可在源语言的值位置出现。
     */
    public static boolean isBlockLike(TypedNode node) {
        return node instanceof BlockExpr || node instanceof IfExpr
                || node instanceof SwitchExpr || node instanceof TryExpr;
    }

    /**
     * 只能出现在语句位置的节点。
     */
    public static boolean isStatement(TypedNode node) {
        return node instanceof VarDeclStmt || node instanceof WhileStmt || node instanceof ForStmt
                || node instanceof ReturnStmt || node instanceof BreakStmt
                || node instanceof ContinueStmt || node instanceof ThrowStmt;
    }

    /**
     * 去掉括号与元数据包装。
     */
    public static TypedNode unwrap(TypedNode node) {
        TypedNode cur = node;
        while (true) {
            if (cur instanceof ParenExpr) {
                cur = ((ParenExpr) cur).getInner();
            } else if (cur instanceof MetaExpr) {
                cur = ((MetaExpr) cur).getInner();
            } else {
                return cur;
            }
        }
    }

    /**
     * 是否静态地为 null 常量（忽略括号与元数据）。
     */
    public static boolean isNullConstant(TypedNode node) {
        TypedNode inner = node != null ? unwrap(node) : null;
        return inner instanceof ConstantExpr && ((ConstantExpr) inner).isNull();
    }

    /**
     * 求值没有可观察副作用的节点：删除、复制或重排它们都不会改变程序行为（读取可变状态除外）。
     */
    public static boolean isSideEffectFree(TypedNode node) {
        if (node == null) return true;
        if (node instanceof ConstantExpr || node instanceof LocalRefExpr
                || node instanceof TypeRefExpr || node instanceof FunctionExpr) {
            return true;
        }
        if (node instanceof ParenExpr) return isSideEffectFree(((ParenExpr) node).getInner());
        if (node instanceof MetaExpr) return isSideEffectFree(((MetaExpr) node).getInner());
        if (node instanceof CastExpr) {
            CastExpr cast = (CastExpr) node;
            return !cast.isChecked() && isSideEffectFree(cast.getInner());
        }
        if (node instanceof FieldAccessExpr) {
            return isSideEffectFree(((FieldAccessExpr) node).getTarget());
        }
        if (node instanceof ArrayIndexExpr) {
            ArrayIndexExpr idx = (ArrayIndexExpr) node;
            return isSideEffectFree(idx.getTarget()) && isSideEffectFree(idx.getIndex());
        }
        if (node instanceof EnumIndexExpr) return isSideEffectFree(((EnumIndexExpr) node).getTarget());
        if (node instanceof EnumParameterExpr) return isSideEffectFree(((EnumParameterExpr) node).getTarget());
        if (node instanceof UnaryExpr) {
            UnaryExpr un = (UnaryExpr) node;
            return !un.isMutation() && isSideEffectFree(un.getOperand());
        }
        if (node instanceof BinaryExpr) {
            BinaryExpr bin = (BinaryExpr) node;
            return !bin.isAssignment()
                    && isSideEffectFree(bin.getLeft()) && isSideEffectFree(bin.getRight());
        }
        if (node instanceof ArrayLiteralExpr) {
            for (TypedNode e : ((ArrayLiteralExpr) node).getElements()) {
                if (!isSideEffectFree(e)) return false;
            }
            return true;
        }
        if (node instanceof ObjectLiteralExpr) {
            for (TypedNode v : ((ObjectLiteralExpr) node).getValues()) {
                if (!isSideEffectFree(v)) return false;
            }
            return true;
        }
        return false;
    }
}
