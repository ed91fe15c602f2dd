package com.lumenlang.compiler.ast;

import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 恒等变换基类（copy-on-change）。
 * 递归遍历所有节点，子节点无变化时返回原节点，否则构造新节点；输入树从不被修改。
 * 子类可覆盖特定 visit 方法实现改写 pass。
 */
public class TypedNodeTransformer implements TypedNodeVisitor<TypedNode, Void> {

    /**
     * 变换入口。
     */
    public TypedNode transform(TypedNode node) {
        if (node == null) return null;
        return node.accept(this, null);
    }

    // ==================== 辅助方法 ====================

    protected List<TypedNode> transformAll(List<TypedNode> nodes) {
        if (nodes == null || nodes.isEmpty()) return nodes;
        List<TypedNode> result = null;
        for (int i = 0; i < nodes.size(); i++) {
            TypedNode original = nodes.get(i);
            TypedNode transformed = transform(original);
            if (transformed != original && result == null) {
                result = new ArrayList<>(nodes.size());
                for (int j = 0; j < i; j++) result.add(nodes.get(j));
            }
            if (result != null) result.add(transformed);
        }
        return result != null ? result : nodes;
    }

    // ==================== 叶节点（直接返回） ====================

    @Override
    public TypedNode visitConstant(ConstantExpr node, Void ctx) {
        return node;
    }

    @Override
    public TypedNode visitLocalRef(LocalRefExpr node, Void ctx) {
        return node;
    }

    @Override
    public TypedNode visitTypeRef(TypeRefExpr node, Void ctx) {
        return node;
    }

    @Override
    public TypedNode visitIdent(IdentExpr node, Void ctx) {
        return node;
    }

    @Override
    public TypedNode visitBreak(BreakStmt node, Void ctx) {
        return node;
    }

    @Override
    public TypedNode visitContinue(ContinueStmt node, Void ctx) {
        return node;
    }

    // ==================== 值 ====================

    @Override
    public TypedNode visitFieldAccess(FieldAccessExpr node, Void ctx) {
        return node.withTarget(transform(node.getTarget()));
    }

    @Override
    public TypedNode visitArrayIndex(ArrayIndexExpr node, Void ctx) {
        TypedNode target = transform(node.getTarget());
        TypedNode index = transform(node.getIndex());
        if (target == node.getTarget() && index == node.getIndex()) return node;
        return new ArrayIndexExpr(node.getLocation(), node.getType(), target, index);
    }

    @Override
    public TypedNode visitParen(ParenExpr node, Void ctx) {
        TypedNode inner = transform(node.getInner());
        if (inner == node.getInner()) return node;
        return new ParenExpr(node.getLocation(), inner);
    }

    @Override
    public TypedNode visitObjectLiteral(ObjectLiteralExpr node, Void ctx) {
        List<TypedNode> values = node.getValues();
        List<TypedNode> transformed = transformAll(values);
        if (transformed == values) return node;
        return node.withValues(transformed);
    }

    @Override
    public TypedNode visitArrayLiteral(ArrayLiteralExpr node, Void ctx) {
        List<TypedNode> elements = transformAll(node.getElements());
        if (elements == node.getElements()) return node;
        return new ArrayLiteralExpr(node.getLocation(), node.getType(), elements);
    }

    @Override
    public TypedNode visitCall(CallExpr node, Void ctx) {
        TypedNode callee = transform(node.getCallee());
        List<TypedNode> args = transformAll(node.getArgs());
        if (callee == node.getCallee() && args == node.getArgs()) return node;
        return new CallExpr(node.getLocation(), node.getType(), callee, args);
    }

    @Override
    public TypedNode visitNew(NewExpr node, Void ctx) {
        List<TypedNode> args = transformAll(node.getArgs());
        if (args == node.getArgs()) return node;
        return new NewExpr(node.getLocation(), node.getType(), node.getClassPath(), args);
    }

    @Override
    public TypedNode visitBinary(BinaryExpr node, Void ctx) {
        return node.withOperands(transform(node.getLeft()), transform(node.getRight()));
    }

    @Override
    public TypedNode visitUnary(UnaryExpr node, Void ctx) {
        return node.withOperand(transform(node.getOperand()));
    }

    @Override
    public TypedNode visitFunction(FunctionExpr node, Void ctx) {
        return node.withBody(transform(node.getBody()));
    }

    @Override
    public TypedNode visitCast(CastExpr node, Void ctx) {
        TypedNode inner = transform(node.getInner());
        if (inner == node.getInner()) return node;
        return new CastExpr(node.getLocation(), node.getType(), inner, node.getTargetPath());
    }

    @Override
    public TypedNode visitMeta(MetaExpr node, Void ctx) {
        TypedNode inner = transform(node.getInner());
        if (inner == node.getInner()) return node;
        return new MetaExpr(node.getLocation(), node.getName(), inner);
    }

    @Override
    public TypedNode visitEnumParameter(EnumParameterExpr node, Void ctx) {
        TypedNode target = transform(node.getTarget());
        if (target == node.getTarget()) return node;
        return new EnumParameterExpr(node.getLocation(), node.getType(), target,
                node.getConstructor(), node.getIndex());
    }

    @Override
    public TypedNode visitEnumIndex(EnumIndexExpr node, Void ctx) {
        TypedNode target = transform(node.getTarget());
        if (target == node.getTarget()) return node;
        return new EnumIndexExpr(node.getLocation(), target);
    }

    // ==================== 块状表达式 ====================

    @Override
    public TypedNode visitBlock(BlockExpr node, Void ctx) {
        List<TypedNode> stmts = transformAll(node.getStatements());
        if (stmts == node.getStatements()) return node;
        return new BlockExpr(node.getLocation(), node.getType(), stmts);
    }

    @Override
    public TypedNode visitIf(IfExpr node, Void ctx) {
        TypedNode cond = transform(node.getCondition());
        TypedNode then = transform(node.getThenBranch());
        TypedNode els = transform(node.getElseBranch());
        if (cond == node.getCondition() && then == node.getThenBranch()
                && els == node.getElseBranch()) return node;
        return new IfExpr(node.getLocation(), node.getType(), cond, then, els);
    }

    @Override
    public TypedNode visitSwitch(SwitchExpr node, Void ctx) {
        TypedNode subject = transform(node.getSubject());
        boolean changed = subject != node.getSubject();
        List<SwitchExpr.Case> cases = new ArrayList<>(node.getCases().size());
        for (SwitchExpr.Case c : node.getCases()) {
            List<TypedNode> values = transformAll(c.getValues());
            TypedNode body = transform(c.getBody());
            if (values != c.getValues() || body != c.getBody()) {
                changed = true;
                cases.add(new SwitchExpr.Case(values, body));
            } else {
                cases.add(c);
            }
        }
        TypedNode def = transform(node.getDefaultBody());
        if (!changed && def == node.getDefaultBody()) return node;
        return new SwitchExpr(node.getLocation(), node.getType(), subject, cases, def);
    }

    @Override
    public TypedNode visitTry(TryExpr node, Void ctx) {
        TypedNode body = transform(node.getBody());
        boolean changed = body != node.getBody();
        List<TryExpr.Catch> catches = new ArrayList<>(node.getCatches().size());
        for (TryExpr.Catch c : node.getCatches()) {
            TypedNode catchBody = transform(c.getBody());
            if (catchBody != c.getBody()) {
                changed = true;
                catches.add(new TryExpr.Catch(c.getVariable(), catchBody));
            } else {
                catches.add(c);
            }
        }
        if (!changed) return node;
        return new TryExpr(node.getLocation(), node.getType(), body, catches);
    }

    // ==================== 语句 ====================

    @Override
    public TypedNode visitVarDecl(VarDeclStmt node, Void ctx) {
        TypedNode init = transform(node.getInitializer());
        if (init == node.getInitializer()) return node;
        return new VarDeclStmt(node.getLocation(), node.getVariable(), init);
    }

    @Override
    public TypedNode visitFor(ForStmt node, Void ctx) {
        TypedNode iter = transform(node.getIterator());
        TypedNode body = transform(node.getBody());
        if (iter == node.getIterator() && body == node.getBody()) return node;
        return new ForStmt(node.getLocation(), node.getVariable(), iter, body);
    }

    @Override
    public TypedNode visitWhile(WhileStmt node, Void ctx) {
        TypedNode cond = transform(node.getCondition());
        TypedNode body = transform(node.getBody());
        if (cond == node.getCondition() && body == node.getBody()) return node;
        return new WhileStmt(node.getLocation(), cond, body, node.isTestBefore());
    }

    @Override
    public TypedNode visitReturn(ReturnStmt node, Void ctx) {
        TypedNode value = transform(node.getValue());
        if (value == node.getValue()) return node;
        return new ReturnStmt(node.getLocation(), value);
    }

    @Override
    public TypedNode visitThrow(ThrowStmt node, Void ctx) {
        TypedNode value = transform(node.getValue());
        if (value == node.getValue()) return node;
        return new ThrowStmt(node.getLocation(), value);
    }
}
