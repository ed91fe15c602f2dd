package com.lumenlang.ir.normalize;

import com.lumenlang.compiler.analysis.TreeQueries;
import com.lumenlang.compiler.ast.LocalVar;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.ast.TypedNodes;
import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.stmt.*;
import com.lumenlang.compiler.types.FunctionType;
import com.lumenlang.compiler.types.LumenType;
import com.lumenlang.compiler.types.Types;
import com.lumenlang.compiler.types.VoidType;
import com.lumenlang.ir.InternalInvariantException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 表达式到语句的规范化核心。
 * <p>
 * 语句被逐条写入输出列表；值位置上需要前置语句的子表达式，其语句先于所在语句写入输出，
 * 值本身替换为一个不会再产生前置语句的节点（通常是临时变量引用）。
 * 赋值目标（assignee）非空时，序列最后一条语句的值被写入该目标。
 */
final class SequenceNormalizer {

    private final TempVarNameGenerator temps;
    private final Set<LocalVar> captured;
    private final StatementNormalizer statements = new StatementNormalizer();
    private final ValueNormalizer values = new ValueNormalizer();

    /**
     * @param captured 被函数字面量引用的局部变量，调用可能改写它们
     */
    SequenceNormalizer(TempVarNameGenerator temps, Set<LocalVar> captured) {
        this.temps = temps;
        this.captured = captured;
    }

    // ==================== 入口 ====================

    /**
     * 规范化一个语句序列；assignee 非空时最后一条语句的值写入 assignee。
     */
    List<TypedNode> sequence(List<TypedNode> input, TypedNode assignee) {
        List<TypedNode> out = new ArrayList<>();
        for (int i = 0; i < input.size(); i++) {
            TypedNode stmt = WhileConditionHoisting.preprocess(input.get(i), temps);
            boolean last = i == input.size() - 1;
            statement(stmt, last ? assignee : null, out);
        }
        return out;
    }

    /**
     * 规范化函数字面量的体，参数与返回类型不变。
     */
    FunctionExpr function(FunctionExpr fn) {
        TypedNode body = fn.getBody();
        if (body != null && !(body instanceof BlockExpr)) {
            SourceLocation loc = body.getLocation();
            TypedNode stmt = Types.isVoid(fn.getReturnType()) || producesNoValue(body)
                    ? body : new ReturnStmt(loc, body);
            body = new BlockExpr(loc, VoidType.INSTANCE, Collections.singletonList(stmt));
        }
        return fn.withBody(body(body));
    }

    /**
     * 规范化一个体（函数体或字段初始化语句）。
     */
    TypedNode body(TypedNode body) {
        if (body == null) return null;
        if (body instanceof BlockExpr) {
            BlockExpr block = (BlockExpr) body;
            return new BlockExpr(block.getLocation(), block.getType(), sequence(block.getStatements(), null));
        }
        List<TypedNode> out = sequence(Collections.singletonList(body), null);
        return out.size() == 1 ? out.get(0) : new BlockExpr(body.getLocation(), VoidType.INSTANCE, out);
    }

    // ==================== 语句与值 ====================

    private void statement(TypedNode node, TypedNode assignee, List<TypedNode> out) {
        node.accept(statements, new Target(assignee, out));
    }

    /**
     * 值位置规范化：前置语句写入 out，返回可直接放在值位置的节点。
     */
    private TypedNode value(TypedNode node, List<TypedNode> out) {
        return node.accept(values, out);
    }

    /**
     * 按从左到右的顺序规范化一组兄弟操作数。
     * 后面的操作数产生前置语句时，前面不稳定的操作数先被存入临时变量，保证求值顺序不变。
     */
    private List<TypedNode> valueList(List<TypedNode> operands, List<TypedNode> out) {
        List<TypedNode> result = new ArrayList<>(operands.size());
        for (TypedNode operand : operands) {
            List<TypedNode> pre = new ArrayList<>();
            TypedNode v = value(operand, pre);
            if (!pre.isEmpty()) {
                for (int i = 0; i < result.size(); i++) {
                    TypedNode earlier = result.get(i);
                    if (!isStable(earlier, pre)) {
                        result.set(i, spill(earlier, out));
                    }
                }
                out.addAll(pre);
            }
            result.add(v);
        }
        return result;
    }

    /**
     * 节点的值在 later 执行之后是否仍然不变。
     * 被闭包捕获的局部变量只要 later 中有调用就视为不稳定。
     */
    private boolean isStable(TypedNode node, List<TypedNode> later) {
        TypedNode v = TypedNodes.unwrap(node);
        if (v instanceof ConstantExpr || v instanceof TypeRefExpr || v instanceof FunctionExpr) {
            return true;
        }
        if (v instanceof LocalRefExpr) {
            LocalVar var = ((LocalRefExpr) v).getVariable();
            if (var.isTemp()) return true;
            if (TreeQueries.assignsVariable(later, var)) return false;
            return !captured.contains(var) || !TreeQueries.containsInvocation(later);
        }
        return false;
    }

    /**
     * 把值存入新的临时变量，返回其引用。
     */
    private LocalRefExpr spill(TypedNode v, List<TypedNode> out) {
        LocalVar t = temps.fresh(v.getType());
        out.add(new VarDeclStmt(v.getLocation(), t, v));
        return new LocalRefExpr(v.getLocation(), t);
    }

    private TypedNode spillUnlessPure(TypedNode v, List<TypedNode> out) {
        return TypedNodes.isSideEffectFree(v) ? v : spill(v, out);
    }

    /**
     * 稳定左值：目标对象与索引只求值一次，之后可被多次读写。
     */
    private TypedNode stabilize(TypedNode lvalue, List<TypedNode> out) {
        if (lvalue instanceof ParenExpr) return stabilize(((ParenExpr) lvalue).getInner(), out);
        if (lvalue instanceof MetaExpr) return stabilize(((MetaExpr) lvalue).getInner(), out);
        if (lvalue instanceof LocalRefExpr) return lvalue;
        if (lvalue instanceof FieldAccessExpr) {
            FieldAccessExpr fa = (FieldAccessExpr) lvalue;
            if (fa.getOwnerPath() != null) return fa;
            return fa.withTarget(spillUnlessPure(value(fa.getTarget(), out), out));
        }
        if (lvalue instanceof ArrayIndexExpr) {
            ArrayIndexExpr ai = (ArrayIndexExpr) lvalue;
            List<TypedNode> parts = valueList(listOf(ai.getTarget(), ai.getIndex()), out);
            return new ArrayIndexExpr(ai.getLocation(), ai.getType(),
                    spillUnlessPure(parts.get(0), out), spillUnlessPure(parts.get(1), out));
        }
        throw new InternalInvariantException(
                "Not an assignable location: " + lvalue.getTag(), lvalue.getLocation());
    }

    /**
     * 规范化简单赋值的左值子表达式（不稳定化）。
     */
    private TypedNode lvalueWithValue(TypedNode lvalue, TypedNode rhs, List<TypedNode> out, TypedNode[] rhsOut) {
        TypedNode lv = TypedNodes.unwrap(lvalue);
        if (lv instanceof FieldAccessExpr && ((FieldAccessExpr) lv).getOwnerPath() == null) {
            FieldAccessExpr fa = (FieldAccessExpr) lv;
            List<TypedNode> ops = valueList(listOf(fa.getTarget(), rhs), out);
            rhsOut[0] = ops.get(1);
            return fa.withTarget(ops.get(0));
        }
        if (lv instanceof ArrayIndexExpr) {
            ArrayIndexExpr ai = (ArrayIndexExpr) lv;
            List<TypedNode> ops = valueList(listOf(ai.getTarget(), ai.getIndex(), rhs), out);
            rhsOut[0] = ops.get(2);
            return new ArrayIndexExpr(ai.getLocation(), ai.getType(), ops.get(0), ops.get(1));
        }
        rhsOut[0] = value(rhs, out);
        return lv;
    }

    private static List<TypedNode> listOf(TypedNode... nodes) {
        List<TypedNode> list = new ArrayList<>(nodes.length);
        Collections.addAll(list, nodes);
        return list;
    }

    private static boolean isPureLvalue(TypedNode lvalue) {
        return TypedNodes.isSideEffectFree(lvalue) && !HoistingAnalysis.requiresHoisting(lvalue);
    }

    /**
     * 单个分支（if 的某个分支、case 体、循环体等）规范化为一个节点。
     */
    private TypedNode branch(TypedNode node, TypedNode assignee) {
        if (node == null) return null;
        List<TypedNode> out = new ArrayList<>();
        statement(WhileConditionHoisting.preprocess(node, temps), assignee, out);
        if (out.size() == 1) return out.get(0);
        return new BlockExpr(node.getLocation(), VoidType.INSTANCE, out);
    }

    private static BinaryExpr assign(TypedNode target, TypedNode value) {
        return BinaryExpr.assign(value.getLocation(), target, value);
    }

    private static LocalRefExpr ref(SourceLocation loc, LocalVar v) {
        return new LocalRefExpr(loc, v);
    }

    private static ConstantExpr nullValue(SourceLocation loc) {
        return ConstantExpr.ofNull(loc);
    }

    private static boolean producesNoValue(TypedNode node) {
        return node instanceof VarDeclStmt || node instanceof WhileStmt || node instanceof ForStmt
                || node instanceof ReturnStmt || node instanceof BreakStmt
                || node instanceof ContinueStmt || node instanceof ThrowStmt;
    }

    /** 语句位置的上下文：赋值目标与输出列表 */
    private static final class Target {
        final TypedNode assignee;
        final List<TypedNode> out;

        Target(TypedNode assignee, List<TypedNode> out) {
            this.assignee = assignee;
            this.out = out;
        }
    }

    // ==================== 语句位置 ====================

    private final class StatementNormalizer implements TypedNodeVisitor<Void, Target> {

        /** 普通值作为语句：先取值，再按需写入 assignee */
        private Void asValue(TypedNode node, Target t) {
            TypedNode v = value(node, t.out);
            if (t.assignee != null) {
                t.out.add(assign(t.assignee, v));
            } else {
                t.out.add(v);
            }
            return null;
        }

        @Override
        public Void visitConstant(ConstantExpr node, Target t) {
            return asValue(node, t);
        }

        @Override
        public Void visitLocalRef(LocalRefExpr node, Target t) {
            return asValue(node, t);
        }

        @Override
        public Void visitFieldAccess(FieldAccessExpr node, Target t) {
            return asValue(node, t);
        }

        @Override
        public Void visitArrayIndex(ArrayIndexExpr node, Target t) {
            return asValue(node, t);
        }

        @Override
        public Void visitParen(ParenExpr node, Target t) {
            if (TypedNodes.isBlockLike(node.getInner())) {
                return node.getInner().accept(this, t);
            }
            return asValue(node, t);
        }

        @Override
        public Void visitObjectLiteral(ObjectLiteralExpr node, Target t) {
            return asValue(node, t);
        }

        @Override
        public Void visitArrayLiteral(ArrayLiteralExpr node, Target t) {
            return asValue(node, t);
        }

        @Override
        public Void visitTypeRef(TypeRefExpr node, Target t) {
            return asValue(node, t);
        }

        @Override
        public Void visitCall(CallExpr node, Target t) {
            return asValue(node, t);
        }

        @Override
        public Void visitNew(NewExpr node, Target t) {
            return asValue(node, t);
        }

        @Override
        public Void visitBinary(BinaryExpr node, Target t) {
            switch (node.getOperator()) {
                case ASSIGN:
                    return assignStatement(node, t);
                case ASSIGN_OP: {
                    TypedNode lv = stabilize(node.getLeft(), t.out);
                    TypedNode rhs = value(node.getRight(), t.out);
                    t.out.add(BinaryExpr.assignOp(node.getLocation(), node.getCompoundOp(), lv, rhs));
                    if (t.assignee != null) t.out.add(assign(t.assignee, lv));
                    return null;
                }
                default:
                    return asValue(node, t);
            }
        }

        private Void assignStatement(BinaryExpr node, Target t) {
            TypedNode left = node.getLeft();
            TypedNode right = node.getRight();
            if (TypedNodes.isBlockLike(TypedNodes.unwrap(right)) && isPureLvalue(left)) {
                // 纯左值直接作为块状右侧的赋值目标
                statement(TypedNodes.unwrap(right), left, t.out);
                if (t.assignee != null) t.out.add(assign(t.assignee, left));
                return null;
            }
            TypedNode[] rhs = new TypedNode[1];
            TypedNode lv = lvalueWithValue(left, right, t.out, rhs);
            t.out.add(BinaryExpr.assign(node.getLocation(), lv, rhs[0]));
            if (t.assignee != null) t.out.add(assign(t.assignee, lv));
            return null;
        }

        @Override
        public Void visitUnary(UnaryExpr node, Target t) {
            if (node.isMutation() && t.assignee == null) {
                TypedNode lv = stabilize(node.getOperand(), t.out);
                t.out.add(increment(node, lv));
                return null;
            }
            return asValue(node, t);
        }

        @Override
        public Void visitFunction(FunctionExpr node, Target t) {
            return asValue(node, t);
        }

        @Override
        public Void visitCast(CastExpr node, Target t) {
            return asValue(node, t);
        }

        @Override
        public Void visitMeta(MetaExpr node, Target t) {
            if (TypedNodes.isBlockLike(node.getInner()) || producesNoValue(node.getInner())) {
                return node.getInner().accept(this, t);
            }
            return asValue(node, t);
        }

        @Override
        public Void visitEnumParameter(EnumParameterExpr node, Target t) {
            return asValue(node, t);
        }

        @Override
        public Void visitEnumIndex(EnumIndexExpr node, Target t) {
            return asValue(node, t);
        }

        @Override
        public Void visitIdent(IdentExpr node, Target t) {
            return asValue(node, t);
        }

        @Override
        public Void visitBlock(BlockExpr node, Target t) {
            t.out.add(new BlockExpr(node.getLocation(), node.getType(),
                    sequence(node.getStatements(), t.assignee)));
            return null;
        }

        @Override
        public Void visitIf(IfExpr node, Target t) {
            TypedNode cond = value(node.getCondition(), t.out);
            TypedNode thenBranch = branch(node.getThenBranch(), t.assignee);
            TypedNode elseBranch = branch(node.getElseBranch(), t.assignee);
            t.out.add(new IfExpr(node.getLocation(), node.getType(), cond, thenBranch, elseBranch));
            return null;
        }

        @Override
        public Void visitSwitch(SwitchExpr node, Target t) {
            // 主体与所有 case 值作为一组兄弟操作数，在分派前按源码顺序求值
            List<TypedNode> operands = new ArrayList<>();
            operands.add(node.getSubject());
            for (SwitchExpr.Case c : node.getCases()) {
                operands.addAll(c.getValues());
            }
            List<TypedNode> normalized = valueList(operands, t.out);
            TypedNode subject = normalized.get(0);
            List<SwitchExpr.Case> cases = new ArrayList<>(node.getCases().size());
            int next = 1;
            for (SwitchExpr.Case c : node.getCases()) {
                int count = c.getValues().size();
                List<TypedNode> caseValues = new ArrayList<>(normalized.subList(next, next + count));
                next += count;
                cases.add(new SwitchExpr.Case(caseValues, branch(c.getBody(), t.assignee)));
            }
            TypedNode defaultBody = branch(node.getDefaultBody(), t.assignee);
            t.out.add(new SwitchExpr(node.getLocation(), node.getType(), subject, cases, defaultBody));
            return null;
        }

        @Override
        public Void visitTry(TryExpr node, Target t) {
            TypedNode body = branch(node.getBody(), t.assignee);
            List<TryExpr.Catch> catches = new ArrayList<>(node.getCatches().size());
            for (TryExpr.Catch c : node.getCatches()) {
                catches.add(new TryExpr.Catch(c.getVariable(), branch(c.getBody(), t.assignee)));
            }
            t.out.add(new TryExpr(node.getLocation(), node.getType(), body, catches));
            return null;
        }

        @Override
        public Void visitVarDecl(VarDeclStmt node, Target t) {
            TypedNode init = node.getInitializer();
            if (init == null) {
                t.out.add(node);
                return null;
            }
            TypedNode unwrapped = TypedNodes.unwrap(init);
            if (TypedNodes.isBlockLike(unwrapped)) {
                t.out.add(new VarDeclStmt(node.getLocation(), node.getVariable(), null));
                statement(unwrapped, ref(node.getLocation(), node.getVariable()), t.out);
                return null;
            }
            t.out.add(new VarDeclStmt(node.getLocation(), node.getVariable(), value(init, t.out)));
            return null;
        }

        @Override
        public Void visitFor(ForStmt node, Target t) {
            TypedNode iterator = value(node.getIterator(), t.out);
            t.out.add(new ForStmt(node.getLocation(), node.getVariable(), iterator, branch(node.getBody(), null)));
            return null;
        }

        @Override
        public Void visitWhile(WhileStmt node, Target t) {
            List<TypedNode> pre = new ArrayList<>();
            TypedNode cond = value(node.getCondition(), pre);
            if (!pre.isEmpty()) {
                // 预处理未覆盖到的提升（例如原生方法值的接收者）：改写后重新规范化
                statement(WhileConditionHoisting.rewrite(node, temps), t.assignee, t.out);
                return null;
            }
            t.out.add(new WhileStmt(node.getLocation(), cond, branch(node.getBody(), null), node.isTestBefore()));
            return null;
        }

        @Override
        public Void visitReturn(ReturnStmt node, Target t) {
            if (!node.hasValue()) {
                t.out.add(node);
                return null;
            }
            t.out.add(new ReturnStmt(node.getLocation(), value(node.getValue(), t.out)));
            return null;
        }

        @Override
        public Void visitBreak(BreakStmt node, Target t) {
            t.out.add(node);
            return null;
        }

        @Override
        public Void visitContinue(ContinueStmt node, Target t) {
            t.out.add(node);
            return null;
        }

        @Override
        public Void visitThrow(ThrowStmt node, Target t) {
            t.out.add(new ThrowStmt(node.getLocation(), value(node.getValue(), t.out)));
            return null;
        }
    }

    private static BinaryExpr increment(UnaryExpr node, TypedNode lvalue) {
        BinaryExpr.BinaryOp op = node.getOperator() == UnaryExpr.UnaryOp.INCREMENT
                ? BinaryExpr.BinaryOp.ADD : BinaryExpr.BinaryOp.SUB;
        return BinaryExpr.assignOp(node.getLocation(), op, lvalue, ConstantExpr.ofInt(node.getLocation(), 1));
    }

    // ==================== 值位置 ====================

    private final class ValueNormalizer implements TypedNodeVisitor<TypedNode, List<TypedNode>> {

        @Override
        public TypedNode visitConstant(ConstantExpr node, List<TypedNode> out) {
            return node;
        }

        @Override
        public TypedNode visitLocalRef(LocalRefExpr node, List<TypedNode> out) {
            return node;
        }

        @Override
        public TypedNode visitTypeRef(TypeRefExpr node, List<TypedNode> out) {
            return node;
        }

        @Override
        public TypedNode visitIdent(IdentExpr node, List<TypedNode> out) {
            return node;
        }

        @Override
        public TypedNode visitFieldAccess(FieldAccessExpr node, List<TypedNode> out) {
            if (isNativeMethodValue(node)) {
                return nativeMethodShim(node, out);
            }
            return fieldTarget(node, out);
        }

        private FieldAccessExpr fieldTarget(FieldAccessExpr node, List<TypedNode> out) {
            if (node.getOwnerPath() != null) return node;
            TypedNode target = value(node.getTarget(), out);
            if (node.getKind() == FieldAccessKind.CLOSURE) {
                // 绑定闭包时接收者会被引用两次
                target = spillUnlessPure(target, out);
            }
            return node.withTarget(target);
        }

        private boolean isNativeMethodValue(FieldAccessExpr node) {
            return node.getField().isNative() && node.getField().isMethod()
                    && node.getType() instanceof FunctionType
                    && node.getKind() != FieldAccessKind.ENUM_CONSTRUCTOR;
        }

        /**
         * 原生命名方法作为值：生成同元数的包装函数，调用点使用原生名。
         */
        private TypedNode nativeMethodShim(FieldAccessExpr node, List<TypedNode> out) {
            SourceLocation loc = node.getLocation();
            FunctionType fnType = (FunctionType) node.getType();
            TypedNode receiver = node.getTarget();
            if (node.getOwnerPath() == null) {
                receiver = spillUnlessPure(value(receiver, out), out);
            }
            List<FunctionExpr.Param> params = new ArrayList<>(fnType.getArity());
            List<TypedNode> args = new ArrayList<>(fnType.getArity());
            for (FunctionType.Param p : fnType.getParams()) {
                LocalVar v = temps.fresh(p.getType());
                params.add(new FunctionExpr.Param(v));
                args.add(ref(loc, v));
            }
            FieldAccessKind kind = node.getKind() == FieldAccessKind.CLOSURE
                    ? FieldAccessKind.INSTANCE : node.getKind();
            FieldAccessExpr callee = new FieldAccessExpr(loc, fnType, receiver, node.getField(), kind);
            LumenType returnType = fnType.getReturnType();
            CallExpr call = new CallExpr(loc, returnType, callee, args);
            TypedNode bodyStmt = Types.isVoid(returnType) ? call : new ReturnStmt(loc, call);
            TypedNode body = new BlockExpr(loc, VoidType.INSTANCE, Collections.singletonList(bodyStmt));
            return new FunctionExpr(loc, params, returnType, body);
        }

        @Override
        public TypedNode visitArrayIndex(ArrayIndexExpr node, List<TypedNode> out) {
            List<TypedNode> ops = valueList(listOf(node.getTarget(), node.getIndex()), out);
            return new ArrayIndexExpr(node.getLocation(), node.getType(), ops.get(0), ops.get(1));
        }

        @Override
        public TypedNode visitParen(ParenExpr node, List<TypedNode> out) {
            TypedNode inner = value(node.getInner(), out);
            if (inner instanceof LocalRefExpr || inner instanceof ConstantExpr) return inner;
            return inner == node.getInner() ? node : new ParenExpr(node.getLocation(), inner);
        }

        @Override
        public TypedNode visitObjectLiteral(ObjectLiteralExpr node, List<TypedNode> out) {
            return node.withValues(valueList(node.getValues(), out));
        }

        @Override
        public TypedNode visitArrayLiteral(ArrayLiteralExpr node, List<TypedNode> out) {
            return new ArrayLiteralExpr(node.getLocation(), node.getType(), valueList(node.getElements(), out));
        }

        @Override
        public TypedNode visitCall(CallExpr node, List<TypedNode> out) {
            TypedNode callee = node.getCallee();
            if ("__lua__".equals(node.getIntrinsicName())) {
                return node;
            }
            if (callee instanceof IdentExpr || callee instanceof ConstantExpr) {
                return new CallExpr(node.getLocation(), node.getType(), callee, valueList(node.getArgs(), out));
            }
            if (callee instanceof FieldAccessExpr) {
                FieldAccessExpr fa = (FieldAccessExpr) callee;
                if (fa.getOwnerPath() != null) {
                    return new CallExpr(node.getLocation(), node.getType(), fa, valueList(node.getArgs(), out));
                }
                List<TypedNode> ops = new ArrayList<>(node.getArgs().size() + 1);
                ops.add(fa.getTarget());
                ops.addAll(node.getArgs());
                List<TypedNode> norm = valueList(ops, out);
                return new CallExpr(node.getLocation(), node.getType(), fa.withTarget(norm.get(0)),
                        new ArrayList<>(norm.subList(1, norm.size())));
            }
            List<TypedNode> ops = new ArrayList<>(node.getArgs().size() + 1);
            ops.add(callee);
            ops.addAll(node.getArgs());
            List<TypedNode> norm = valueList(ops, out);
            return new CallExpr(node.getLocation(), node.getType(), norm.get(0),
                    new ArrayList<>(norm.subList(1, norm.size())));
        }

        @Override
        public TypedNode visitNew(NewExpr node, List<TypedNode> out) {
            return new NewExpr(node.getLocation(), node.getType(), node.getClassPath(),
                    valueList(node.getArgs(), out));
        }

        @Override
        public TypedNode visitBinary(BinaryExpr node, List<TypedNode> out) {
            switch (node.getOperator()) {
                case ASSIGN: {
                    TypedNode lv = stabilize(node.getLeft(), out);
                    TypedNode rhs = value(node.getRight(), out);
                    out.add(BinaryExpr.assign(node.getLocation(), lv, rhs));
                    return lv;
                }
                case ASSIGN_OP: {
                    TypedNode lv = stabilize(node.getLeft(), out);
                    TypedNode rhs = value(node.getRight(), out);
                    out.add(BinaryExpr.assignOp(node.getLocation(), node.getCompoundOp(), lv, rhs));
                    return lv;
                }
                case NULL_COALESCE:
                    return nullCoalesce(node, out);
                case AND:
                case OR:
                    return shortCircuit(node, out);
                default: {
                    List<TypedNode> ops = valueList(listOf(node.getLeft(), node.getRight()), out);
                    return node.withOperands(ops.get(0), ops.get(1));
                }
            }
        }

        private TypedNode nullCoalesce(BinaryExpr node, List<TypedNode> out) {
            SourceLocation loc = node.getLocation();
            LocalVar t = temps.fresh(node.getType());
            out.add(new VarDeclStmt(loc, t, value(node.getLeft(), out)));
            TypedNode isNull = new BinaryExpr(loc, Types.BOOL, BinaryExpr.BinaryOp.EQ,
                    ref(loc, t), nullValue(loc));
            List<TypedNode> fallback = sequence(Collections.singletonList(node.getRight()), ref(loc, t));
            out.add(new IfExpr(loc, VoidType.INSTANCE, isNull,
                    new BlockExpr(loc, VoidType.INSTANCE, fallback), null));
            return ref(loc, t);
        }

        private TypedNode shortCircuit(BinaryExpr node, List<TypedNode> out) {
            SourceLocation loc = node.getLocation();
            TypedNode left = value(node.getLeft(), out);
            List<TypedNode> pre = new ArrayList<>();
            TypedNode right = value(node.getRight(), pre);
            if (pre.isEmpty()) {
                return node.withOperands(left, right);
            }
            // 右侧有前置语句：只在需要时执行，保持短路语义
            LocalVar t = temps.fresh(node.getType());
            out.add(new VarDeclStmt(loc, t, left));
            TypedNode cond = node.getOperator() == BinaryExpr.BinaryOp.AND
                    ? ref(loc, t)
                    : new UnaryExpr(loc, Types.BOOL, UnaryExpr.UnaryOp.NOT, ref(loc, t), false);
            pre.add(assign(ref(loc, t), right));
            out.add(new IfExpr(loc, VoidType.INSTANCE, cond, new BlockExpr(loc, VoidType.INSTANCE, pre), null));
            return ref(loc, t);
        }

        @Override
        public TypedNode visitUnary(UnaryExpr node, List<TypedNode> out) {
            if (!node.isMutation()) {
                return node.withOperand(value(node.getOperand(), out));
            }
            TypedNode lv = stabilize(node.getOperand(), out);
            if (node.isPrefix()) {
                out.add(increment(node, lv));
                return lv;
            }
            LocalVar old = temps.fresh(node.getOperand().getType());
            out.add(new VarDeclStmt(node.getLocation(), old, lv));
            out.add(increment(node, lv));
            return ref(node.getLocation(), old);
        }

        @Override
        public TypedNode visitFunction(FunctionExpr node, List<TypedNode> out) {
            return function(node);
        }

        @Override
        public TypedNode visitCast(CastExpr node, List<TypedNode> out) {
            TypedNode inner = value(node.getInner(), out);
            if (inner == node.getInner()) return node;
            return new CastExpr(node.getLocation(), node.getType(), inner, node.getTargetPath());
        }

        @Override
        public TypedNode visitMeta(MetaExpr node, List<TypedNode> out) {
            TypedNode inner = value(node.getInner(), out);
            if (inner == node.getInner()) return node;
            return new MetaExpr(node.getLocation(), node.getName(), inner);
        }

        @Override
        public TypedNode visitEnumParameter(EnumParameterExpr node, List<TypedNode> out) {
            TypedNode target = value(node.getTarget(), out);
            if (target == node.getTarget()) return node;
            return new EnumParameterExpr(node.getLocation(), node.getType(), target,
                    node.getConstructor(), node.getIndex());
        }

        @Override
        public TypedNode visitEnumIndex(EnumIndexExpr node, List<TypedNode> out) {
            TypedNode target = value(node.getTarget(), out);
            if (target == node.getTarget()) return node;
            return new EnumIndexExpr(node.getLocation(), target);
        }

        // ----- 块状表达式：声明临时变量，以它为赋值目标规范化 -----

        private TypedNode viaTemp(TypedNode node, List<TypedNode> out) {
            SourceLocation loc = node.getLocation();
            LocalVar t = temps.fresh(node.getType());
            out.add(new VarDeclStmt(loc, t, null));
            statement(node, ref(loc, t), out);
            return ref(loc, t);
        }

        @Override
        public TypedNode visitBlock(BlockExpr node, List<TypedNode> out) {
            return viaTemp(node, out);
        }

        @Override
        public TypedNode visitIf(IfExpr node, List<TypedNode> out) {
            return viaTemp(node, out);
        }

        @Override
        public TypedNode visitSwitch(SwitchExpr node, List<TypedNode> out) {
            return viaTemp(node, out);
        }

        @Override
        public TypedNode visitTry(TryExpr node, List<TypedNode> out) {
            return viaTemp(node, out);
        }

        // ----- 不产生值的语句：提升为语句，值为 null -----

        private TypedNode hoisted(TypedNode node, List<TypedNode> out) {
            statement(node, null, out);
            return nullValue(node.getLocation());
        }

        @Override
        public TypedNode visitVarDecl(VarDeclStmt node, List<TypedNode> out) {
            return hoisted(node, out);
        }

        @Override
        public TypedNode visitFor(ForStmt node, List<TypedNode> out) {
            return hoisted(node, out);
        }

        @Override
        public TypedNode visitWhile(WhileStmt node, List<TypedNode> out) {
            return hoisted(WhileConditionHoisting.preprocess(node, temps), out);
        }

        @Override
        public TypedNode visitReturn(ReturnStmt node, List<TypedNode> out) {
            return hoisted(node, out);
        }

        @Override
        public TypedNode visitBreak(BreakStmt node, List<TypedNode> out) {
            return hoisted(node, out);
        }

        @Override
        public TypedNode visitContinue(ContinueStmt node, List<TypedNode> out) {
            return hoisted(node, out);
        }

        @Override
        public TypedNode visitThrow(ThrowStmt node, List<TypedNode> out) {
            return hoisted(node, out);
        }
    }
}
