package com.lumenlang.ir.normalize;

import com.lumenlang.compiler.analysis.TreeQueries;
import com.lumenlang.compiler.ast.LocalVar;
import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.expr.*;
import com.lumenlang.compiler.ast.stmt.BreakStmt;
import com.lumenlang.compiler.ast.stmt.VarDeclStmt;
import com.lumenlang.compiler.ast.stmt.WhileStmt;
import com.lumenlang.compiler.types.Types;
import com.lumenlang.compiler.types.VoidType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 条件需要前置语句的 while 循环改写为 while (true) + break 形式，
 * 使条件在每次迭代时重新求值（而不是被提到循环外只算一次）。
 */
final class WhileConditionHoisting {

    private WhileConditionHoisting() {
    }

    /**
     * 若 stmt 是条件需要提升的 while，返回改写后的节点，否则原样返回。
     */
    static TypedNode preprocess(TypedNode stmt, TempVarNameGenerator temps) {
        if (!(stmt instanceof WhileStmt)) return stmt;
        WhileStmt loop = (WhileStmt) stmt;
        if (!HoistingAnalysis.requiresHoisting(loop.getCondition())) return stmt;
        return rewrite(loop, temps);
    }

    static TypedNode rewrite(WhileStmt loop, TempVarNameGenerator temps) {
        SourceLocation loc = loop.getLocation();
        TypedNode exitTest = exitIfFalse(loop.getCondition());
        TypedNode body = loop.getBody();

        if (loop.isTestBefore()) {
            return new WhileStmt(loc, trueConstant(loc), block(loc, exitTest, body), true);
        }
        if (!TreeQueries.containsContinue(body)) {
            return new WhileStmt(loc, trueConstant(loc), block(loc, body, exitTest), true);
        }

        // do-while 体内有 continue：首轮跳过条件，其余轮次在体前测试
        LocalVar first = temps.fresh(Types.BOOL);
        LocalRefExpr firstRef = new LocalRefExpr(loc, first);
        TypedNode skipFirst = new IfExpr(loc, VoidType.INSTANCE,
                new UnaryExpr(loc, Types.BOOL, UnaryExpr.UnaryOp.NOT, firstRef, false),
                block(loc, exitTest), null);
        TypedNode clearFirst = BinaryExpr.assign(loc, firstRef, ConstantExpr.ofBool(loc, false));
        WhileStmt rewritten = new WhileStmt(loc, trueConstant(loc),
                block(loc, skipFirst, clearFirst, body), true);
        return block(loc, new VarDeclStmt(loc, first, ConstantExpr.ofBool(loc, true)), rewritten);
    }

    private static TypedNode exitIfFalse(TypedNode condition) {
        SourceLocation loc = condition.getLocation();
        TypedNode negated = new UnaryExpr(loc, Types.BOOL, UnaryExpr.UnaryOp.NOT,
                new ParenExpr(loc, condition), false);
        return new IfExpr(loc, VoidType.INSTANCE, negated,
                new BreakStmt(loc), null);
    }

    private static ConstantExpr trueConstant(SourceLocation loc) {
        return ConstantExpr.ofBool(loc, true);
    }

    private static BlockExpr block(SourceLocation loc, TypedNode... statements) {
        List<TypedNode> list = new ArrayList<>(Arrays.asList(statements));
        return new BlockExpr(loc, VoidType.INSTANCE, Collections.unmodifiableList(list));
    }
}
