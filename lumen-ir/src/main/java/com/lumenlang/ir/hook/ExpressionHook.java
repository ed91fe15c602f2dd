package com.lumenlang.ir.hook;

import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.ir.CompilerHandle;

/**
 * 单个表达式输出后处理。
 */
@FunctionalInterface
public interface ExpressionHook {
    String apply(String priorText, CompilerHandle compiler, TypedNode node);
}
