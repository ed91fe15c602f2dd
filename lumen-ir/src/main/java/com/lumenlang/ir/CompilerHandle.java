package com.lumenlang.ir;

import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.ir.backend.EmitConfig;

/**
 * 钩子可见的编译器能力。
 */
public interface CompilerHandle {

    EmitConfig getConfig();

    /**
     * 以当前配置输出单个表达式体（经过完整管线，不运行表达式钩子）。
     */
    String printExpression(TypedNode node);
}
