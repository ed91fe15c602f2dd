package com.lumenlang.ir.hook;

import com.lumenlang.compiler.ast.decl.Declaration;
import com.lumenlang.ir.CompilerHandle;

/**
 * 声明输出后处理：接收上一个钩子（或打印器）的文本，返回新文本。
 */
@FunctionalInterface
public interface DeclarationHook {
    String apply(String priorText, CompilerHandle compiler, Declaration declaration);
}
