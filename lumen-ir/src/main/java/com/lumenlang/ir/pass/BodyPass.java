package com.lumenlang.ir.pass;

import com.lumenlang.compiler.ast.TypedNode;

/**
 * 作用于单个表达式体（方法体、字段初始化）的 pass 接口。
 */
public interface BodyPass {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 变换一个体，返回新树；输入树不被修改。
     */
    TypedNode run(TypedNode body, PassContext context);
}
