package com.lumenlang.ir.backend;

import com.lumenlang.compiler.ast.TypedNode;

/**
 * 声明输出前对每个体（方法、构造函数、字段初始化语句）执行的变换，通常是 pass 管线。
 */
@FunctionalInterface
public interface BodyLowering {

    TypedNode lower(TypedNode body);

    /** 不做变换 */
    BodyLowering IDENTITY = body -> body;
}
