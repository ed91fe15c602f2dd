package com.lumenlang.compiler.ast.expr;

/**
 * 字段访问方式。
 */
public enum FieldAccessKind {
    /** 实例字段/方法 */
    INSTANCE,
    /** 静态成员，按所属类型路径限定 */
    STATIC,
    /** 匿名结构体字段 */
    ANONYMOUS,
    /** 按名字动态访问 */
    DYNAMIC,
    /** 绑定接收者的方法值（闭包） */
    CLOSURE,
    /** 枚举构造器 */
    ENUM_CONSTRUCTOR
}
