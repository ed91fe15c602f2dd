package com.lumenlang.compiler.ast.decl;

/**
 * 顶层声明种类。
 */
public enum DeclarationKind {
    CLASS,
    ENUM,
    TYPEDEF,
    ABSTRACT
}
