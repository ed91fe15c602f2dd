package com.lumenlang.ir.hook;

import com.lumenlang.compiler.ast.decl.DeclarationKind;

/**
 * 钩子挂载点：每种顶层声明一个，外加单个表达式。
 */
public enum HookKind {
    CLASS,
    ENUM,
    TYPEDEF,
    ABSTRACT,
    EXPRESSION;

    public static HookKind forDeclaration(DeclarationKind kind) {
        switch (kind) {
            case CLASS: return CLASS;
            case ENUM: return ENUM;
            case TYPEDEF: return TYPEDEF;
            case ABSTRACT: return ABSTRACT;
            default: throw new IllegalArgumentException("Unknown declaration kind: " + kind);
        }
    }
}
