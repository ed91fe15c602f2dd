package com.lumenlang.compiler.ast.decl;

/**
 * 顶层声明访问者。
 */
public interface DeclarationVisitor<R, C> {
    R visitClass(ClassDecl decl, C context);
    R visitEnum(EnumDecl decl, C context);
    R visitTypedef(TypedefDecl decl, C context);
    R visitAbstract(AbstractDecl decl, C context);
}
