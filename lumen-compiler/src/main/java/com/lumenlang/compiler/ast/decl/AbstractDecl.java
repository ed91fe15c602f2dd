package com.lumenlang.compiler.ast.decl;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypePath;
import com.lumenlang.compiler.types.LumenType;

/**
 * 抽象类型：底层类型 + 可选的实现类（静态方法集合）。
 */
public final class AbstractDecl extends Declaration {

    private final LumenType underlyingType;
    private final ClassDecl implementation;  // nullable

    public AbstractDecl(SourceLocation location, TypePath path, LumenType underlyingType,
                        ClassDecl implementation) {
        super(location, path);
        this.underlyingType = underlyingType;
        this.implementation = implementation;
    }

    public LumenType getUnderlyingType() {
        return underlyingType;
    }

    public ClassDecl getImplementation() {
        return implementation;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.ABSTRACT;
    }

    @Override
    public <R, C> R accept(DeclarationVisitor<R, C> visitor, C context) {
        return visitor.visitAbstract(this, context);
    }
}
