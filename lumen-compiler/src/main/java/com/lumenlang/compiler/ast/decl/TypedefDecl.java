package com.lumenlang.compiler.ast.decl;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypePath;
import com.lumenlang.compiler.types.LumenType;

/**
 * 类型别名，只在静态类型层面存在。
 */
public final class TypedefDecl extends Declaration {

    private final LumenType aliasedType;

    public TypedefDecl(SourceLocation location, TypePath path, LumenType aliasedType) {
        super(location, path);
        this.aliasedType = aliasedType;
    }

    public LumenType getAliasedType() {
        return aliasedType;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.TYPEDEF;
    }

    @Override
    public <R, C> R accept(DeclarationVisitor<R, C> visitor, C context) {
        return visitor.visitTypedef(this, context);
    }
}
