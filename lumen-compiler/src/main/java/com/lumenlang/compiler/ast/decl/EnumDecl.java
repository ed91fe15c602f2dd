package com.lumenlang.compiler.ast.decl;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypePath;

import java.util.List;

/**
 * 枚举声明，构造器按序号排列。
 */
public final class EnumDecl extends Declaration {

    private final List<EnumConstructor> constructors;

    public EnumDecl(SourceLocation location, TypePath path, List<EnumConstructor> constructors) {
        super(location, path);
        this.constructors = constructors;
    }

    public List<EnumConstructor> getConstructors() {
        return constructors;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.ENUM;
    }

    @Override
    public <R, C> R accept(DeclarationVisitor<R, C> visitor, C context) {
        return visitor.visitEnum(this, context);
    }
}
