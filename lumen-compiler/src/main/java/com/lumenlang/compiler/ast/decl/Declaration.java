package com.lumenlang.compiler.ast.decl;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypePath;

/**
 * 前端解析完毕的顶层声明。后端只读取，不修改、不注册新的声明。
 */
public abstract class Declaration {

    protected final SourceLocation location;
    protected final TypePath path;

    protected Declaration(SourceLocation location, TypePath path) {
        this.location = location != null ? location : SourceLocation.UNKNOWN;
        this.path = path;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public TypePath getPath() {
        return path;
    }

    public String getName() {
        return path.getName();
    }

    public abstract DeclarationKind getKind();

    public abstract <R, C> R accept(DeclarationVisitor<R, C> visitor, C context);

    @Override
    public String toString() {
        return getKind().name().toLowerCase() + " " + path;
    }
}
