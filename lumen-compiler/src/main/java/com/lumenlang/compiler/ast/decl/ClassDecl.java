package com.lumenlang.compiler.ast.decl;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypePath;

import java.util.Collections;
import java.util.List;

/**
 * 类或接口声明。extern 类由目标环境提供，不生成代码。
 */
public final class ClassDecl extends Declaration {

    private final TypePath superClass;      // nullable
    private final List<TypePath> interfaces;
    private final FieldDecl constructor;    // nullable
    private final List<FieldDecl> fields;
    private final List<FieldDecl> staticFields;
    private final boolean isInterface;
    private final boolean isExtern;

    public ClassDecl(SourceLocation location, TypePath path, TypePath superClass,
                     List<TypePath> interfaces, FieldDecl constructor,
                     List<FieldDecl> fields, List<FieldDecl> staticFields,
                     boolean isInterface, boolean isExtern) {
        super(location, path);
        this.superClass = superClass;
        this.interfaces = interfaces != null ? interfaces : Collections.<TypePath>emptyList();
        this.constructor = constructor;
        this.fields = fields != null ? fields : Collections.<FieldDecl>emptyList();
        this.staticFields = staticFields != null ? staticFields : Collections.<FieldDecl>emptyList();
        this.isInterface = isInterface;
        this.isExtern = isExtern;
    }

    public TypePath getSuperClass() {
        return superClass;
    }

    public boolean hasSuperClass() {
        return superClass != null;
    }

    public List<TypePath> getInterfaces() {
        return interfaces;
    }

    public FieldDecl getConstructor() {
        return constructor;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    public List<FieldDecl> getStaticFields() {
        return staticFields;
    }

    public boolean isInterface() {
        return isInterface;
    }

    public boolean isExtern() {
        return isExtern;
    }

    @Override
    public DeclarationKind getKind() {
        return DeclarationKind.CLASS;
    }

    @Override
    public <R, C> R accept(DeclarationVisitor<R, C> visitor, C context) {
        return visitor.visitClass(this, context);
    }
}
