package com.lumenlang.compiler.ast.decl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次编译交给后端的声明序列，保持前端给出的顺序。
 */
public final class CompilationUnit {

    private final String name;
    private final List<Declaration> declarations;

    public CompilationUnit(String name, List<Declaration> declarations) {
        this.name = name;
        this.declarations = Collections.unmodifiableList(new ArrayList<>(declarations));
    }

    public String getName() {
        return name;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }
}
