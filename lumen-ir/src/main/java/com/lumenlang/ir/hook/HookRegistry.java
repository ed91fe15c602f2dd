package com.lumenlang.ir.hook;

import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.decl.Declaration;
import com.lumenlang.ir.CompilerHandle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 按挂载点保存有序钩子链，执行时从左到右折叠输出文本。
 * <p>
 * 编译期间注册表被冻结，此时注册会抛出 {@link IllegalStateException}。
 */
public class HookRegistry {

    private final Map<HookKind, List<DeclarationHook>> declarationHooks = new EnumMap<>(HookKind.class);
    private final List<ExpressionHook> expressionHooks = new ArrayList<>();
    private boolean frozen;

    /**
     * 在 kind 的钩子链末尾追加一个声明钩子。
     */
    public void register(HookKind kind, DeclarationHook hook) {
        if (kind == HookKind.EXPRESSION) {
            throw new IllegalArgumentException("Use registerExpressionHook for expression hooks");
        }
        checkNotFrozen();
        declarationHooks.computeIfAbsent(kind, k -> new ArrayList<>()).add(hook);
    }

    public void registerExpressionHook(ExpressionHook hook) {
        checkNotFrozen();
        expressionHooks.add(hook);
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Hooks cannot be registered while a compilation is running");
        }
    }

    public void freeze() {
        frozen = true;
    }

    public void unfreeze() {
        frozen = false;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public List<DeclarationHook> getHooks(HookKind kind) {
        List<DeclarationHook> hooks = declarationHooks.get(kind);
        return hooks != null ? Collections.unmodifiableList(hooks) : Collections.<DeclarationHook>emptyList();
    }

    /**
     * 依次执行 kind 的钩子：每个钩子的输入是前一个的输出；没有钩子时原样返回。
     */
    public String run(HookKind kind, String text, CompilerHandle compiler, Declaration declaration) {
        String result = text;
        for (DeclarationHook hook : getHooks(kind)) {
            result = hook.apply(result, compiler, declaration);
        }
        return result;
    }

    public String runExpression(String text, CompilerHandle compiler, TypedNode node) {
        String result = text;
        for (ExpressionHook hook : expressionHooks) {
            result = hook.apply(result, compiler, node);
        }
        return result;
    }
}
