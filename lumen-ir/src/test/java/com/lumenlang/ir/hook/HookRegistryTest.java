package com.lumenlang.ir.hook;

import com.lumenlang.compiler.ast.TypePath;
import com.lumenlang.compiler.ast.decl.DeclarationKind;
import com.lumenlang.compiler.ast.decl.TypedefDecl;
import com.lumenlang.compiler.types.Types;
import org.junit.jupiter.api.Test;

import static com.lumenlang.ir.TypedTrees.LOC;
import static com.lumenlang.ir.TypedTrees.i;
import static org.junit.jupiter.api.Assertions.*;

class HookRegistryTest {

    private final TypedefDecl alias = new TypedefDecl(LOC, TypePath.parse("Alias"), Types.INT);

    @Test
    void testHooksFoldInRegistrationOrder() {
        HookRegistry hooks = new HookRegistry();
        hooks.register(HookKind.TYPEDEF, (text, compiler, decl) -> text + "a");
        hooks.register(HookKind.TYPEDEF, (text, compiler, decl) -> text + "b");
        hooks.register(HookKind.CLASS, (text, compiler, decl) -> text + "ignored");

        assertEquals("-ab", hooks.run(HookKind.TYPEDEF, "-", null, alias));
        assertEquals(2, hooks.getHooks(HookKind.TYPEDEF).size());
    }

    @Test
    void testNoHooksReturnsTextUnchanged() {
        HookRegistry hooks = new HookRegistry();
        assertEquals("x", hooks.run(HookKind.ENUM, "x", null, alias));
        assertEquals("y", hooks.runExpression("y", null, i(1)));
        assertTrue(hooks.getHooks(HookKind.ENUM).isEmpty());
    }

    @Test
    void testHookSeesDeclaration() {
        HookRegistry hooks = new HookRegistry();
        hooks.register(HookKind.TYPEDEF, (text, compiler, decl) -> "-- " + decl.getPath() + "\n" + text);
        assertEquals("-- Alias\n", hooks.run(HookKind.TYPEDEF, "", null, alias));
    }

    @Test
    void testExpressionHooks() {
        HookRegistry hooks = new HookRegistry();
        hooks.registerExpressionHook((text, compiler, node) -> "(" + text + ")");
        hooks.registerExpressionHook((text, compiler, node) -> text + " --[[" + node.getTag() + "]]");
        assertEquals("(1) --[[" + i(1).getTag() + "]]", hooks.runExpression("1", null, i(1)));
    }

    @Test
    void testExpressionKindRejectedForDeclarationHooks() {
        HookRegistry hooks = new HookRegistry();
        assertThrows(IllegalArgumentException.class,
                () -> hooks.register(HookKind.EXPRESSION, (text, compiler, decl) -> text));
    }

    @Test
    void testFrozenRegistryRejectsRegistration() {
        HookRegistry hooks = new HookRegistry();
        hooks.freeze();
        assertThrows(IllegalStateException.class,
                () -> hooks.register(HookKind.CLASS, (text, compiler, decl) -> text));
        assertThrows(IllegalStateException.class,
                () -> hooks.registerExpressionHook((text, compiler, node) -> text));
        hooks.unfreeze();
        hooks.register(HookKind.CLASS, (text, compiler, decl) -> text);
        assertEquals(1, hooks.getHooks(HookKind.CLASS).size());
    }

    @Test
    void testHookListIsReadOnly() {
        HookRegistry hooks = new HookRegistry();
        hooks.register(HookKind.ENUM, (text, compiler, decl) -> text);
        assertThrows(UnsupportedOperationException.class, () -> hooks.getHooks(HookKind.ENUM).clear());
    }

    @Test
    void testKindForDeclaration() {
        assertEquals(HookKind.CLASS, HookKind.forDeclaration(DeclarationKind.CLASS));
        assertEquals(HookKind.ABSTRACT, HookKind.forDeclaration(DeclarationKind.ABSTRACT));
    }
}
