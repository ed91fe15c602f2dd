package com.lumenlang.ir;

import com.lumenlang.compiler.analysis.NullabilityChecker;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodes;
import com.lumenlang.compiler.ast.decl.CompilationUnit;
import com.lumenlang.compiler.ast.decl.Declaration;
import com.lumenlang.compiler.ast.expr.BinaryExpr;
import com.lumenlang.compiler.ast.expr.UnaryExpr;
import com.lumenlang.compiler.diagnostics.Diagnostic;
import com.lumenlang.compiler.diagnostics.DiagnosticCollector;
import com.lumenlang.compiler.types.NullabilityResolver;
import com.lumenlang.ir.backend.EmissionContext;
import com.lumenlang.ir.backend.EmitConfig;
import com.lumenlang.ir.backend.LuaPrinter;
import com.lumenlang.ir.backend.UnsupportedConstructException;
import com.lumenlang.ir.hook.HookKind;
import com.lumenlang.ir.hook.HookRegistry;
import com.lumenlang.ir.pass.PassContext;
import com.lumenlang.ir.pass.PassPipeline;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lua 后端门面。
 * 管线：类型化声明 → null 安全检查 → 体变换（折叠、规范化）→ Lua 文本 → 钩子。
 * <p>
 * 单个声明中的不支持构造或内部错误只使该声明失败，不影响其余声明。
 */
public class LumenLuaCompiler implements CompilerHandle {

    private static final Logger LOG = Logger.getLogger(LumenLuaCompiler.class.getName());

    private final EmitConfig config;
    private final PassPipeline pipeline;
    private final HookRegistry hooks = new HookRegistry();
    private final LuaPrinter printer = new LuaPrinter();
    private NullabilityResolver nullability = NullabilityResolver.DEFAULT;

    public LumenLuaCompiler() {
        this(new EmitConfig());
    }

    public LumenLuaCompiler(EmitConfig config) {
        this(config, PassPipeline.createDefault());
    }

    public LumenLuaCompiler(EmitConfig config, PassPipeline pipeline) {
        this.config = config != null ? config : new EmitConfig();
        this.pipeline = pipeline;
    }

    @Override
    public EmitConfig getConfig() {
        return config;
    }

    public PassPipeline getPipeline() {
        return pipeline;
    }

    public HookRegistry getHooks() {
        return hooks;
    }

    public void setNullabilityResolver(NullabilityResolver nullability) {
        this.nullability = nullability != null ? nullability : NullabilityResolver.DEFAULT;
    }

    /**
     * 编译一组声明。编译期间钩子注册表被冻结。
     */
    public CompilationResult compile(CompilationUnit unit) {
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        CompilationResult result = new CompilationResult(diagnostics);
        boolean wasFrozen = hooks.isFrozen();
        hooks.freeze();
        try {
            for (Declaration decl : unit.getDeclarations()) {
                compileDeclaration(decl, diagnostics, result);
            }
        } finally {
            if (!wasFrozen) hooks.unfreeze();
        }
        LOG.fine("编译完成 " + unit.getName() + ": " + result.getOutputs().size() + " 个声明, "
                + result.getFailedDeclarations().size() + " 个失败");
        return result;
    }

    private void compileDeclaration(Declaration decl, DiagnosticCollector diagnostics, CompilationResult result) {
        new NullabilityChecker(nullability, diagnostics).checkDeclaration(decl);
        PassContext passContext = new PassContext(config, nullability, diagnostics);
        try {
            String text = printer.printDeclaration(decl, config, body -> pipeline.run(body, passContext));
            text = hooks.run(HookKind.forDeclaration(decl.getKind()), text, this, decl);
            result.addOutput(decl, text);
            LOG.fine("已输出 " + decl);
        } catch (UnsupportedConstructException e) {
            LOG.log(Level.WARNING, "跳过声明 " + decl + ": " + e.getMessage());
            diagnostics.error(Diagnostic.UNSUPPORTED_CONSTRUCT, e.getMessage(), e.getLocation());
            result.addFailure(decl);
        } catch (InternalInvariantException e) {
            LOG.log(Level.WARNING, "输出声明时发生内部错误 " + decl, e);
            diagnostics.error(Diagnostic.INTERNAL_ERROR, e.getMessage(), e.getLocation());
            result.addFailure(decl);
        }
    }

    /**
     * 输出单个体并运行表达式钩子。值表达式输出为表达式，其余输出为语句序列。
     */
    public String compileExpression(TypedNode node) {
        String text = render(node);
        return hooks.runExpression(text, this, node);
    }

    @Override
    public String printExpression(TypedNode node) {
        return render(node);
    }

    private String render(TypedNode node) {
        PassContext passContext = new PassContext(config, nullability, new DiagnosticCollector());
        TypedNode lowered = pipeline.run(node, passContext);
        EmissionContext ctx = new EmissionContext(config);
        if (lowered == null) return "";
        if (isValueForm(lowered)) {
            return printer.printExpression(lowered, ctx);
        }
        return printer.printStatements(lowered, ctx);
    }

    private static boolean isValueForm(TypedNode node) {
        if (TypedNodes.isBlockLike(node) || TypedNodes.isStatement(node)) return false;
        if (node instanceof BinaryExpr) return !((BinaryExpr) node).isAssignment();
        if (node instanceof UnaryExpr) return !((UnaryExpr) node).isMutation();
        return true;
    }
}
