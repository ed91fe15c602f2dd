package com.lumenlang.ir.pass;

import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.ir.normalize.NormalizedFormVerifier;
import com.lumenlang.ir.normalize.Normalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 体变换管线：按注册顺序依次执行各 pass，最后（按配置）校验规范化形式。
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<BodyPass> passes = new ArrayList<>();

    public PassPipeline() {
    }

    /**
     * 创建默认管线：null 比较折叠 → 规范化。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addPass(new NullComparisonFolding());
        pipeline.addPass(new Normalizer());
        return pipeline;
    }

    public void addPass(BodyPass pass) {
        passes.add(pass);
    }

    public List<BodyPass> getPasses() {
        return Collections.unmodifiableList(passes);
    }

    /**
     * 对一个体执行全部 pass。
     */
    public TypedNode run(TypedNode body, PassContext context) {
        if (body == null) return null;
        boolean fold = context.getConfig() == null || context.getConfig().isFoldNullComparisons();
        TypedNode result = body;
        boolean normalized = false;
        for (BodyPass pass : passes) {
            if (!fold && pass instanceof NullComparisonFolding) continue;
            if (LOG.isLoggable(Level.FINEST)) {
                LOG.finest("执行 " + pass.getName() + ": " + body.getTag() + " " + body.getLocation());
            }
            result = pass.run(result, context);
            if (pass instanceof Normalizer) normalized = true;
        }
        if (normalized && (context.getConfig() == null || context.getConfig().isVerifyNormalizedForm())) {
            NormalizedFormVerifier.verify(result);
        }
        return result;
    }
}
