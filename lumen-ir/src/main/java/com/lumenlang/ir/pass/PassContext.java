package com.lumenlang.ir.pass;

import com.lumenlang.compiler.diagnostics.DiagnosticCollector;
import com.lumenlang.compiler.types.NullabilityResolver;
import com.lumenlang.ir.backend.EmitConfig;

/**
 * 一次声明编译期间各 pass 共享的只读环境。
 */
public final class PassContext {

    private final EmitConfig config;
    private final NullabilityResolver nullability;
    private final DiagnosticCollector diagnostics;

    public PassContext(EmitConfig config, NullabilityResolver nullability, DiagnosticCollector diagnostics) {
        this.config = config;
        this.nullability = nullability != null ? nullability : NullabilityResolver.DEFAULT;
        this.diagnostics = diagnostics;
    }

    public EmitConfig getConfig() {
        return config;
    }

    public NullabilityResolver getNullability() {
        return nullability;
    }

    public DiagnosticCollector getDiagnostics() {
        return diagnostics;
    }
}
