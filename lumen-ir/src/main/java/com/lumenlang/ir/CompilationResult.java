package com.lumenlang.ir;

import com.lumenlang.compiler.ast.decl.Declaration;
import com.lumenlang.compiler.diagnostics.DiagnosticCollector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次编译的结果：按输入顺序排列的声明输出、诊断以及失败的声明。
 */
public final class CompilationResult {

    private final Map<Declaration, String> outputs = new LinkedHashMap<>();
    private final List<Declaration> failed = new ArrayList<>();
    private final DiagnosticCollector diagnostics;

    CompilationResult(DiagnosticCollector diagnostics) {
        this.diagnostics = diagnostics;
    }

    void addOutput(Declaration decl, String text) {
        outputs.put(decl, text);
    }

    void addFailure(Declaration decl) {
        failed.add(decl);
    }

    public Map<Declaration, String> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    public String getOutput(Declaration decl) {
        return outputs.get(decl);
    }

    public List<Declaration> getFailedDeclarations() {
        return Collections.unmodifiableList(failed);
    }

    public DiagnosticCollector getDiagnostics() {
        return diagnostics;
    }

    public boolean isSuccess() {
        return failed.isEmpty() && !diagnostics.hasErrors();
    }

    /**
     * 按声明顺序拼接所有成功输出。
     */
    public String getText() {
        StringBuilder sb = new StringBuilder();
        for (String text : outputs.values()) {
            sb.append(text);
        }
        return sb.toString();
    }
}
