package com.lumenlang.compiler.diagnostics;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.lumenlang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 诊断收集器。只追加，不丢弃；是否中止编译由调用方决定。
 */
public class DiagnosticCollector {

    private static final int SEVERITY_ERROR = 1;
    private static final int SEVERITY_WARNING = 2;
    private static final int SEVERITY_INFORMATION = 3;
    private static final int SEVERITY_HINT = 4;

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void error(String code, String message, SourceLocation location) {
        report(Diagnostic.error(code, message, location));
    }

    public void warning(String code, String message, SourceLocation location) {
        report(new Diagnostic(Diagnostic.Severity.WARNING, code, message, location));
    }

    public void addAll(DiagnosticCollector other) {
        diagnostics.addAll(other.diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public boolean hasErrors() {
        for (Diagnostic d : diagnostics) {
            if (d.isError()) return true;
        }
        return false;
    }

    public int size() {
        return diagnostics.size();
    }

    /**
     * 转为 LSP publishDiagnostics 格式（行列从 0 开始）。
     */
    public JsonArray toJson() {
        JsonArray result = new JsonArray();
        for (Diagnostic d : diagnostics) {
            JsonObject diag = new JsonObject();
            SourceLocation loc = d.getLocation();
            int line = loc.getLine() > 0 ? loc.getLine() - 1 : 0;
            int col = loc.getColumn() > 0 ? loc.getColumn() - 1 : 0;
            diag.add("range", createRange(line, col, line, col + 1));
            int severity;
            switch (d.getSeverity()) {
                case ERROR: severity = SEVERITY_ERROR; break;
                case WARNING: severity = SEVERITY_WARNING; break;
                case INFO: severity = SEVERITY_INFORMATION; break;
                case HINT: severity = SEVERITY_HINT; break;
                default: severity = SEVERITY_ERROR;
            }
            diag.addProperty("severity", severity);
            diag.addProperty("source", "lumen");
            diag.addProperty("code", d.getCode());
            diag.addProperty("message", d.getMessage());
            if (loc.getFile() != null) {
                diag.addProperty("file", loc.getFile());
            }
            result.add(diag);
        }
        return result;
    }

    private static JsonObject createRange(int startLine, int startCol, int endLine, int endCol) {
        JsonObject range = new JsonObject();
        range.add("start", createPosition(startLine, startCol));
        range.add("end", createPosition(endLine, endCol));
        return range;
    }

    private static JsonObject createPosition(int line, int character) {
        JsonObject pos = new JsonObject();
        pos.addProperty("line", line);
        pos.addProperty("character", character);
        return pos;
    }
}
