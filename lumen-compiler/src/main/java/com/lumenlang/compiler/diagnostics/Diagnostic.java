package com.lumenlang.compiler.diagnostics;

import com.lumenlang.compiler.ast.SourceLocation;

/**
 * 诊断条目
 */
public final class Diagnostic {

    public enum Severity {
        ERROR, WARNING, INFO, HINT
    }

    /** null 安全违规 */
    public static final String NULL_SAFETY = "null-safety";
    /** 目标语言没有对应形式的节点 */
    public static final String UNSUPPORTED_CONSTRUCT = "unsupported-construct";
    /** 后端内部不变量被破坏 */
    public static final String INTERNAL_ERROR = "internal-error";

    private final Severity severity;
    private final String code;
    private final String message;
    private final SourceLocation location;

    public Diagnostic(Severity severity, String code, String message, SourceLocation location) {
        this.severity = severity;
        this.code = code;
        this.message = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public static Diagnostic error(String code, String message, SourceLocation location) {
        return new Diagnostic(Severity.ERROR, code, message, location);
    }

    public Severity getSeverity() { return severity; }
    public String getCode() { return code; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return location + ": " + severity.name().toLowerCase() + ": " + message + " [" + code + "]";
    }
}
