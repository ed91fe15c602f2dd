package com.lumenlang.ir.backend;

/**
 * 控制结构栈的一层：循环、pcall 包装的 try 体，或函数边界。
 */
public final class ControlFrame {

    public enum Kind {
        LOOP, PROTECTED_CALL, FUNCTION
    }

    private final Kind kind;
    /** 循环的 continue 标签，体内没有 continue 时为 null */
    private final String continueLabel;

    private ControlFrame(Kind kind, String continueLabel) {
        this.kind = kind;
        this.continueLabel = continueLabel;
    }

    public static ControlFrame loop(String continueLabel) {
        return new ControlFrame(Kind.LOOP, continueLabel);
    }

    public static ControlFrame protectedCall() {
        return new ControlFrame(Kind.PROTECTED_CALL, null);
    }

    public static ControlFrame function() {
        return new ControlFrame(Kind.FUNCTION, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getContinueLabel() {
        return continueLabel;
    }
}
