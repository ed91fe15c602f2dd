package com.lumenlang.compiler.ast;

/**
 * 源码位置信息，用于诊断。
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0);

    public SourceLocation(String file, int line, int column) {
        this.file = file != null ? file.intern() : null;
        this.line = line;
        this.column = column;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column
                && (file == null ? that.file == null : file.equals(that.file));
    }

    @Override
    public int hashCode() {
        int h = file != null ? file.hashCode() : 0;
        return 31 * (31 * h + line) + column;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
