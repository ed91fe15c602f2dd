package com.lumenlang.ir.backend;

import com.lumenlang.compiler.ast.TypePath;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * 代码生成上下文：输出缓冲、缩进层级，以及当前声明的状态
 * （所在类、父类、是否在构造函数内、是否有 self、标签计数、循环与 pcall 嵌套）。
 * 每次声明生成新建一个，不跨声明共享。
 */
public class EmissionContext {
    private final StringBuilder output = new StringBuilder();
    private final EmitConfig config;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    private TypePath currentClass;
    private TypePath superClass;
    private boolean inConstructor;
    private boolean instanceContext;
    private int labelCounter = 0;
    /** 当前语句是否是所在 Lua 块的最后一条（决定 return 是否需要 do ... end 包裹） */
    private boolean tailPosition;
    private final Deque<ControlFrame> frames = new ArrayDeque<>();

    public EmissionContext(EmitConfig config) {
        this.config = config != null ? config : new EmitConfig();
    }

    public EmitConfig getConfig() {
        return config;
    }

    // ==================== 输出 ====================

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            output.append(indentString());
            atLineStart = false;
        }
        output.append(text);
    }

    /**
     * 换行
     */
    public void newLine() {
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 追加一整行
     */
    public void line(String text) {
        append(text);
        newLine();
    }

    public String getOutput() {
        return output.toString();
    }

    private String indentString() {
        String unit = config.getIndentString();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(unit);
        }
        return sb.toString();
    }

    // ==================== 名字 ====================

    /**
     * 类型在生成代码中的全局名：命名空间前缀 + 下划线连接的路径。
     */
    public String typeName(TypePath path) {
        return config.getNamespacePrefix() + path.toIdentifier();
    }

    // ==================== 声明状态 ====================

    public TypePath getCurrentClass() {
        return currentClass;
    }

    public void setCurrentClass(TypePath currentClass) {
        this.currentClass = currentClass;
    }

    public TypePath getSuperClass() {
        return superClass;
    }

    public void setSuperClass(TypePath superClass) {
        this.superClass = superClass;
    }

    public boolean isInConstructor() {
        return inConstructor;
    }

    public void setInConstructor(boolean inConstructor) {
        this.inConstructor = inConstructor;
    }

    /**
     * 当前函数是否有 self 可用（实例方法与构造函数体）。
     */
    public boolean isInstanceContext() {
        return instanceContext;
    }

    public void setInstanceContext(boolean instanceContext) {
        this.instanceContext = instanceContext;
    }

    public boolean isTailPosition() {
        return tailPosition;
    }

    public void setTailPosition(boolean tailPosition) {
        this.tailPosition = tailPosition;
    }

    public int nextLabel() {
        return labelCounter++;
    }

    // ==================== 控制结构嵌套 ====================

    public void pushFrame(ControlFrame frame) {
        frames.push(frame);
    }

    public void popFrame() {
        frames.pop();
    }

    /**
     * 从内向外遍历控制结构栈。
     */
    public Iterator<ControlFrame> frames() {
        return frames.iterator();
    }
}
