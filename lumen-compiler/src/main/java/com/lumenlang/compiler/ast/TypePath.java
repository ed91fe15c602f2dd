package com.lumenlang.compiler.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 已解析的类型路径：包名片段 + 类型名。
 */
public final class TypePath {

    private final List<String> pack;
    private final String name;

    public TypePath(List<String> pack, String name) {
        this.pack = pack != null ? Collections.unmodifiableList(new ArrayList<>(pack))
                : Collections.<String>emptyList();
        this.name = name;
    }

    /**
     * 解析点分形式，例如 {@code "pkg.sub.Foo"}。
     */
    public static TypePath parse(String dotted) {
        int dot = dotted.lastIndexOf('.');
        if (dot < 0) return new TypePath(null, dotted);
        return new TypePath(Arrays.asList(dotted.substring(0, dot).split("\\.")), dotted.substring(dot + 1));
    }

    public List<String> getPack() {
        return pack;
    }

    public String getName() {
        return name;
    }

    /**
     * 目标代码中的全局标识符：包片段与类型名以下划线连接。
     */
    public String toIdentifier() {
        if (pack.isEmpty()) return name;
        StringBuilder sb = new StringBuilder();
        for (String p : pack) {
            sb.append(p).append('_');
        }
        return sb.append(name).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypePath)) return false;
        TypePath that = (TypePath) o;
        return pack.equals(that.pack) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return 31 * pack.hashCode() + name.hashCode();
    }

    @Override
    public String toString() {
        if (pack.isEmpty()) return name;
        return String.join(".", pack) + "." + name;
    }
}
