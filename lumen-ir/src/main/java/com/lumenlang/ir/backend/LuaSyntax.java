package com.lumenlang.ir.backend;

import com.lumenlang.compiler.ast.LocalVar;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Lua 词法层面的工具：关键字、标识符合法性、字符串与数字字面量。
 */
public final class LuaSyntax {

    private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
            "and", "break", "do", "else", "elseif", "end", "false", "for", "function",
            "goto", "if", "in", "local", "nil", "not", "or", "repeat", "return",
            "then", "true", "until", "while"));

    private static final String GENERATED_PREFIX = "_hx_";
    private static final String USER_ESCAPE = "_hx_u";

    private LuaSyntax() {
    }

    public static boolean isKeyword(String name) {
        return KEYWORDS.contains(name);
    }

    /**
     * 是否可直接用作 Lua 名字（且不是关键字）。
     */
    public static boolean isIdentifier(String name) {
        if (name == null || name.isEmpty() || isKeyword(name)) return false;
        char c0 = name.charAt(0);
        if (!(Character.isLetter(c0) && c0 < 128) && c0 != '_') return false;
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c >= 128 || !(Character.isLetterOrDigit(c) || c == '_')) return false;
        }
        return true;
    }

    /**
     * 局部变量在 Lua 中的名字。
     * <p>
     * {@code _hx_} 前缀留给生成的名字：关键字写成 {@code _hx_<kw>}；
     * 本身以 {@code _hx_} 开头的用户名字与 {@code self} 写成 {@code _hx_u<name>}，
     * 生成的名字都不以 {@code _hx_u} 开头。临时变量的名字原样使用。
     */
    public static String localName(LocalVar var) {
        String name = var.getName();
        if (var.isTemp()) return name;
        if (isKeyword(name)) return GENERATED_PREFIX + name;
        if (name.startsWith(GENERATED_PREFIX) || "self".equals(name)) return USER_ESCAPE + name;
        return name;
    }

    /**
     * 字段访问后缀：合法名字用 ".f"，否则用 "[\"f\"]"。
     */
    public static String fieldSuffix(String name) {
        return isIdentifier(name) ? "." + name : "[" + quote(name) + "]";
    }

    /**
     * 表构造器中的键：合法名字原样，否则 ["k"]。
     */
    public static String tableKey(String name) {
        return isIdentifier(name) ? name : "[" + quote(name) + "]";
    }

    /**
     * 双引号字符串字面量。
     */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\0':
                    // 后随数字时 \0 会被并入十进制转义
                    boolean digitFollows = i + 1 < s.length() && Character.isDigit(s.charAt(i + 1));
                    sb.append(digitFollows ? "\\000" : "\\0");
                    break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\%03d", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
        return sb.toString();
    }

    public static String floatLiteral(double value) {
        if (Double.isNaN(value)) return "(0/0)";
        if (Double.isInfinite(value)) return value > 0 ? "math.huge" : "-math.huge";
        return Double.toString(value);
    }
}
