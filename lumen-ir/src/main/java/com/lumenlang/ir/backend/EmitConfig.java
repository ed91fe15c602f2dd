package com.lumenlang.ir.backend;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Lua 代码生成配置
 */
public class EmitConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;
    /** 顶层类型名前缀，如 "pkg_" */
    private String namespacePrefix = "";
    private boolean verifyNormalizedForm = true;
    private boolean foldNullComparisons = true;

    public EmitConfig() {
    }

    /**
     * 从 JSON 读取配置，缺省字段保持默认值。
     *
     * @throws IllegalArgumentException JSON 格式错误
     */
    public static EmitConfig fromJson(String json) {
        try {
            EmitConfig config = new Gson().fromJson(json, EmitConfig.class);
            if (config == null) return new EmitConfig();
            if (config.namespacePrefix == null) config.namespacePrefix = "";
            if (config.indentSize < 0) {
                throw new IllegalArgumentException("indentSize must not be negative: " + config.indentSize);
            }
            return config;
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid emit config: " + e.getMessage(), e);
        }
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    public String getNamespacePrefix() {
        return namespacePrefix;
    }

    public void setNamespacePrefix(String namespacePrefix) {
        this.namespacePrefix = namespacePrefix != null ? namespacePrefix : "";
    }

    public boolean isVerifyNormalizedForm() {
        return verifyNormalizedForm;
    }

    public void setVerifyNormalizedForm(boolean verifyNormalizedForm) {
        this.verifyNormalizedForm = verifyNormalizedForm;
    }

    public boolean isFoldNullComparisons() {
        return foldNullComparisons;
    }

    public void setFoldNullComparisons(boolean foldNullComparisons) {
        this.foldNullComparisons = foldNullComparisons;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (useSpaces) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < indentSize; i++) {
                sb.append(' ');
            }
            return sb.toString();
        } else {
            return "\t";
        }
    }
}
