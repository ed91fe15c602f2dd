package com.lumenlang.compiler.diagnostics;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.lumenlang.compiler.ast.SourceLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * 诊断收集器测试
 */
class DiagnosticCollectorTest {

    @Test
    @DisplayName("只追加，按报告顺序保留")
    void testKeepsOrder() {
        DiagnosticCollector collector = new DiagnosticCollector();
        collector.warning("w", "first", null);
        collector.error(Diagnostic.NULL_SAFETY, "second", new SourceLocation("A.lm", 2, 5));

        assertThat(collector.getDiagnostics()).extracting(Diagnostic::getMessage)
                .containsExactly("first", "second");
        assertThat(collector.hasErrors()).isTrue();
        assertThat(collector.getDiagnostics().get(0).getLocation()).isEqualTo(SourceLocation.UNKNOWN);
    }

    @Test
    @DisplayName("只有警告时没有错误")
    void testWarningsOnly() {
        DiagnosticCollector collector = new DiagnosticCollector();
        collector.warning("w", "careful", SourceLocation.UNKNOWN);
        assertThat(collector.hasErrors()).isFalse();
    }

    @Test
    @DisplayName("转为 LSP 格式，行列从 0 开始")
    void testToJson() {
        DiagnosticCollector collector = new DiagnosticCollector();
        collector.error(Diagnostic.UNSUPPORTED_CONSTRUCT, "no super", new SourceLocation("A.lm", 4, 9));

        JsonArray json = collector.toJson();
        assertThat(json.size()).isEqualTo(1);
        JsonObject diag = json.get(0).getAsJsonObject();
        JsonObject start = diag.getAsJsonObject("range").getAsJsonObject("start");
        assertThat(start.get("line").getAsInt()).isEqualTo(3);
        assertThat(start.get("character").getAsInt()).isEqualTo(8);
        assertThat(diag.get("severity").getAsInt()).isEqualTo(1);
        assertThat(diag.get("code").getAsString()).isEqualTo(Diagnostic.UNSUPPORTED_CONSTRUCT);
        assertThat(diag.get("source").getAsString()).isEqualTo("lumen");
        assertThat(diag.get("file").getAsString()).isEqualTo("A.lm");
    }

    @Test
    @DisplayName("合并另一个收集器")
    void testAddAll() {
        DiagnosticCollector a = new DiagnosticCollector();
        DiagnosticCollector b = new DiagnosticCollector();
        b.error("x", "boom", null);
        a.addAll(b);
        assertThat(a.size()).isEqualTo(1);
        assertThatThrownBy(() -> a.getDiagnostics().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
