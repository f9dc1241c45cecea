package com.chih.JXcb.core.engine;

import com.chih.JXcb.core.domain.Diagnostic;

import java.util.List;
import java.util.Map;

/**
 * 渲染结果
 *
 * @param output      输出文本
 * @param diagnostics 编译期 + 渲染期的全部诊断
 * @param variables   渲染结束时根作用域中的变量
 */
public record RenderResult(String output, List<Diagnostic> diagnostics, Map<String, Object> variables) {

    public RenderResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
